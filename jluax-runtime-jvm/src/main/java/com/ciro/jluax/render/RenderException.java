package com.ciro.jluax.render;

/** Payload que no se puede convertir a HTML o JSON. */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
