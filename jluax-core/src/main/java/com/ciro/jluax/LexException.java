package com.ciro.jluax;

/** Entrada mal formada a nivel de token (literal o expresión sin cerrar, UTF-8 inválido). */
public class LexException extends LuaxException {

    private final String reason;

    public LexException(String module, SourcePosition position, String reason) {
        super(module, position, reason);
        this.reason = reason;
    }

    public String getReason() { return reason; }
}
