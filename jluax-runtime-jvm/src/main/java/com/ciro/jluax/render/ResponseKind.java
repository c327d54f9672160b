package com.ciro.jluax.render;

import com.ciro.jluax.Response;

import java.util.Locale;
import java.util.Map;

/** Cómo se serializa el payload de un handler. */
public enum ResponseKind {
    /** Documento completo: se antepone {@code <!DOCTYPE html>} */
    PAGE(Response.HTML),
    /** Trozo de HTML (respuestas parciales, htmx, etc.) */
    FRAGMENT(Response.HTML),
    JSON(Response.JSON),
    TEXT(Response.TEXT);

    private final String contentType;

    ResponseKind(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }

    /** @return el kind con ese nombre ("page", "json"...), o null si no existe */
    public static ResponseKind byName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Sin kind explícito: tabla con {@code tag} → página, otra tabla → JSON,
     * string → fragmento HTML, cualquier otra cosa → texto.
     */
    public static ResponseKind infer(Object payload) {
        if (payload instanceof Map<?, ?> map) return map.containsKey("tag") ? PAGE : JSON;
        if (payload instanceof Iterable<?>) return JSON;
        if (payload instanceof String) return FRAGMENT;
        return TEXT;
    }
}
