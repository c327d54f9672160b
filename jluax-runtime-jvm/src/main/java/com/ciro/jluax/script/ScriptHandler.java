package com.ciro.jluax.script;

import com.ciro.jluax.HandlerResult;
import com.ciro.jluax.Request;

import java.util.Map;
import java.util.Optional;

@FunctionalInterface
public interface ScriptHandler {
    // Vacío si el handler devolvió nil (la petición sigue hacia los estáticos)
    Optional<HandlerResult> handle(Map<String, String> params, Request request);
}
