package com.ciro.jluax.script;

import com.ciro.jluax.LuaxException;
import org.luaj.vm2.LuaError;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fallo al ejecutar Lua (error en runtime, sintaxis de un .lua, manifest mal formado).
 * Si el mensaje empieza con {@code chunk:línea} se extraen ambos.
 */
public class ScriptException extends RuntimeException {

    private static final Pattern LOCATION = Pattern.compile("^@?([^\\s:@]+):(\\d+)");

    private final String chunk;
    private final int line;

    public ScriptException(String message) {
        this(message, null);
    }

    public ScriptException(String message, Throwable cause) {
        super(message, cause);
        Matcher m = message == null ? null : LOCATION.matcher(message);
        if (m != null && m.find()) {
            this.chunk = m.group(1);
            this.line = Integer.parseInt(m.group(2));
        } else {
            this.chunk = null;
            this.line = -1;
        }
    }

    /**
     * Traduce un {@link LuaError}. Si el origen fue un error de compilación LuaX
     * (un require de un .luax roto) se devuelve ese error tal cual.
     */
    public static RuntimeException translate(LuaError e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof LuaxException lx) return lx;
            if (t.getCause() == t) break;
        }
        return new ScriptException(e.getMessage(), e);
    }

    /** Nombre del chunk (p.ej. {@code pages/home.luax}) o null si no se conoce. */
    public String getChunk() { return chunk; }

    /** Línea del error o -1. */
    public int getLine() { return line; }
}
