package com.ciro.jluax;

/**
 * Error al compilar código LuaX. Siempre fatal para la compilación en curso:
 * no se genera salida parcial.
 */
public abstract class LuaxException extends RuntimeException {

    private final String module;
    private final SourcePosition position;

    protected LuaxException(String module, SourcePosition position, String detail) {
        super(module + ":" + position.line() + ":" + position.column() + ": " + detail);
        this.module = module;
        this.position = position;
    }

    public String getModule() { return module; }

    public SourcePosition getPosition() { return position; }

    /** Offset en bytes UTF-8 desde el inicio del fuente. */
    public int getOffset() { return position.byteOffset(); }

    public int getLine() { return position.line(); }
}
