package com.ciro.jluax;

/** Markup estructuralmente inválido: tags sin cerrar o cruzados, atributos duplicados, etc. */
public class ParseException extends LuaxException {

    private final String expected;
    private final String found;

    public ParseException(String module, SourcePosition position, String expected, String found) {
        super(module, position, "expected " + expected + ", found " + found);
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() { return expected; }

    public String getFound() { return found; }
}
