package com.ciro.jluax.ast;

import java.util.Set;
import java.util.regex.Pattern;

/** Lo mínimo de la gramática de Lua que necesitan el lexer y el generador. */
public final class LuaSyntax {

    public static final Set<String> KEYWORDS = Set.of(
            "and", "break", "do", "else", "elseif", "end", "false", "for", "function", "goto",
            "if", "in", "local", "nil", "not", "or", "repeat", "return", "then", "true",
            "until", "while");

    /** Keywords que terminan un valor: tras ellas un '<' es comparación. */
    static final Set<String> VALUE_KEYWORDS = Set.of("true", "false", "nil", "end");

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern DOTTED_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private LuaSyntax() {}

    /** Un Name de Lua que además no es palabra reservada. */
    public static boolean isName(String s) {
        return NAME.matcher(s).matches() && !KEYWORDS.contains(s);
    }

    /** Algo invocable directamente: {@code Card}, {@code UI.Button}. */
    public static boolean isCallableName(String s) {
        if (!DOTTED_NAME.matcher(s).matches()) return false;
        for (String part : s.split("\\.")) {
            if (KEYWORDS.contains(part)) return false;
        }
        return true;
    }

    static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isNamePart(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }
}
