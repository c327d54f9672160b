package com.ciro.jluax.ast;

import com.ciro.jluax.LexException;
import com.ciro.jluax.SourcePosition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lexer O(N) de un solo paso para LuaX.
 * <p>
 * El código Lua se deja pasar como texto opaco ({@link TokenType#HOST}); solo se
 * escanea lo suficiente para saber dónde empieza el markup. Un '&lt;' abre un tag
 * únicamente en posición de inicio de expresión, así {@code a < b} sigue siendo Lua.
 * El estado vive en una pila de modos (host / splice / expresión de atributo / tag / contenido).
 * <p>
 * No valida el balance de tags: eso es trabajo del parser.
 */
public class LuaxLexer {

    public enum TokenType {
        HOST,            // Lua crudo: local x = 1
        TAG_OPEN,        // <div   (text = nombre)
        ATTR_NAME,       // class
        ATTR_STRING,     // "valor"  (sin comillas)
        ATTR_EXPR_START, // {
        ATTR_EXPR_END,   // }
        TAG_END,         // >  que cierra el tag de apertura
        SELF_CLOSE,      // />
        TAG_CLOSE,       // </div>  (text = nombre)
        TEXT,            // texto entre tags, espacios incluidos
        SPLICE_START,    // {$
        SPLICE_END,      // $}
        JUNK,            // carácter ilegal en esa posición (lo reporta el parser)
        EOF
    }

    /**
     * @param offset     índice de char en el String fuente
     * @param byteOffset el mismo punto en bytes UTF-8 (lo que reportan los errores)
     */
    public record Token(TokenType type, String text, int offset, int byteOffset) {
        public boolean is(TokenType t) { return type == t; }
    }

    private enum Mode { HOST, SPLICE, ATTR_EXPR, TAG, CONTENT }

    private static final class Frame {
        Mode mode;
        final int start;
        int depth;                // llaves abiertas dentro de código Lua
        boolean exprStart = true; // ¿el próximo token Lua está en posición de expresión?

        Frame(Mode mode, int start) {
            this.mode = mode;
            this.start = start;
        }
    }

    private final String module;
    private final String src;
    private final int len;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Deque<Token> pending = new ArrayDeque<>();
    private int pos;
    private boolean finished;
    // último offset convertido a bytes: los tokens salen en orden, así que se avanza desde ahí
    private int charMark;
    private int byteMark;

    public LuaxLexer(String module, String src) {
        this.module = module;
        this.src = src == null ? "" : src;
        this.len = this.src.length();
        frames.push(new Frame(Mode.HOST, 0));
    }

    /** Secuencia perezosa; cada iterador vuelve a empezar desde el principio. */
    public static Iterable<Token> lex(String module, String src) {
        return () -> new TokenIterator(new LuaxLexer(module, src));
    }

    public static List<Token> tokenize(String module, String src) {
        List<Token> tokens = new ArrayList<>();
        lex(module, src).forEach(tokens::add);
        return tokens;
    }

    public static List<Token> tokenize(String src) {
        return tokenize("<input>", src);
    }

    public Token next() {
        if (pending.isEmpty()) {
            if (finished) throw new NoSuchElementException("EOF already emitted");
            Frame f = frames.peek();
            switch (f.mode) {
                case HOST, SPLICE, ATTR_EXPR -> lexHost(f);
                case TAG -> lexTag(f);
                case CONTENT -> lexContent(f);
            }
        }
        return pending.poll();
    }

    // ==============================================================
    // 1. Código Lua (raíz, {$ ... $} y { ... } de atributos)
    // ==============================================================
    private void lexHost(Frame f) {
        int start = pos;
        while (true) {
            if (pos >= len) {
                flushHost(start);
                if (f.mode == Mode.SPLICE) throw error(f.start, "unterminated expression splice, missing '$}'");
                if (f.mode == Mode.ATTR_EXPR) throw error(f.start, "unterminated attribute expression, missing '}'");
                emitEof();
                return;
            }
            char c = src.charAt(pos);

            if (f.mode == Mode.SPLICE && f.depth == 0 && c == '$' && peek(1) == '}') {
                flushHost(start);
                emit(TokenType.SPLICE_END, "$}", pos);
                pos += 2;
                frames.pop();
                return;
            }
            if (f.mode == Mode.ATTR_EXPR && f.depth == 0 && c == '}') {
                flushHost(start);
                emit(TokenType.ATTR_EXPR_END, "}", pos);
                pos++;
                frames.pop();
                return;
            }
            if (c == '<' && f.exprStart && LuaSyntax.isNameStart(peek(1))) {
                flushHost(start);
                // Un elemento completo es un valor: lo que venga después ya no es inicio de expresión
                f.exprStart = false;
                openTag();
                return;
            }
            scanLuaToken(f);
        }
    }

    private void scanLuaToken(Frame f) {
        char c = src.charAt(pos);

        if (Character.isWhitespace(c)) {
            pos++;
            return;
        }
        if (c == '-' && peek(1) == '-') {
            skipComment();
            return;
        }
        if (c == '"' || c == '\'') {
            skipShortString(c);
            f.exprStart = false;
            return;
        }
        if (c == '[' && longBracketLevel(pos) >= 0) {
            skipLongBracket("string");
            f.exprStart = false;
            return;
        }
        if (LuaSyntax.isNameStart(c)) {
            int s = pos;
            while (pos < len && LuaSyntax.isNamePart(src.charAt(pos))) pos++;
            String word = src.substring(s, pos);
            f.exprStart = LuaSyntax.KEYWORDS.contains(word) && !LuaSyntax.VALUE_KEYWORDS.contains(word);
            return;
        }
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            skipNumber();
            f.exprStart = false;
            return;
        }
        if (c == '.') {
            if (peek(1) == '.' && peek(2) == '.') {
                pos += 3;
                f.exprStart = false; // vararg
            } else if (peek(1) == '.') {
                pos += 2;
                f.exprStart = true;
            } else {
                pos++;
                f.exprStart = true;
            }
            return;
        }
        switch (c) {
            case '{' -> {
                f.depth++;
                f.exprStart = true;
            }
            case '}' -> {
                if (f.depth > 0) f.depth--;
                f.exprStart = false;
            }
            case ')', ']' -> f.exprStart = false;
            default -> f.exprStart = true; // operadores, '(', '[', ',', '=', ...
        }
        pos++;
    }

    private void skipComment() {
        int start = pos;
        pos += 2;
        if (pos < len && src.charAt(pos) == '[' && longBracketLevel(pos) >= 0) {
            skipLongBracket("comment", start);
            return;
        }
        while (pos < len && src.charAt(pos) != '\n') pos++;
    }

    private void skipShortString(char quote) {
        int start = pos;
        pos++;
        while (pos < len) {
            char c = src.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == quote) {
                pos++;
                return;
            }
            if (c == '\n') break; // Lua no permite saltos de línea sin escapar
            pos++;
        }
        throw error(start, "unterminated string literal");
    }

    /** Nivel de un corchete largo que empieza en {@code at} ([[ = 0, [==[ = 2), o -1. */
    private int longBracketLevel(int at) {
        int i = at + 1;
        int level = 0;
        while (i < len && src.charAt(i) == '=') {
            level++;
            i++;
        }
        return (i < len && src.charAt(i) == '[') ? level : -1;
    }

    private void skipLongBracket(String what) {
        skipLongBracket(what, pos);
    }

    private void skipLongBracket(String what, int reportAt) {
        int level = longBracketLevel(pos);
        String close = "]" + "=".repeat(level) + "]";
        int end = src.indexOf(close, pos + level + 2);
        if (end < 0) throw error(reportAt, "unterminated long " + what);
        pos = end + close.length();
    }

    private void skipNumber() {
        boolean hex = src.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'X');
        if (hex) pos += 2;
        while (pos < len) {
            char c = src.charAt(pos);
            if (LuaSyntax.isNamePart(c) || c == '.') {
                pos++;
            } else if ((c == '+' || c == '-') && isExponent(src.charAt(pos - 1), hex)) {
                pos++;
            } else {
                break;
            }
        }
    }

    private static boolean isExponent(char c, boolean hex) {
        return hex ? (c == 'p' || c == 'P') : (c == 'e' || c == 'E');
    }

    private void flushHost(int start) {
        if (pos > start) emit(TokenType.HOST, src.substring(start, pos), start);
    }

    // ==============================================================
    // 2. Dentro de un tag de apertura: <div class="x" id={y} />
    // ==============================================================
    private void openTag() {
        int at = pos;
        pos++; // '<'
        emit(TokenType.TAG_OPEN, readMarkupName(), at);
        frames.push(new Frame(Mode.TAG, at));
    }

    private void lexTag(Frame f) {
        skipWhitespace();
        if (pos >= len) {
            emitEof();
            return;
        }
        char c = src.charAt(pos);

        if (c == '/' && peek(1) == '>') {
            emit(TokenType.SELF_CLOSE, "/>", pos);
            pos += 2;
            frames.pop();
            return;
        }
        if (c == '>') {
            emit(TokenType.TAG_END, ">", pos);
            pos++;
            f.mode = Mode.CONTENT;
            return;
        }
        if (LuaSyntax.isNameStart(c)) {
            int at = pos;
            emit(TokenType.ATTR_NAME, readMarkupName(), at);
            int afterName = pos;
            skipWhitespace();
            if (pos >= len || src.charAt(pos) != '=') {
                pos = afterName; // atributo sin valor: <input disabled>
                return;
            }
            pos++;
            skipWhitespace();
            if (pos >= len) return; // el próximo next() emite EOF
            char v = src.charAt(pos);
            if (v == '"' || v == '\'') {
                int end = src.indexOf(v, pos + 1);
                if (end < 0) throw error(pos, "unterminated attribute value");
                emit(TokenType.ATTR_STRING, src.substring(pos + 1, end), pos);
                pos = end + 1;
            } else if (v == '{') {
                emit(TokenType.ATTR_EXPR_START, "{", pos);
                frames.push(new Frame(Mode.ATTR_EXPR, pos));
                pos++;
            } else {
                emit(TokenType.JUNK, String.valueOf(v), pos);
                pos++;
            }
            return;
        }

        emit(TokenType.JUNK, String.valueOf(c), pos);
        pos++;
    }

    private String readMarkupName() {
        int start = pos;
        while (pos < len) {
            char c = src.charAt(pos);
            if (LuaSyntax.isNamePart(c) || c == '-' || c == ':' || c == '.') pos++;
            else break;
        }
        return src.substring(start, pos);
    }

    // ==============================================================
    // 3. Contenido de un elemento: texto, hijos y {$ ... $}
    // ==============================================================
    private void lexContent(Frame f) {
        int start = pos;
        while (pos < len) {
            char c = src.charAt(pos);
            if (c == '<' && (peek(1) == '/' || LuaSyntax.isNameStart(peek(1)))) break;
            if (c == '{' && peek(1) == '$') break;
            pos++;
        }
        if (pos > start) {
            emit(TokenType.TEXT, src.substring(start, pos), start);
            return;
        }
        if (pos >= len) {
            emitEof();
            return;
        }

        if (peek(1) == '/') {
            closeTag();
        } else if (src.charAt(pos) == '<') {
            openTag();
        } else {
            emit(TokenType.SPLICE_START, "{$", pos);
            frames.push(new Frame(Mode.SPLICE, pos));
            pos += 2;
        }
    }

    private void closeTag() {
        int at = pos;
        pos += 2; // '</'
        String name = readMarkupName();
        skipWhitespace();
        if (pos < len && src.charAt(pos) == '>') {
            pos++;
            emit(TokenType.TAG_CLOSE, name, at);
            frames.pop();
            return;
        }
        // Tag de cierre mal formado: se lo entregamos al parser para que diga qué esperaba
        int end = Math.min(pos + 1, len);
        emit(TokenType.JUNK, src.substring(at, end), at);
        pos = end;
    }

    // ==============================================================
    // Helpers
    // ==============================================================
    private void skipWhitespace() {
        while (pos < len && Character.isWhitespace(src.charAt(pos))) pos++;
    }

    private char peek(int ahead) {
        int i = pos + ahead;
        return i < len ? src.charAt(i) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void emit(TokenType type, String text, int offset) {
        pending.add(new Token(type, text, offset, byteOffsetOf(offset)));
    }

    private int byteOffsetOf(int at) {
        if (at < charMark) {
            charMark = 0;
            byteMark = 0;
        }
        for (int i = charMark; i < at; i++) {
            char c = src.charAt(i);
            if (c < 0x80) {
                byteMark += 1;
            } else if (c < 0x800) {
                byteMark += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < len && Character.isLowSurrogate(src.charAt(i + 1))) {
                byteMark += 4;
                i++;
            } else {
                byteMark += 3;
            }
        }
        charMark = at;
        return byteMark;
    }

    private void emitEof() {
        emit(TokenType.EOF, "", len);
        finished = true;
    }

    private LexException error(int at, String reason) {
        return new LexException(module, SourcePosition.of(src, at), reason);
    }

    private static final class TokenIterator implements Iterator<Token> {
        private final LuaxLexer lexer;
        private boolean done;

        TokenIterator(LuaxLexer lexer) {
            this.lexer = lexer;
        }

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public Token next() {
            if (done) throw new NoSuchElementException();
            Token t = lexer.next();
            if (t.is(TokenType.EOF)) done = true;
            return t;
        }
    }
}
