package com.ciro.jluax.ast;

import com.ciro.jluax.ParseException;
import com.ciro.jluax.SourcePosition;
import com.ciro.jluax.ast.LuaxLexer.Token;
import com.ciro.jluax.ast.LuaxLexer.TokenType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Descenso recursivo sobre los tokens del {@link LuaxLexer}.
 * <pre>
 * program   := hostSeq EOF
 * hostSeq   := (HOST | element)*
 * element   := TAG_OPEN attribute* (SELF_CLOSE | TAG_END child* TAG_CLOSE)
 * attribute := ATTR_NAME [ATTR_STRING | ATTR_EXPR_START hostSeq ATTR_EXPR_END]
 * child     := TEXT | element | SPLICE_START hostSeq SPLICE_END
 * </pre>
 * Cualquier error aborta: no existe modo "best effort".
 */
public class LuaxParser {

    private final String module;
    private final String src;
    private final Iterator<Token> tokens;
    private final int[] lineStarts;
    private Token current;

    public LuaxParser(String module, String src) {
        this.module = module;
        this.src = src == null ? "" : src;
        this.tokens = LuaxLexer.lex(module, this.src).iterator();
        this.lineStarts = lineStarts(this.src);
        this.current = tokens.next();
    }

    public static List<LuaxNode> parse(String module, String src) {
        return new LuaxParser(module, src).parseProgram();
    }

    public static List<LuaxNode> parse(String src) {
        return parse("<input>", src);
    }

    public List<LuaxNode> parseProgram() {
        List<LuaxNode> program = hostSequence();
        if (!current.is(TokenType.EOF)) throw unexpected("end of input");
        return program;
    }

    private List<LuaxNode> hostSequence() {
        List<LuaxNode> parts = new ArrayList<>();
        while (true) {
            if (current.is(TokenType.HOST)) {
                parts.add(new HostNode(current.text(), lineOf(current)));
                advance();
            } else if (current.is(TokenType.TAG_OPEN)) {
                parts.add(element());
            } else {
                return parts;
            }
        }
    }

    private ElementNode element() {
        Token open = current;
        String name = open.text();
        int line = lineOf(open);
        advance();

        if (name.isEmpty()) throw error(open, "tag name", describe(open));
        if (Character.isUpperCase(name.charAt(0)) && !LuaSyntax.isCallableName(name)) {
            throw error(open, "component name callable from Lua", "'" + name + "'");
        }

        Map<String, Attribute> attributes = new LinkedHashMap<>();
        while (current.is(TokenType.ATTR_NAME)) {
            Token attrTok = current;
            Attribute attr = attribute();
            if (attributes.putIfAbsent(attr.name(), attr) != null) {
                throw error(attrTok, "unique attribute names in <" + name + ">",
                        "duplicate attribute '" + attr.name() + "'");
            }
        }

        if (current.is(TokenType.SELF_CLOSE)) {
            int endLine = lineOf(current);
            advance();
            return new ElementNode(name, List.copyOf(attributes.values()), List.of(), true, line, endLine);
        }
        if (!current.is(TokenType.TAG_END)) throw unexpected("attribute, '>' or '/>'");
        advance();

        // Frame implícito: la recursión es la pila de tags abiertos
        List<LuaxNode> children = new ArrayList<>();
        while (true) {
            switch (current.type()) {
                case TEXT -> {
                    children.add(new TextNode(current.text(), lineOf(current)));
                    advance();
                }
                case TAG_OPEN -> children.add(element());
                case SPLICE_START -> children.add(splice());
                case TAG_CLOSE -> {
                    if (!current.text().equals(name)) throw unexpected("</" + name + ">");
                    int endLine = lineOf(current);
                    advance();
                    return new ElementNode(name, List.copyOf(attributes.values()), children, false, line, endLine);
                }
                default -> throw unexpected("</" + name + ">");
            }
        }
    }

    private Attribute attribute() {
        Token nameTok = current;
        advance();

        Attribute.Value value;
        if (current.is(TokenType.ATTR_STRING)) {
            value = new Attribute.Literal(current.text());
            advance();
        } else if (current.is(TokenType.ATTR_EXPR_START)) {
            Token start = current;
            advance();
            List<LuaxNode> parts = hostSequence();
            if (!current.is(TokenType.ATTR_EXPR_END)) throw unexpected("'}'");
            if (isBlank(parts)) throw error(start, "expression", "empty '{}'");
            advance();
            value = new Attribute.Expression(parts);
        } else if (current.is(TokenType.JUNK)) {
            throw unexpected("quoted value or '{' expression '}'");
        } else {
            value = new Attribute.Flag();
        }
        return new Attribute(nameTok.text(), value, lineOf(nameTok));
    }

    private SpliceNode splice() {
        Token start = current;
        advance();
        List<LuaxNode> parts = hostSequence();
        if (!current.is(TokenType.SPLICE_END)) throw unexpected("'$}'");
        if (isBlank(parts)) throw error(start, "expression", "empty '{$ $}'");
        advance();
        return new SpliceNode(parts, lineOf(start));
    }

    private static boolean isBlank(List<LuaxNode> parts) {
        for (LuaxNode p : parts) {
            if (!(p instanceof HostNode h) || !h.text().isBlank()) return false;
        }
        return true;
    }

    // --- tokens ---

    private void advance() {
        current = tokens.next();
    }

    private ParseException unexpected(String expected) {
        return error(current, expected, describe(current));
    }

    private ParseException error(Token at, String expected, String found) {
        return new ParseException(module, SourcePosition.of(src, at.offset()), expected, found);
    }

    private static String describe(Token t) {
        return switch (t.type()) {
            case EOF -> "end of input";
            case TAG_OPEN -> "<" + t.text();
            case TAG_CLOSE -> "</" + t.text() + ">";
            case TEXT -> "text \"" + abbreviate(t.text()) + "\"";
            case HOST -> "Lua code \"" + abbreviate(t.text()) + "\"";
            case ATTR_NAME -> "attribute '" + t.text() + "'";
            case ATTR_STRING -> "string \"" + abbreviate(t.text()) + "\"";
            default -> "'" + t.text() + "'";
        };
    }

    private static String abbreviate(String s) {
        String flat = s.replace("\n", "\\n");
        return flat.length() <= 24 ? flat : flat.substring(0, 21) + "...";
    }

    // --- líneas ---

    private static int[] lineStarts(String src) {
        int[] starts = new int[16];
        int n = 1; // starts[0] = 0
        for (int i = 0; i < src.length(); i++) {
            if (src.charAt(i) == '\n') {
                if (n == starts.length) starts = Arrays.copyOf(starts, n * 2);
                starts[n++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, n);
    }

    private int lineOf(Token t) {
        int idx = Arrays.binarySearch(lineStarts, t.offset());
        return idx >= 0 ? idx + 1 : -idx - 1;
    }
}
