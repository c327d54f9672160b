package com.ciro.jluax.codegen;

import com.ciro.jluax.ast.Attribute;
import com.ciro.jluax.ast.ElementNode;
import com.ciro.jluax.ast.HostNode;
import com.ciro.jluax.ast.LuaSyntax;
import com.ciro.jluax.ast.LuaxNode;
import com.ciro.jluax.ast.SpliceNode;
import com.ciro.jluax.ast.TextNode;
import org.jsoup.parser.Parser;

import java.util.List;

/**
 * Convierte el AST en Lua puro, en un único recorrido.
 * <pre>
 * &lt;div class="a"&gt;hola&lt;/div&gt;  →  { tag="div", attrs={class="a", }, children={ "hola", } }
 * &lt;Card title={t}/&gt;          →  Card({title=t, }, {})
 * </pre>
 * Las líneas de la salida se mantienen alineadas con las del fuente, así los errores
 * de Lua apuntan a la línea correcta del .luax.
 */
public final class LuaGenerator {

    private final StringBuilder out = new StringBuilder();
    private int line = 1;

    private LuaGenerator() {}

    public static String generate(List<LuaxNode> program) {
        LuaGenerator gen = new LuaGenerator();
        for (LuaxNode node : program) gen.node(node);
        return gen.out.toString();
    }

    private void node(LuaxNode node) {
        if (node instanceof HostNode host) {
            alignTo(host.line());
            append(host.text());
        } else if (node instanceof ElementNode el) {
            element(el);
        } else if (node instanceof TextNode text) {
            alignTo(text.line());
            append(markupText(text.text(), false));
        } else if (node instanceof SpliceNode splice) {
            for (LuaxNode part : splice.parts()) node(part);
        }
    }

    private void element(ElementNode el) {
        alignTo(el.line());
        if (el.isComponent()) {
            // Resolución tardía: el nombre se busca en el scope de Lua al ejecutar
            append(el.tagName());
            append("(");
            attributes(el.attributes());
            append(", ");
            children(el.children());
            alignTo(el.endLine());
            append(")");
        } else {
            append("{ tag=");
            append(quote(el.tagName()));
            append(", attrs=");
            attributes(el.attributes());
            append(", children=");
            children(el.children());
            alignTo(el.endLine());
            append(" }");
        }
    }

    private void attributes(List<Attribute> attributes) {
        append("{");
        for (Attribute attr : attributes) {
            alignTo(attr.line());
            append(key(attr.name()));
            append("=");
            if (attr.value() instanceof Attribute.Literal lit) {
                append(markupText(lit.text(), true));
            } else if (attr.value() instanceof Attribute.Expression expr) {
                for (LuaxNode part : expr.parts()) node(part);
            } else {
                append("true");
            }
            append(", ");
        }
        append("}");
    }

    private void children(List<LuaxNode> children) {
        if (children.isEmpty()) {
            append("{}");
            return;
        }
        append("{ ");
        for (LuaxNode child : children) {
            node(child);
            append(", ");
        }
        append("}");
    }

    private static String key(String name) {
        return LuaSyntax.isName(name) ? name : "[" + quote(name) + "]";
    }

    /**
     * Literal Lua entre comillas dobles. Un salto de línea se escribe como
     * '\' + salto real (escape válido en Lua) para no desalinear las líneas.
     */
    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        escape(s, sb, true);
        return sb.append('"').toString();
    }

    /**
     * Texto escrito en el markup: las referencias ({@code &copy;}, {@code &#169;})
     * se decodifican acá, como en JSX, porque el render vuelve a escapar.
     * Los saltos que vienen de una referencia no son saltos del fuente: van como \n.
     */
    static String markupText(String raw, boolean inAttribute) {
        StringBuilder sb = new StringBuilder(raw.length() + 2).append('"');
        String[] lines = raw.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append("\\\n");
            escape(Parser.unescapeEntities(lines[i], inAttribute), sb, false);
        }
        return sb.append('"').toString();
    }

    private static void escape(String s, StringBuilder sb, boolean realNewlines) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append(realNewlines ? "\\\n" : "\\n");
                case '\t' -> sb.append(c);
                default -> {
                    if (c < 0x20) sb.append(String.format("\\%03d", (int) c));
                    else sb.append(c);
                }
            }
        }
    }

    private void alignTo(int target) {
        while (line < target) {
            out.append('\n');
            line++;
        }
    }

    private void append(String s) {
        out.append(s);
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') line++;
        }
    }
}
