package com.ciro.jluax.render;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Convierte el árbol que devuelve el código generado
 * ({@code { tag=..., attrs={...}, children={...} }}) en HTML.
 * <ul>
 *   <li>texto y valores de atributos se escapan</li>
 *   <li>{@code true} → atributo sin valor; {@code false} → se omite</li>
 *   <li>listas anidadas dentro de children se aplanan</li>
 *   <li>elementos void ({@code br}, {@code img}...) no llevan cierre</li>
 * </ul>
 */
public class HtmlRenderer {

    public static final String DOCTYPE = "<!DOCTYPE html>";

    private static final Pattern TAG_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9:._-]*");
    private static final int MAX_DEPTH = 256;

    private final Set<String> voidElements;

    public HtmlRenderer(Set<String> voidElements) {
        this.voidElements = Set.copyOf(voidElements);
    }

    public String page(Object tree) {
        StringBuilder sb = new StringBuilder(256).append(DOCTYPE);
        if (tree instanceof String raw) sb.append(raw);
        else node(tree, sb, 0);
        return sb.toString();
    }

    public String fragment(Object tree) {
        if (tree instanceof String raw) return raw;
        StringBuilder sb = new StringBuilder(256);
        node(tree, sb, 0);
        return sb.toString();
    }

    private void node(Object value, StringBuilder out, int depth) {
        if (depth > MAX_DEPTH) throw new RenderException("tree nested deeper than " + MAX_DEPTH + " levels");

        if (value == null) return;
        if (value instanceof String s) {
            HtmlEscaper.text(s, out);
        } else if (value instanceof Number || value instanceof Boolean) {
            out.append(value);
        } else if (value instanceof List<?> list) {
            for (Object child : list) node(child, out, depth + 1);
        } else if (value instanceof Map<?, ?> map) {
            element(map, out, depth);
        } else {
            throw new RenderException("cannot render value of type " + value.getClass().getSimpleName());
        }
    }

    private void element(Map<?, ?> el, StringBuilder out, int depth) {
        Object tag = el.get("tag");
        if (!(tag instanceof String name)) throw new RenderException("element without a 'tag' string: " + el.keySet());
        if (!TAG_NAME.matcher(name).matches()) throw new RenderException("invalid tag name '" + name + "'");

        out.append('<').append(name);
        attributes(name, el.get("attrs"), out);
        out.append('>');

        if (voidElements.contains(name.toLowerCase(Locale.ROOT))) return;

        Object children = el.get("children");
        if (children != null && !(children instanceof List<?>)) {
            throw new RenderException("'children' of <" + name + "> must be a list");
        }
        node(children, out, depth + 1);
        out.append("</").append(name).append('>');
    }

    private static void attributes(String tag, Object attrs, StringBuilder out) {
        if (attrs == null) return;
        // Una tabla vacía llega como lista vacía
        if (attrs instanceof List<?> list && list.isEmpty()) return;
        if (!(attrs instanceof Map<?, ?> map)) throw new RenderException("'attrs' of <" + tag + "> must be a table");

        for (Map.Entry<?, ?> e : map.entrySet()) {
            String key = String.valueOf(e.getKey());
            Object v = e.getValue();
            if (v == null || Boolean.FALSE.equals(v)) continue;
            if (!TAG_NAME.matcher(key).matches()) throw new RenderException("invalid attribute name '" + key + "'");

            out.append(' ').append(key);
            if (Boolean.TRUE.equals(v)) continue;
            if (v instanceof Map<?, ?> || v instanceof List<?>) {
                throw new RenderException("attribute '" + key + "' of <" + tag + "> is a table");
            }
            out.append("=\"");
            HtmlEscaper.attribute(String.valueOf(v), out);
            out.append('"');
        }
    }
}
