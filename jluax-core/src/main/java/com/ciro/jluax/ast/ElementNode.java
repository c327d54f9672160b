package com.ciro.jluax.ast;

import java.util.List;

/**
 * Un tag. Si el nombre empieza con mayúscula es un componente ({@code <Card/>}),
 * pero esa decisión la toma el generador, no el parser.
 *
 * @param line    línea del '&lt;' de apertura
 * @param endLine línea del '/&gt;' o del tag de cierre
 */
public record ElementNode(String tagName,
                          List<Attribute> attributes,
                          List<LuaxNode> children,
                          boolean selfClosing,
                          int line,
                          int endLine) implements LuaxNode {

    public ElementNode {
        attributes = List.copyOf(attributes);
        children = List.copyOf(children);
    }

    public boolean isComponent() {
        return Character.isUpperCase(tagName.charAt(0));
    }
}
