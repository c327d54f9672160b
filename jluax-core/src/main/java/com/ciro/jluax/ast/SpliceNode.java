package com.ciro.jluax.ast;

import java.util.List;

/**
 * {@code {$ expr $}}: una expresión Lua cuyo valor, en tiempo de ejecución, es un hijo más.
 * Las partes son {@link HostNode} y, si la expresión contiene markup, {@link ElementNode}.
 */
public record SpliceNode(List<LuaxNode> parts, int line) implements LuaxNode {

    public SpliceNode {
        parts = List.copyOf(parts);
    }
}
