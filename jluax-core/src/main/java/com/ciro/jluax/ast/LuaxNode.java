package com.ciro.jluax.ast;

/**
 * Nodo del AST de LuaX. {@link #line()} es la línea (desde 1) donde empieza en el fuente.
 */
public sealed interface LuaxNode permits HostNode, ElementNode, TextNode, SpliceNode {
    int line();
}
