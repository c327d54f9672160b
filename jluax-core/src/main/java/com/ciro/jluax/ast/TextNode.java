package com.ciro.jluax.ast;

/** Texto literal entre tags. Los espacios se conservan byte a byte. */
public record TextNode(String text, int line) implements LuaxNode {

    public boolean isBlank() {
        return text.isBlank();
    }
}
