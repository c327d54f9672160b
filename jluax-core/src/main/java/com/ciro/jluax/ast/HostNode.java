package com.ciro.jluax.ast;

/** Fragmento de Lua que se copia tal cual. */
public record HostNode(String text, int line) implements LuaxNode {}
