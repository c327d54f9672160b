package com.ciro.jluax.ast;

import java.util.List;

public record Attribute(String name, Value value, int line) {

    public sealed interface Value permits Literal, Expression, Flag {}

    /** {@code class="card"} */
    public record Literal(String text) implements Value {}

    /** {@code onclick={handler}}: Lua, posiblemente con markup dentro. */
    public record Expression(List<LuaxNode> parts) implements Value {
        public Expression {
            parts = List.copyOf(parts);
        }
    }

    /** {@code <input disabled>}: sin valor, equivale a {@code true}. */
    public record Flag() implements Value {}
}
