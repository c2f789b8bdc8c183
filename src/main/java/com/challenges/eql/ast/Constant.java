package com.challenges.eql.ast;

import java.util.Objects;

/**
 * Binds a literal to a name.
 */
public record Constant(String name, Literal value) implements Definition, EqlNode {

    public Constant {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
