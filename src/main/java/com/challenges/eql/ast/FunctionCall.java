package com.challenges.eql.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * A call into a named function. With {@code asMethod} set, the first argument renders as the receiver.
 */
public record FunctionCall(String name, ImmutableList<Expression> arguments, boolean asMethod) implements Expression {

    public FunctionCall {
        Objects.requireNonNull(name, "name");
        arguments = arguments == null ? Lists.immutable.empty() : arguments;
    }

    public FunctionCall(String name, ImmutableList<Expression> arguments) {
        this(name, arguments, false);
    }

    public static FunctionCall of(String name, Expression... arguments) {
        return new FunctionCall(name, Lists.immutable.of(arguments), false);
    }
}
