package com.challenges.eql.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * A post-processing stage. The name selects a kind from the pipe registry.
 */
public record PipeCommand(String name, ImmutableList<Expression> arguments) implements EqlNode {

    public PipeCommand {
        Objects.requireNonNull(name, "name");
        arguments = arguments == null ? Lists.immutable.empty() : arguments;
    }

    public static PipeCommand of(String name, Expression... arguments) {
        return new PipeCommand(name, Lists.immutable.of(arguments));
    }
}
