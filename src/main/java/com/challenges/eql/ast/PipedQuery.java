package com.challenges.eql.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

public record PipedQuery(Query first, ImmutableList<PipeCommand> pipes) implements EqlNode {

    public PipedQuery {
        Objects.requireNonNull(first, "first");
        pipes = pipes == null ? Lists.immutable.empty() : pipes;
    }

    public PipedQuery(Query first) {
        this(first, null);
    }
}
