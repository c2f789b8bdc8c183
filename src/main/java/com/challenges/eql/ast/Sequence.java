package com.challenges.eql.ast;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * Like {@link Join}, but enforces an ordering. {@code close} is the optional {@code until} query.
 */
public record Sequence(ImmutableList<SubqueryBy> queries, NamedParams params, SubqueryBy close) implements Query {

    public Sequence {
        Objects.requireNonNull(queries, "queries");
        params = params == null ? new NamedParams() : params;
    }

    public Sequence(ImmutableList<SubqueryBy> queries) {
        this(queries, null, null);
    }
}
