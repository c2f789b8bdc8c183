package com.challenges.eql.ast;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * Joins multiple events that share common values. {@code close} may be null, otherwise it purges all join state.
 */
public record Join(ImmutableList<SubqueryBy> queries, SubqueryBy close) implements Query {

    public Join {
        Objects.requireNonNull(queries, "queries");
    }

    public Join(ImmutableList<SubqueryBy> queries) {
        this(queries, null);
    }
}
