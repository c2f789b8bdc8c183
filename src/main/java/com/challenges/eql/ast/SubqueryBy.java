package com.challenges.eql.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * An {@link EventQuery} within a join or sequence, with its parameters and the values it joins on.
 */
public record SubqueryBy(EventQuery query, NamedParams params, ImmutableList<Expression> joinValues) implements EqlNode {

    public SubqueryBy {
        Objects.requireNonNull(query, "query");
        params = params == null ? new NamedParams() : params;
        joinValues = joinValues == null ? Lists.immutable.empty() : joinValues;
    }

    public SubqueryBy(EventQuery query) {
        this(query, null, null);
    }
}
