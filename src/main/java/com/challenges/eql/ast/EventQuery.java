package com.challenges.eql.ast;

import java.util.Objects;

/**
 * Query over a specific event type with a boolean condition.
 */
public record EventQuery(String eventType, Expression query) implements Query {

    public EventQuery {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(query, "query");
    }
}
