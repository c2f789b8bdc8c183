package com.challenges.eql.ast;

/**
 * Queries that can start a {@link PipedQuery}.
 */
public sealed interface Query extends EqlNode permits EventQuery, Join, Sequence {
}
