package com.challenges.eql.ast;

/**
 * Root of the event query language syntax tree.
 *
 * Every node is an immutable record. The record components are the node's attributes, in declaration
 * order, and record equality is the structural equality used throughout the optimizer.
 */
public sealed interface EqlNode
        permits Expression, Query, NamedParams, SubqueryBy, PipeCommand, PipedQuery, EqlAnalytic,
        Constant, Macro {
}
