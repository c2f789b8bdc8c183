package com.challenges.eql.ast;

/**
 * Nodes that evaluate to a value within the scope of an event.
 */
public sealed interface Expression extends EqlNode
        permits Literal, TimeRange, Field, FunctionCall, NamedSubquery, MathOperation, Comparison, InSet,
        And, Or, Not {
}
