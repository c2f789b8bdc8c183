package com.challenges.eql.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Check if the value of an expression matches one of a list of candidates.
 */
public record InSet(Expression expression, ImmutableList<Expression> container) implements Expression {

    public InSet {
        Objects.requireNonNull(expression, "expression");
        container = container == null ? Lists.immutable.empty() : container;
    }

    public static InSet of(Expression expression, Expression... container) {
        return new InSet(expression, Lists.immutable.of(container));
    }

    /**
     * Check if the set contains only literal values.
     */
    public boolean isLiteral() {
        return container.allSatisfy(Literal.class::isInstance);
    }

    /**
     * Check if the set contains only dynamic values.
     */
    public boolean isDynamic() {
        return container.noneSatisfy(Literal.class::isInstance);
    }

    /**
     * Equivalent node that performs one {@code ==} comparison per candidate.
     */
    public Or synonym() {
        return new Or(container.<Expression>collect(value -> new Comparison(expression, Comparison.Comparator.EQ, value)));
    }
}
