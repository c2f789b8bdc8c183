package com.challenges.eql.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

public record Or(ImmutableList<Expression> terms) implements Expression {

    public Or {
        Objects.requireNonNull(terms, "terms");
    }

    public static Or of(Expression... terms) {
        return new Or(Lists.immutable.of(terms));
    }
}
