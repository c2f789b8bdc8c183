package com.challenges.eql.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

public record And(ImmutableList<Expression> terms) implements Expression {

    public And {
        Objects.requireNonNull(terms, "terms");
    }

    public static And of(Expression... terms) {
        return new And(Lists.immutable.of(terms));
    }
}
