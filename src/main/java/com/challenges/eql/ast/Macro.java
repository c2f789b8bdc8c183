package com.challenges.eql.ast;

import com.challenges.eql.optimizer.Optimizer;
import com.challenges.eql.walk.RecursiveWalker;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.List;
import java.util.Objects;

/**
 * A named, parameterized expression that is expanded at the call site.
 */
public record Macro(String name, ImmutableList<String> parameters, Expression expression) implements BaseMacro, EqlNode {

    public Macro {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public Expression expand(List<Expression> arguments, Optimizer optimizer) {
        if (arguments.size() != parameters.size()) {
            throw new MacroArityException(name, parameters.size(), arguments.size());
        }

        MutableMap<String, Expression> lookup = Maps.mutable.empty();
        for (int i = 0; i < parameters.size(); i++) {
            lookup.put(parameters.get(i), arguments.get(i));
        }

        RecursiveWalker walker = new RecursiveWalker()
                .register(Field.class, field -> {
                    Expression argument = lookup.get(field.base());
                    return argument != null && field.path().isEmpty() ? optimizer.optimize(argument) : field;
                });
        return optimizer.optimize(walker.walkExpression(expression));
    }
}
