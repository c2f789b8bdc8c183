package com.challenges.eql.ast;

import com.challenges.eql.optimizer.Optimizer;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Macro whose expansion is computed by a caller supplied function, for rewrites that can't be written as a template.
 */
public record CustomMacro(String name, Function<List<Expression>, Expression> callback) implements BaseMacro {

    public CustomMacro {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(callback, "callback");
    }

    public static CustomMacro fromName(String name, Function<List<Expression>, Expression> callback) {
        return new CustomMacro(name, callback);
    }

    @Override
    public Expression expand(List<Expression> arguments, Optimizer optimizer) {
        return optimizer.optimize(callback.apply(arguments));
    }
}
