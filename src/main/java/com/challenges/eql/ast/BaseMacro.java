package com.challenges.eql.ast;

import com.challenges.eql.optimizer.Optimizer;

import java.util.List;

public sealed interface BaseMacro extends Definition permits Macro, CustomMacro {

    /**
     * Expand a call to this macro. The result is always optimized.
     *
     * @param arguments the expressions the macro is called with
     * @param optimizer optimizer applied to the expansion
     */
    Expression expand(List<Expression> arguments, Optimizer optimizer);
}
