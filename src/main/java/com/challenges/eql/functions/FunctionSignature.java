package com.challenges.eql.functions;

import com.challenges.eql.ast.Expression;
import com.challenges.eql.render.Renderer;

import java.util.List;
import java.util.Optional;

/**
 * Capabilities of a named function, as needed by the optimizer and the renderer.
 */
public interface FunctionSignature {

    String name();

    /**
     * Whether calls with only literal arguments may be folded by {@link #evaluate(List)}.
     */
    default boolean isConstantFoldable() {
        return true;
    }

    /**
     * Evaluate the function over literal values.
     *
     * @throws UnsupportedConstantEvaluationException if these values can't be evaluated at compile time
     */
    default Object evaluate(List<Object> arguments) {
        throw new UnsupportedConstantEvaluationException(name());
    }

    /**
     * Shorthand source text for a call, e.g. an infix operator the call was parsed from.
     */
    default Optional<String> alternateRender(List<Expression> arguments, Integer precedence, Renderer renderer) {
        return Optional.empty();
    }
}
