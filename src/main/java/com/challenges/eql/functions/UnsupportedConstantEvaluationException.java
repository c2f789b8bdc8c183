package com.challenges.eql.functions;

import com.challenges.eql.ast.EqlException;

/**
 * Signals that a function call can't be evaluated at compile time and must be left for the evaluator.
 * Unlike other evaluation errors, the optimizer recovers from it.
 */
public class UnsupportedConstantEvaluationException extends EqlException {

    public UnsupportedConstantEvaluationException(String functionName) {
        super("Function " + functionName + " can't be evaluated at compile time");
    }

    public UnsupportedConstantEvaluationException(String functionName, String reason) {
        super("Function " + functionName + " can't be evaluated at compile time: " + reason);
    }
}
