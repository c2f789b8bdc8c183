package com.challenges.eql.ast;

import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Mathematical operation between two numeric values.
 */
public record MathOperation(Expression left, Operator operator, Expression right) implements Expression {

    public enum Operator {
        MULTIPLY("*", "multiply"),
        DIVIDE("/", "divide"),
        MODULO("%", "modulo"),
        ADD("+", "add"),
        SUBTRACT("-", "subtract");

        private final String symbol;
        private final String functionName;

        Operator(String symbol, String functionName) {
            this.symbol = symbol;
            this.functionName = functionName;
        }

        public String symbol() {
            return symbol;
        }

        public String functionName() {
            return functionName;
        }

        public boolean isMultiplicative() {
            return this == MULTIPLY || this == DIVIDE || this == MODULO;
        }

        /**
         * Apply the operator. Two integral operands stay integral, except for a division that doesn't divide evenly.
         * Division and modulo by an integral zero throw {@link ArithmeticException}.
         */
        public java.lang.Number apply(java.lang.Number left, java.lang.Number right) {
            if (left instanceof Long a && right instanceof Long b) {
                switch (this) {
                    case MULTIPLY:
                        return a * b;
                    case DIVIDE:
                        if (b == 0) {
                            throw new ArithmeticException("/ by zero");
                        }
                        return a % b == 0 ? (java.lang.Number) (a / b) : (java.lang.Number) ((double) a / b);
                    case MODULO:
                        return a % b;
                    case ADD:
                        return a + b;
                    default:
                        return a - b;
                }
            }

            double a = left.doubleValue();
            double b = right.doubleValue();
            switch (this) {
                case MULTIPLY:
                    return a * b;
                case DIVIDE:
                    return a / b;
                case MODULO:
                    return a % b;
                case ADD:
                    return a + b;
                default:
                    return a - b;
            }
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator operator : values()) {
                if (operator.symbol.equals(symbol)) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("Unknown math operator: " + symbol);
        }
    }

    public MathOperation {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    public FunctionCall toFunctionCall() {
        return new FunctionCall(operator.functionName(), Lists.immutable.of(left, right));
    }
}
