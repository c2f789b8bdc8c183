package com.challenges.eql.ast;

import java.util.Objects;

/**
 * A comparison between two values, as in {@code <expr> <comparator> <expr>}.
 */
public record Comparison(Expression left, Comparator comparator, Expression right) implements Expression {

    public enum Comparator {
        LT("<"),
        LE("<="),
        EQ("=="),
        NE("!="),
        GE(">="),
        GT(">");

        private final String symbol;

        Comparator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Check the result of a {@code compareTo} against this comparator.
         */
        public boolean test(int comparison) {
            switch (this) {
                case LT:
                    return comparison < 0;
                case LE:
                    return comparison <= 0;
                case EQ:
                    return comparison == 0;
                case NE:
                    return comparison != 0;
                case GE:
                    return comparison >= 0;
                default:
                    return comparison > 0;
            }
        }

        public static Comparator fromSymbol(String symbol) {
            for (Comparator comparator : values()) {
                if (comparator.symbol.equals(symbol)) {
                    return comparator;
                }
            }
            throw new IllegalArgumentException("Unknown comparator: " + symbol);
        }
    }

    public Comparison {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(comparator, "comparator");
        Objects.requireNonNull(right, "right");
    }
}
