package com.challenges.eql.ast;

import java.util.Objects;

/**
 * Static values. The base type can't be instantiated, use one of the nested records or {@link #fromJava(Object)}.
 */
public sealed interface Literal extends Expression {

    Object value();

    TypeHint typeHint();

    /**
     * Truthiness of the wrapped value: false, null, zero and the empty string are falsy.
     */
    boolean isTruthy();

    static Literal fromJava(Object value) {
        if (value == null) {
            return new NullLiteral();
        } else if (value instanceof Boolean b) {
            return new BooleanLiteral(b);
        } else if (value instanceof java.lang.Number n) {
            return new NumberLiteral(n);
        } else if (value instanceof CharSequence s) {
            return new StringLiteral(s.toString());
        }
        throw new IllegalArgumentException("Unable to convert " + value.getClass().getSimpleName() + " to a literal");
    }

    record StringLiteral(String value) implements Literal {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public TypeHint typeHint() {
            return TypeHint.STRING;
        }

        @Override
        public boolean isTruthy() {
            return !value.isEmpty();
        }
    }

    /**
     * Numeric literal. Integral values are held as {@code Long}, fractional ones as {@code Double}, and equality is
     * numeric so that {@code 1} equals {@code 1.0}.
     */
    record NumberLiteral(java.lang.Number value) implements Literal {
        public static final NumberLiteral ZERO = new NumberLiteral(0L);

        public NumberLiteral {
            Objects.requireNonNull(value, "value");
            if (value instanceof Integer || value instanceof Short || value instanceof Byte
                    || value instanceof java.math.BigInteger) {
                value = value.longValue();
            } else if (!(value instanceof Long) && !(value instanceof Double)) {
                value = value.doubleValue();
            }
        }

        public NumberLiteral(long value) {
            this(Long.valueOf(value));
        }

        public NumberLiteral(double value) {
            this(Double.valueOf(value));
        }

        public boolean isIntegral() {
            return value instanceof Long;
        }

        /**
         * Key used for equality and set membership, whole doubles collapse onto longs.
         */
        public Object key() {
            if (value instanceof Double d && !d.isInfinite() && d == Math.rint(d)
                    && Math.abs(d) < 0x1p63) {
                return d.longValue();
            }
            return value;
        }

        @Override
        public TypeHint typeHint() {
            return TypeHint.NUMBER;
        }

        @Override
        public boolean isTruthy() {
            return value.doubleValue() != 0;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof NumberLiteral other && key().equals(other.key());
        }

        @Override
        public int hashCode() {
            return key().hashCode();
        }
    }

    record BooleanLiteral(Boolean value) implements Literal {
        public static final BooleanLiteral TRUE = new BooleanLiteral(true);
        public static final BooleanLiteral FALSE = new BooleanLiteral(false);

        public BooleanLiteral {
            Objects.requireNonNull(value, "value");
        }

        public static BooleanLiteral of(boolean value) {
            return value ? TRUE : FALSE;
        }

        @Override
        public TypeHint typeHint() {
            return TypeHint.BOOLEAN;
        }

        @Override
        public boolean isTruthy() {
            return value;
        }
    }

    record NullLiteral() implements Literal {
        @Override
        public Object value() {
            return null;
        }

        @Override
        public TypeHint typeHint() {
            return TypeHint.NULL;
        }

        @Override
        public boolean isTruthy() {
            return false;
        }
    }
}
