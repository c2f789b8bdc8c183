package com.challenges.eql.ast;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * An interval of time, used by the timing parameters of joins and sequences.
 */
public record TimeRange(Duration delta) implements Expression {

    public TimeRange {
        Objects.requireNonNull(delta, "delta");
    }

    public static TimeRange ofSeconds(double seconds) {
        return new TimeRange(Duration.ofNanos(Math.round(seconds * 1_000_000_000L)));
    }

    public double totalSeconds() {
        return delta.getSeconds() + delta.getNano() / 1e9;
    }

    /**
     * Convert a numeric literal, measured in seconds, to a time range.
     */
    public static Optional<TimeRange> convert(Expression node) {
        if (node instanceof TimeRange range) {
            return Optional.of(range);
        } else if (node instanceof Literal.NumberLiteral number) {
            return Optional.of(ofSeconds(number.value().doubleValue()));
        }
        return Optional.empty();
    }
}
