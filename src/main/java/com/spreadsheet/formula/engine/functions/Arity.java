package com.spreadsheet.formula.engine.functions;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Accepted argument count of a function: an exact count, a bounded span
 * for trailing optional arguments, or variadic.
 */
public final class Arity {

    private static final int UNBOUNDED = -1;

    private final int min;
    private final int max;

    private Arity(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public static Arity exactly(int count) {
        return new Arity(count, count);
    }

    public static Arity between(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " > max " + max);
        }
        return new Arity(min, max);
    }

    public static Arity variadic() {
        return new Arity(0, UNBOUNDED);
    }

    public static Arity atLeast(int min) {
        return new Arity(min, UNBOUNDED);
    }

    public boolean isVariadic() {
        return max == UNBOUNDED;
    }

    public boolean accepts(int count) {
        return count >= min && (max == UNBOUNDED || count <= max);
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    @JsonValue
    @Override
    public String toString() {
        if (isVariadic()) {
            return min == 0 ? "variadic" : min + "+";
        }
        return min == max ? String.valueOf(min) : min + ".." + max;
    }
}
