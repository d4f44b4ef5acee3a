package com.densematrix;

import java.util.Optional;

/** A validated non-negative int, used to check dimensions before allocating. */
final class NaturalNumber {
    private final int value;

    private NaturalNumber(int value) { this.value = value; }

    static Optional<NaturalNumber> build(int value) {
        return value >= 0 ? Optional.of(new NaturalNumber(value)) : Optional.empty();
    }

    int intValue() { return value; }
    boolean isPositive() { return value > 0; }

    @Override public boolean equals(Object obj) {
        return obj instanceof NaturalNumber && ((NaturalNumber) obj).value == value;
    }

    @Override public int hashCode() { return Integer.hashCode(value); }

    @Override public String toString() { return Integer.toString(value); }
}
