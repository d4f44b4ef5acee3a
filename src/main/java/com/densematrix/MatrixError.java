package com.densematrix;

import java.util.Objects;
import java.util.OptionalInt;

/** Why a checked matrix operation produced no value. */
public final class MatrixError {
    public enum Kind {
        INDEX_OUT_OF_RANGE,     // row/column/element index outside the matrix
        INVALID_OPERATION,      // operation undefined for this shape (e.g. diag of non-square)
        SINGULAR,               // pivot magnitude below tolerance
        DIVIDE_BY_ZERO,         // a required divisor is exactly zero
        DEGENERATE              // zero-norm column during orthogonalization
    }

    private static final int NO_INDEX = -1;

    private final Kind kind;
    private final String message;
    private final int index;

    private MatrixError(Kind kind, String message, int index) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = Objects.requireNonNull(message, "message");
        this.index = index;
    }

    public static MatrixError of(Kind kind, String message) {
        return new MatrixError(kind, message, NO_INDEX);
    }

    public static MatrixError indexOutOfRange(int index, String message) {
        return new MatrixError(Kind.INDEX_OUT_OF_RANGE, message, index);
    }

    public Kind kind() { return kind; }
    public String message() { return message; }

    /** The offending index; only present for {@link Kind#INDEX_OUT_OF_RANGE}. */
    public OptionalInt index() {
        return kind == Kind.INDEX_OUT_OF_RANGE ? OptionalInt.of(index) : OptionalInt.empty();
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MatrixError)) return false;
        MatrixError o = (MatrixError) obj;
        return kind == o.kind && index == o.index && message.equals(o.message);
    }

    @Override public int hashCode() { return Objects.hash(kind, message, index); }

    @Override public String toString() {
        return index().isPresent()
                ? kind + "[" + index + "]: " + message
                : kind + ": " + message;
    }
}
