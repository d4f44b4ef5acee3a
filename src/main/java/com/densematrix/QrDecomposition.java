package com.densematrix;

import java.util.Objects;

/**
 * {@code A = Q·R}: {@code Q} is {@code rows × cols} with orthonormal
 * columns, {@code R} is {@code cols × cols} upper-triangular.
 */
public final class QrDecomposition {
    private final Matrix q;
    private final Matrix r;

    QrDecomposition(Matrix q, Matrix r) {
        this.q = Objects.requireNonNull(q, "q");
        this.r = Objects.requireNonNull(r, "r");
    }

    public Matrix q() { return q.copy(); }
    public Matrix r() { return r.copy(); }
}
