package com.densematrix;

import java.util.Objects;

/** {@code A = L·U} with {@code L} unit lower-triangular and {@code U} upper-triangular. */
public final class LuDecomposition {
    private final Matrix l;
    private final Matrix u;

    LuDecomposition(Matrix l, Matrix u) {
        this.l = Objects.requireNonNull(l, "l");
        this.u = Objects.requireNonNull(u, "u");
    }

    public Matrix l() { return l.copy(); }
    public Matrix u() { return u.copy(); }
}
