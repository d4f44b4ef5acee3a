package com.densematrix;

import java.util.Arrays;
import java.util.Objects;

/**
 * Result of {@link Linalg#plu}: {@code L} and {@code U} packed into one
 * square matrix (multipliers strictly below the diagonal, {@code U} on and
 * above it) plus the row permutation.
 *
 * <p>The permutation array has length {@code n + 1}.  Entry {@code i < n}
 * is the original row now at position {@code i}, so
 * {@code (P·A)[i] = A[p[i]]}; entry {@code n} counts the row swaps.
 */
public final class PluDecomposition {
    private final Matrix lu;
    private final int[] p;

    PluDecomposition(Matrix lu, int[] p) {
        this.lu = Objects.requireNonNull(lu, "lu");
        this.p = Objects.requireNonNull(p, "p");
    }

    /** Copy of the packed LU matrix. */
    public Matrix lu() { return lu.copy(); }

    /** Copy of the permutation array, swap count last. */
    public int[] permutation() { return Arrays.copyOf(p, p.length); }

    public int swapCount() { return p[p.length - 1]; }

    /** Sign of the permutation: +1 for an even number of swaps, -1 for odd. */
    public int sign() { return swapCount() % 2 == 0 ? 1 : -1; }

    /** Unit lower-triangular factor. */
    public Matrix lower() {
        int n = lu.rows();
        Matrix l = BuildUtilities.eye(n).orElseThrow();
        for (int i = 1; i < n; i++)
            for (int j = 0; j < i; j++)
                l.set(i, j, lu.get(i, j));
        return l;
    }

    /** Upper-triangular factor. */
    public Matrix upper() {
        int n = lu.rows();
        Matrix u = BuildUtilities.zeros(n, n).orElseThrow();
        for (int i = 0; i < n; i++)
            for (int j = i; j < n; j++)
                u.set(i, j, lu.get(i, j));
        return u;
    }

    /** Applies the recorded row order to {@code a}, giving {@code P·a}. */
    public Matrix permute(Matrix a) {
        int n = lu.rows();
        if (a.rows() != n) {
            throw new IllegalArgumentException("Expected " + n + " rows, got " + a.rows());
        }
        double[][] out = new double[n][];
        for (int i = 0; i < n; i++) out[i] = a.getRow(p[i]).get();
        return Matrix.build(out).orElseThrow();
    }
}
