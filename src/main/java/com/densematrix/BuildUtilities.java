package com.densematrix;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated constructors layered on {@link Matrix}.  Every size argument
 * goes through {@link NaturalNumber} and must also be strictly positive;
 * anything else yields an empty result.
 */
public final class BuildUtilities {

    private BuildUtilities() {}

    public static Optional<Matrix> filled(int rows, int cols, double value) {
        return positive(rows).flatMap(r -> positive(cols).flatMap(c -> {
            double[] flat = new double[r.intValue() * c.intValue()];
            Arrays.fill(flat, value);
            return Matrix.build(flat, r.intValue(), c.intValue());
        }));
    }

    public static Optional<Matrix> zeros(int rows, int cols) {
        return filled(rows, cols, 0d);
    }

    /** Square {@code size × size} matrix with {@code value} on the diagonal and 0 elsewhere. */
    public static Optional<Matrix> diag(int size, double value) {
        return positive(size).flatMap(n -> {
            double[][] d = new double[n.intValue()][n.intValue()];
            for (int i = 0; i < d.length; i++) d[i][i] = value;
            return Matrix.build(d);
        });
    }

    public static Optional<Matrix> eye(int n) {
        return diag(n, 1d);
    }

    /** Returns a new {@code cols × rows} matrix with {@code result[j][i] = a[i][j]}. */
    public static Matrix transpose(Matrix a) {
        int rows = a.rows(), cols = a.cols();
        Matrix t = zeros(cols, rows).orElseThrow();
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                t.set(j, i, a.get(i, j));
            }
        }
        return t;
    }

    /** Joins {@code a} and {@code b}; empty when the dimension that must agree does not. */
    public static Optional<Matrix> concat(Matrix a, Matrix b, ConcatMode mode) {
        Objects.requireNonNull(mode, "mode");
        switch (mode) {
            case ROWS: return concatRows(a, b);
            case COLUMNS: return concatColumns(a, b);
            default: throw new IllegalArgumentException("Unknown mode: " + mode);
        }
    }

    private static Optional<Matrix> concatRows(Matrix a, Matrix b) {
        if (a.cols() != b.cols()) return Optional.empty();
        double[][] out = new double[a.rows() + b.rows()][];
        int i = 0;
        for (double[] row : a) out[i++] = row;
        for (double[] row : b) out[i++] = row;
        return Matrix.build(out);
    }

    private static Optional<Matrix> concatColumns(Matrix a, Matrix b) {
        if (a.rows() != b.rows()) return Optional.empty();
        double[][] out = new double[a.rows()][a.cols() + b.cols()];
        for (int i = 0; i < a.rows(); i++) {
            for (int j = 0; j < a.cols(); j++) out[i][j] = a.get(i, j);
            for (int j = 0; j < b.cols(); j++) out[i][a.cols() + j] = b.get(i, j);
        }
        return Matrix.build(out);
    }

    private static Optional<NaturalNumber> positive(int n) {
        return NaturalNumber.build(n).filter(NaturalNumber::isPositive);
    }
}
