package com.densematrix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decompositions on {@link Matrix}.  Every method works on a private copy
 * of its input, so the caller's matrix is never modified, and reports
 * bad shapes and degenerate numerics through {@link Result}.
 */
public final class Linalg {
    private static final Logger logger = LoggerFactory.getLogger(Linalg.class);

    private Linalg() {}

    // ---- PLU ----

    public static Result<PluDecomposition> plu(Matrix a) {
        return plu(a, LinalgOptions.DEFAULTS);
    }

    public static Result<PluDecomposition> plu(Matrix a, double tolerance) {
        return plu(a, LinalgOptions.builder().pivotTolerance(tolerance).build());
    }

    /**
     * Gaussian elimination with partial pivoting.  For each column the row
     * with the largest magnitude at or below the diagonal becomes the pivot
     * row; a pivot magnitude below {@code options.pivotTolerance} fails
     * with {@code SINGULAR}.
     */
    public static Result<PluDecomposition> plu(Matrix a, LinalgOptions options) {
        if (!a.isSquare()) return notSquare("PLU", a);

        Matrix m = a.copy();
        int n = m.rows();
        int[] p = new int[n + 1];
        for (int i = 0; i < n; i++) p[i] = i;
        p[n] = 0;

        for (int i = 0; i < n; i++) {
            int imax = i;
            double maxVal = Math.abs(m.get(i, i));
            for (int r = i + 1; r < n; r++) {
                double v = Math.abs(m.get(r, i));
                if (v > maxVal) { maxVal = v; imax = r; }
            }

            if (maxVal < options.pivotTolerance) {
                if (logger.isDebugEnabled()) {
                    logger.debug("PLU stopped at column {}: pivot {} below tolerance {}", i, maxVal, options.pivotTolerance);
                }
                return Result.failure(MatrixError.Kind.SINGULAR,
                        "Pivot in column " + i + " is below tolerance " + options.pivotTolerance);
            }

            if (imax != i) {
                m.swapRows(imax, i);
                int t = p[i]; p[i] = p[imax]; p[imax] = t;
                p[n]++;
            }

            for (int j = i + 1; j < n; j++) {
                m.set(j, i, m.get(j, i) / m.get(i, i));
                double f = m.get(j, i);
                for (int k = i + 1; k < n; k++) {
                    m.set(j, k, m.get(j, k) - f * m.get(i, k));
                }
            }
        }
        return Result.success(new PluDecomposition(m, p));
    }

    public static Result<Double> determinantByPlu(Matrix a) {
        return determinantByPlu(a, LinalgOptions.DEFAULTS);
    }

    /** {@code det(A) = sign(P) · Π diag(U)}. */
    public static Result<Double> determinantByPlu(Matrix a, LinalgOptions options) {
        return plu(a, options).flatMap(d -> d.lu().getDiag().map(diag -> {
            double det = d.sign();
            for (double x : diag) det *= x;
            return det;
        }));
    }

    // ---- Doolittle LU ----

    /**
     * Unpivoted Doolittle factorisation.  Fails with {@code DIVIDE_BY_ZERO}
     * when some {@code U[i][i]} it has to divide by is exactly zero; there
     * is no tolerance check, use {@link #plu} for ill-conditioned input.
     */
    public static Result<LuDecomposition> doolittleLu(Matrix a) {
        if (!a.isSquare()) return notSquare("LU", a);

        int n = a.rows();
        Matrix l = BuildUtilities.zeros(n, n).orElseThrow();
        Matrix u = BuildUtilities.zeros(n, n).orElseThrow();

        for (int i = 0; i < n; i++) {
            for (int k = i; k < n; k++) {
                u.set(i, k, a.get(i, k) - dot(l, i, u, k, i));
            }

            l.set(i, i, 1d);
            for (int k = i + 1; k < n; k++) {
                if (u.get(i, i) == 0d) {
                    if (logger.isDebugEnabled()) {
                        logger.debug("LU stopped: U[{}][{}] is zero", i, i);
                    }
                    return Result.failure(MatrixError.Kind.DIVIDE_BY_ZERO,
                            "Can't divide by U[" + i + "][" + i + "] because it is 0");
                }
                l.set(k, i, (a.get(k, i) - dot(l, k, u, i, i)) / u.get(i, i));
            }
        }
        return Result.success(new LuDecomposition(l, u));
    }

    /** Determinant through {@link #doolittleLu}: {@code Π diag(L) · Π diag(U)}. */
    public static Result<Double> determinant(Matrix a) {
        return doolittleLu(a).flatMap(lu -> lu.l().getDiag().flatMap(dl -> lu.u().getDiag().map(du -> {
            double det = 1d;
            for (double x : dl) det *= x;
            for (double x : du) det *= x;
            return det;
        })));
    }

    // Σ_{j<len} l[row][j] * u[j][col]
    private static double dot(Matrix l, int row, Matrix u, int col, int len) {
        double s = 0d;
        for (int j = 0; j < len; j++) s += l.get(row, j) * u.get(j, col);
        return s;
    }

    // ---- QR ----

    public static Result<QrDecomposition> qr(Matrix a) {
        return qr(a, LinalgOptions.DEFAULTS);
    }

    /**
     * Classical Gram-Schmidt.  Each column has its projections onto the
     * already orthonormalised columns removed and is then scaled to unit
     * length; {@code R = Qᵗ·A}.
     *
     * <p>Fails with {@code DEGENERATE} when the columns are linearly
     * dependent: more columns than rows, or a residual column whose norm is
     * zero or at most {@code options.orthogonalityTolerance} times the norm
     * of the original column.
     */
    public static Result<QrDecomposition> qr(Matrix a, LinalgOptions options) {
        int rows = a.rows(), cols = a.cols();
        if (rows < cols) {
            return Result.failure(MatrixError.Kind.DEGENERATE,
                    "Columns of a " + rows + "x" + cols + " matrix are linearly dependent");
        }

        double[][] q = new double[cols][];
        for (int i = 0; i < cols; i++) {
            double[] col = a.getColumn(i).get();
            double[] b = col.clone();
            for (int j = 0; j < i; j++) {
                subtractProjection(b, col, q[j]);
            }

            double norm = norm(b);
            if (norm == 0d || norm <= options.orthogonalityTolerance * norm(col)) {
                if (logger.isDebugEnabled()) {
                    logger.debug("QR stopped: column {} has residual norm {}", i, norm);
                }
                return Result.failure(MatrixError.Kind.DEGENERATE,
                        "Column " + i + " is linearly dependent on the previous columns");
            }
            for (int k = 0; k < b.length; k++) b[k] /= norm;
            q[i] = b;
        }

        Matrix qm = BuildUtilities.zeros(rows, cols).orElseThrow();
        for (int i = 0; i < cols; i++)
            for (int k = 0; k < rows; k++)
                qm.set(k, i, q[i][k]);

        Matrix r = BuildUtilities.transpose(qm).multiply(a).orElseThrow();
        return Result.success(new QrDecomposition(qm, r));
    }

    // target -= (a·b / b·b) b
    private static void subtractProjection(double[] target, double[] a, double[] b) {
        double coef = dot(a, b) / dot(b, b);
        for (int k = 0; k < target.length; k++) target[k] -= coef * b[k];
    }

    private static double dot(double[] x, double[] y) {
        double s = 0d;
        for (int k = 0; k < x.length; k++) s += x[k] * y[k];
        return s;
    }

    private static double norm(double[] x) {
        return Math.sqrt(dot(x, x));
    }

    // ---- Householder ----

    /**
     * Reduces a square matrix with Householder reflections {@code P = I − 2vvᵗ},
     * replacing {@code A} by {@code P·A·P} for each leading column
     * {@code k = 0 .. n-3}.  The result is similar to the input and is
     * upper Hessenberg; a symmetric input comes out tridiagonal.  Fails with
     * {@code DIVIDE_BY_ZERO} when a column is already zero below its
     * sub-diagonal, since the reflector is then undefined.
     */
    public static Result<Matrix> householder(Matrix a) {
        if (!a.isSquare()) return notSquare("Householder", a);

        int n = a.rows();
        Matrix res = a.copy();
        Matrix eye = BuildUtilities.eye(n).orElseThrow();

        for (int k = 0; k < n - 2; k++) {
            double sub = res.get(k + 1, k);
            double alpha = -sign(sub) * norm(res.columnSlice(k + 1, n, k));
            double r = Math.sqrt(alpha * (alpha - sub) / 2d);
            if (r == 0d) {
                if (logger.isDebugEnabled()) {
                    logger.debug("Householder stopped at column {}: zero reflector", k);
                }
                return Result.failure(MatrixError.Kind.DIVIDE_BY_ZERO,
                        "Reflector for column " + k + " is undefined (r = 0)");
            }

            double[] v = new double[n];
            v[k + 1] = (sub - alpha) / (2d * r);
            for (int i = k + 2; i < n; i++) v[i] = res.get(i, k) / (2d * r);

            Matrix vm = Matrix.build(v, n, 1).orElseThrow();
            Matrix p = vm.multiply(BuildUtilities.transpose(vm))
                    .flatMap(vvt -> eye.subtract(vvt.multiply(2d)))
                    .orElseThrow();
            res = p.multiply(res).flatMap(pa -> pa.multiply(p)).orElseThrow();
        }
        return Result.success(res);
    }

    private static double sign(double x) {
        return x >= 0 ? 1d : -1d;
    }

    private static <T> Result<T> notSquare(String op, Matrix a) {
        return Result.failure(MatrixError.Kind.INVALID_OPERATION,
                op + " requires a square matrix, got " + a.rows() + "x" + a.cols());
    }
}
