package com.densematrix;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.DoubleFunction;
import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;

/**
 * A dense {@code rows × cols} matrix of doubles, stored row-major.  Rows
 * and columns are indexed from zero and both counts are always positive.
 *
 * <p>Instances are only created through {@link #build(double[][])} and
 * {@link #build(double[], int, int)}, which copy their input.  The shape
 * never changes after construction; element values can be changed through
 * {@link #set}, {@link #trySet}, {@link #swapRows} and {@link #mapFor}.
 * Every accessor that hands out rows, columns or blocks returns a fresh
 * copy, so the backing store is only ever shared through this object.
 * Use {@link #copy()} for an independent matrix.
 *
 * <p>Not thread-safe: the mutators above write straight into the backing
 * store.
 */
public final class Matrix implements Iterable<double[]> {
    private static final int ELIDE_ABOVE = 10;
    private static final int ELIDE_KEEP = 4;

    private final int rows;
    private final int cols;
    private final double[][] data;

    // takes ownership of data; callers must have validated it
    private Matrix(double[][] data) {
        this.rows = data.length;
        this.cols = data[0].length;
        this.data = data;
    }

    /**
     * Builds a matrix from a copy of {@code rows}.  Empty when there are no
     * rows, when a row is empty, or when two rows differ in length.
     */
    public static Optional<Matrix> build(double[][] rows) {
        Objects.requireNonNull(rows, "rows");
        if (rows.length == 0) return Optional.empty();
        int width = Objects.requireNonNull(rows[0], "row 0").length;
        if (width == 0) return Optional.empty();
        for (int i = 1; i < rows.length; i++) {
            if (Objects.requireNonNull(rows[i], "row " + i).length != width) return Optional.empty();
        }
        return Optional.of(new Matrix(copyOf(rows)));
    }

    /**
     * Builds a {@code rowCount × columnCount} matrix by slicing {@code flat}
     * row after row.  Empty unless both counts are positive and their
     * product equals {@code flat.length}.
     */
    public static Optional<Matrix> build(double[] flat, int rowCount, int columnCount) {
        Objects.requireNonNull(flat, "flat");
        if (rowCount <= 0 || columnCount <= 0 || (long) rowCount * columnCount != flat.length) {
            return Optional.empty();
        }
        double[][] d = new double[rowCount][];
        for (int i = 0; i < rowCount; i++) {
            d[i] = Arrays.copyOfRange(flat, i * columnCount, (i + 1) * columnCount);
        }
        return Optional.of(new Matrix(d));
    }

    /** Returns the number of rows. */
    public int rows() { return rows; }

    /** Returns the number of columns. */
    public int cols() { return cols; }

    /** Returns {@code {rows, cols}}. */
    public int[] shape() { return new int[] { rows, cols }; }

    public boolean isSquare() { return rows == cols; }

    // ---- element access ----

    /** Unchecked read; an invalid index raises {@link ArrayIndexOutOfBoundsException}. */
    public double get(int r, int c) {
        return data[r][c];
    }

    /** Unchecked write into the backing store. */
    public void set(int r, int c, double value) {
        data[r][c] = value;
    }

    /** Checked read; the failure names the offending row or column index. */
    public Result<Double> tryGet(int r, int c) {
        if (!inRange(r, rows)) return Result.failure(MatrixError.indexOutOfRange(r, "Row index out of matrix sizes"));
        if (!inRange(c, cols)) return Result.failure(MatrixError.indexOutOfRange(c, "Column index out of matrix sizes"));
        return Result.success(data[r][c]);
    }

    /** Checked write; returns this matrix on success. */
    public Result<Matrix> trySet(int r, int c, double value) {
        if (!inRange(r, rows)) return Result.failure(MatrixError.indexOutOfRange(r, "Row index out of matrix sizes"));
        if (!inRange(c, cols)) return Result.failure(MatrixError.indexOutOfRange(c, "Column index out of matrix sizes"));
        data[r][c] = value;
        return Result.success(this);
    }

    // ---- range access (half-open ranges, always copies) ----

    /** Columns {@code [fromCol, toCol)} of row {@code row}. */
    public double[] rowSlice(int row, int fromCol, int toCol) {
        checkRange(fromCol, toCol, cols);
        return Arrays.copyOfRange(data[row], fromCol, toCol);
    }

    /** Rows {@code [fromRow, toRow)} of column {@code col}. */
    public double[] columnSlice(int fromRow, int toRow, int col) {
        checkRange(fromRow, toRow, rows);
        double[] out = new double[toRow - fromRow];
        for (int i = fromRow; i < toRow; i++) out[i - fromRow] = data[i][col];
        return out;
    }

    /** Rows {@code [fromRow, toRow)} in full. */
    public double[][] rowRange(int fromRow, int toRow) {
        return block(fromRow, toRow, 0, cols);
    }

    /** The block of rows {@code [fromRow, toRow)} and columns {@code [fromCol, toCol)}. */
    public double[][] block(int fromRow, int toRow, int fromCol, int toCol) {
        checkRange(fromRow, toRow, rows);
        checkRange(fromCol, toCol, cols);
        double[][] out = new double[toRow - fromRow][];
        for (int i = fromRow; i < toRow; i++) out[i - fromRow] = Arrays.copyOfRange(data[i], fromCol, toCol);
        return out;
    }

    public Result<double[]> getRow(int n) {
        if (!inRange(n, rows)) return Result.failure(MatrixError.indexOutOfRange(n, "Row index not in range"));
        return Result.success(data[n].clone());
    }

    public Result<double[]> getColumn(int n) {
        if (!inRange(n, cols)) return Result.failure(MatrixError.indexOutOfRange(n, "Column index not in range"));
        double[] out = new double[rows];
        for (int i = 0; i < rows; i++) out[i] = data[i][n];
        return Result.success(out);
    }

    /** The main diagonal; fails with {@code INVALID_OPERATION} unless square. */
    public Result<double[]> getDiag() {
        if (!isSquare()) {
            return Result.failure(MatrixError.Kind.INVALID_OPERATION,
                    "Diagonal is only defined for a square matrix, got " + rows + "x" + cols);
        }
        double[] out = new double[rows];
        for (int i = 0; i < rows; i++) out[i] = data[i][i];
        return Result.success(out);
    }

    // ---- mutation ----

    /** Swaps two rows in place; returns this matrix on success. */
    public Result<Matrix> swapRows(int i, int j) {
        if (!inRange(i, rows)) return Result.failure(MatrixError.indexOutOfRange(i, "Row index out of rows count"));
        if (!inRange(j, rows)) return Result.failure(MatrixError.indexOutOfRange(j, "Row index out of rows count"));
        double[] t = data[i];
        data[i] = data[j];
        data[j] = t;
        return Result.success(this);
    }

    /** Replaces, in place and row-major, every element matching {@code predicate} by {@code f} of it. */
    public void mapFor(DoublePredicate predicate, DoubleUnaryOperator f) {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(f, "f");
        for (double[] row : data) {
            for (int j = 0; j < cols; j++) {
                if (predicate.test(row[j])) row[j] = f.applyAsDouble(row[j]);
            }
        }
    }

    public Matrix copy() {
        return new Matrix(copyOf(data));
    }

    /** Same elements, read row-major, laid out as {@code nrows × ncols}. */
    public Optional<Matrix> reshape(int nrows, int ncols) {
        return build(flatten(), nrows, ncols);
    }

    /** Row-major copy of all elements. */
    public double[] flatten() {
        double[] flat = new double[rows * cols];
        for (int i = 0; i < rows; i++) System.arraycopy(data[i], 0, flat, i * cols, cols);
        return flat;
    }

    /** Deep copy of the backing store. */
    public double[][] toArray() {
        return copyOf(data);
    }

    // ---- arithmetic; none of these modify this matrix ----

    /** Elementwise sum; empty unless both shapes are equal. */
    public Optional<Matrix> add(Matrix other) {
        if (!sameShape(other)) return Optional.empty();
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++)
            for (int j = 0; j < cols; j++)
                out[i][j] = data[i][j] + other.data[i][j];
        return Optional.of(new Matrix(out));
    }

    public Matrix add(double s) {
        return elementwise(x -> x + s);
    }

    /** Elementwise difference; empty unless both shapes are equal. */
    public Optional<Matrix> subtract(Matrix other) {
        if (!sameShape(other)) return Optional.empty();
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++)
            for (int j = 0; j < cols; j++)
                out[i][j] = data[i][j] - other.data[i][j];
        return Optional.of(new Matrix(out));
    }

    public Matrix subtract(double s) {
        return elementwise(x -> x - s);
    }

    /** {@code s - this}. */
    public Matrix subtractFrom(double s) {
        return elementwise(x -> s - x);
    }

    public Matrix negate() {
        return elementwise(x -> -x);
    }

    /**
     * Matrix product {@code this · other}; empty unless
     * {@code this.cols() == other.rows()}.
     */
    public Optional<Matrix> multiply(Matrix other) {
        if (cols != other.rows) return Optional.empty();
        double[][] out = new double[rows][other.cols];
        for (int i = 0; i < rows; i++) {
            double[] a = data[i];
            double[] res = out[i];
            for (int k = 0; k < cols; k++) {
                double aik = a[k];
                double[] b = other.data[k];
                for (int j = 0; j < other.cols; j++) res[j] += aik * b[j];
            }
        }
        return Optional.of(new Matrix(out));
    }

    public Matrix multiply(double s) {
        return elementwise(x -> x * s);
    }

    /**
     * Returns a new matrix with the rows stably sorted by {@code key}.
     * Rows with equal keys keep their relative order in both directions.
     */
    public <K extends Comparable<? super K>> Matrix sortBy(Function<double[], K> key, boolean descending) {
        Objects.requireNonNull(key, "key");
        double[][] out = copyOf(data);
        Comparator<double[]> cmp = Comparator.comparing(key);
        Arrays.sort(out, descending ? cmp.reversed() : cmp);
        return new Matrix(out);
    }

    public <K extends Comparable<? super K>> Matrix sortBy(Function<double[], K> key) {
        return sortBy(key, false);
    }

    // ---- text I/O ----

    /**
     * Reads {@code m} non-blank lines of {@code n} whitespace-separated
     * numbers each.  The caller consumes any header before calling this.
     */
    public static Matrix read(BufferedReader reader, int m, int n) throws IOException {
        if (m <= 0 || n <= 0) throw new IOException("Matrix sizes must be positive, got " + m + "x" + n);
        if ((long) m * n > Integer.MAX_VALUE) throw new IOException("Matrix of " + m + "x" + n + " is too large");
        double[] flat = new double[m * n];
        for (int i = 0; i < m; i++) {
            String line;
            do {
                line = reader.readLine();
                if (line == null) {
                    throw new IOException("Unexpected end of file while reading matrix");
                }
                line = line.trim();
            } while (line.isEmpty());
            String[] tokens = line.split("\\s+");
            if (tokens.length != n) {
                throw new IOException("Expected " + n + " columns on line " + (i + 1));
            }
            for (int j = 0; j < n; j++) {
                try {
                    flat[i * n + j] = Double.parseDouble(tokens[j]);
                } catch (NumberFormatException e) {
                    throw new IOException("Bad number '" + tokens[j] + "' on line " + (i + 1), e);
                }
            }
        }
        return build(flat, m, n).orElseThrow();
    }

    /** Writes one row per line, values separated by a single space. */
    public void write(Writer out) throws IOException {
        write(out, Double::toString);
    }

    public void write(Writer out, DoubleFunction<String> format) throws IOException {
        for (int i = 0; i < rows; i++) {
            StringBuilder sb = new StringBuilder();
            for (int j = 0; j < cols; j++) {
                if (j > 0) sb.append(' ');
                sb.append(format.apply(data[i][j]));
            }
            out.write(sb.toString());
            out.write(System.lineSeparator());
        }
    }

    // ---- Iterable ----

    /** Iterates over copies of the rows. */
    @Override public Iterator<double[]> iterator() {
        return new Iterator<>() {
            private int next = 0;
            @Override public boolean hasNext() { return next < rows; }
            @Override public double[] next() {
                if (next >= rows) throw new NoSuchElementException();
                return data[next++].clone();
            }
        };
    }

    // ---- Object ----

    /** Same shape and every element equal; no tolerance, {@code 0.0 == -0.0}, NaN equals NaN. */
    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Matrix)) return false;
        Matrix o = (Matrix) obj;
        if (!sameShape(o)) return false;
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                double a = data[i][j], b = o.data[i][j];
                if (a != b && !(Double.isNaN(a) && Double.isNaN(b))) return false;
            }
        }
        return true;
    }

    @Override public int hashCode() {
        int h = 31 * rows + cols;
        for (double[] row : data) {
            for (double x : row) h = 31 * h + Double.hashCode(x + 0.0); // folds -0.0 into 0.0
        }
        return h;
    }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Matrix size = ").append(rows).append('x').append(cols).append(System.lineSeparator());
        sb.append(System.lineSeparator());
        for (int i = 0; i < rows; i++) {
            if (rows > ELIDE_ABOVE && i == ELIDE_KEEP) {
                sb.append("...").append(System.lineSeparator());
                i = rows - ELIDE_KEEP;
            }
            sb.append('[').append(rowToString(data[i])).append(']').append(System.lineSeparator());
        }
        return sb.toString();
    }

    private static String rowToString(double[] row) {
        StringBuilder sb = new StringBuilder();
        for (int j = 0; j < row.length; j++) {
            if (row.length > ELIDE_ABOVE && j == ELIDE_KEEP) {
                sb.append(", ...");
                j = row.length - ELIDE_KEEP;
            }
            if (j > 0) sb.append(", ");
            sb.append(row[j]);
        }
        return sb.toString();
    }

    // ---- helpers ----

    private Matrix elementwise(DoubleUnaryOperator f) {
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++)
            for (int j = 0; j < cols; j++)
                out[i][j] = f.applyAsDouble(data[i][j]);
        return new Matrix(out);
    }

    private boolean sameShape(Matrix o) {
        return rows == o.rows && cols == o.cols;
    }

    private static boolean inRange(int n, int count) {
        return n >= 0 && n < count;
    }

    private static void checkRange(int from, int to, int count) {
        if (from < 0 || to > count || from > to) {
            throw new IndexOutOfBoundsException("Range [" + from + ", " + to + ") outside [0, " + count + ")");
        }
    }

    private static double[][] copyOf(double[][] src) {
        double[][] out = new double[src.length][];
        for (int i = 0; i < src.length; i++) out[i] = src[i].clone();
        return out;
    }
}
