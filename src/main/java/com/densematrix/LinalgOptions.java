package com.densematrix;

/** Numeric thresholds for {@link Linalg}. */
public final class LinalgOptions {
    public static final double DEFAULT_PIVOT_TOLERANCE = 1e-15;
    public static final double DEFAULT_ORTHOGONALITY_TOLERANCE = 1e-10;

    public static final LinalgOptions DEFAULTS = new Builder().build();

    public final double pivotTolerance;            // PLU: |pivot| below this means singular
    public final double orthogonalityTolerance;    // QR: residual/original column norm at or below this means dependent

    private LinalgOptions(Builder b) {
        this.pivotTolerance = b.pivotTolerance;
        this.orthogonalityTolerance = b.orthogonalityTolerance;
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder().pivotTolerance(pivotTolerance).orthogonalityTolerance(orthogonalityTolerance);
    }

    @Override public String toString() {
        return "LinalgOptions{pivotTolerance=" + pivotTolerance
                + ", orthogonalityTolerance=" + orthogonalityTolerance + "}";
    }

    public static final class Builder {
        private double pivotTolerance = DEFAULT_PIVOT_TOLERANCE;
        private double orthogonalityTolerance = DEFAULT_ORTHOGONALITY_TOLERANCE;

        public Builder pivotTolerance(double v){ this.pivotTolerance = requireTolerance(v, "pivotTolerance"); return this; }
        public Builder orthogonalityTolerance(double v){ this.orthogonalityTolerance = requireTolerance(v, "orthogonalityTolerance"); return this; }
        public LinalgOptions build(){ return new LinalgOptions(this); }

        private static double requireTolerance(double v, String name) {
            if (!(v >= 0) || Double.isInfinite(v)) throw new IllegalArgumentException(name + " must be finite and >= 0, got " + v);
            return v;
        }
    }
}
