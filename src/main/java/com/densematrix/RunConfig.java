package com.densematrix;

import java.util.Objects;

/** Settings for one command-line run. */
public final class RunConfig {
    public enum Operation {
        DET,            // determinant by PLU (default)
        DET_LU,         // determinant by Doolittle LU
        PLU,
        LU,
        QR,
        HOUSEHOLDER,
        TRANSPOSE
    }

    public final Operation operation;
    public final LinalgOptions options;
    public final int precision;             // significant digits printed, 0 = full Double.toString
    public final String inputPath;

    private RunConfig(Builder b) {
        this.operation = b.operation;
        this.options = b.options.build();
        this.precision = b.precision;
        this.inputPath = Objects.requireNonNull(b.inputPath, "inputPath");
    }

    public static final class Builder {
        private Operation operation = Operation.DET;
        private final LinalgOptions.Builder options = LinalgOptions.builder();
        private int precision = 0;
        private String inputPath;

        public Builder operation(Operation op){ this.operation = Objects.requireNonNull(op); return this; }
        public Builder pivotTolerance(double v){ this.options.pivotTolerance(v); return this; }
        public Builder orthogonalityTolerance(double v){ this.options.orthogonalityTolerance(v); return this; }
        public Builder precision(int v){
            if (v < 0) throw new IllegalArgumentException("precision must be >= 0, got " + v);
            this.precision = v; return this;
        }
        public Builder inputPath(String p){ this.inputPath = p; return this; }
        public RunConfig build(){ return new RunConfig(this); }
    }
}
