package com.densematrix;

public final class OptionsParser {

    private OptionsParser() {}

    public static RunConfig parse(String[] args) {
        RunConfig.Builder b = new RunConfig.Builder();
        String input = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-det": b.operation(RunConfig.Operation.DET); break;
                case "-detlu": b.operation(RunConfig.Operation.DET_LU); break;
                case "-plu": b.operation(RunConfig.Operation.PLU); break;
                case "-lu": b.operation(RunConfig.Operation.LU); break;
                case "-qr": b.operation(RunConfig.Operation.QR); break;
                case "-householder": b.operation(RunConfig.Operation.HOUSEHOLDER); break;
                case "-transpose": b.operation(RunConfig.Operation.TRANSPOSE); break;
                case "-tol": b.pivotTolerance(Double.parseDouble(value(args, ++i, a))); break;
                case "-qrtol": b.orthogonalityTolerance(Double.parseDouble(value(args, ++i, a))); break;
                case "-precision": b.precision(Integer.parseInt(value(args, ++i, a))); break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (input != null) throw new IllegalArgumentException("Multiple inputs: " + a);
                    input = a;
            }
        }
        if (input == null) throw new IllegalArgumentException("Missing input file");
        return b.inputPath(input).build();
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }
}
