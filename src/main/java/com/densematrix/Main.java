package com.densematrix;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.function.DoubleFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static void usage(PrintStream err) {
        err.println(
                "Usage: densematrix [options] <matrix-file>\n" +
                        "Operations:\n" +
                        "  -det          determinant by pivoted LU  [default]\n" +
                        "  -detlu        determinant by Doolittle LU\n" +
                        "  -plu          pivoted LU (packed LU matrix + permutation)\n" +
                        "  -lu           Doolittle LU (L and U)\n" +
                        "  -qr           Gram-Schmidt QR (Q and R)\n" +
                        "  -householder  Householder reduction\n" +
                        "  -transpose    transpose\n" +
                        "Options:\n" +
                        "  -tol X        pivot tolerance for PLU (default 1e-15)\n" +
                        "  -qrtol X      relative zero-norm tolerance for QR (default 1e-10)\n" +
                        "  -precision N  significant digits to print (0 = full)\n"
        );
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        RunConfig config;
        try {
            config = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage(err);
            err.println("Argument error: " + e.getMessage());
            return EXIT_USAGE;
        }

        long t0 = System.nanoTime();
        try {
            Matrix input = MatrixFile.read(Paths.get(config.inputPath));
            PrintWriter pw = new PrintWriter(out, true);
            Result<?> outcome = execute(config, input, pw, formatter(config.precision));
            pw.flush();

            if (logger.isDebugEnabled()) {
                logger.debug("{} on {}x{} took {} ms", config.operation, input.rows(), input.cols(),
                        (System.nanoTime() - t0) / 1_000_000);
            }
            if (outcome.isFailure()) {
                logger.warn("{} failed: {}", config.operation, outcome.error());
                err.println("Error: " + outcome.error().message());
                return EXIT_FAILURE;
            }
            return EXIT_OK;
        } catch (NoSuchFileException e) {
            err.println("File not found: " + config.inputPath);
            return EXIT_FAILURE;
        } catch (IOException e) {
            logger.warn("Could not read {}", config.inputPath, e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static Result<?> execute(RunConfig config, Matrix a, PrintWriter out, DoubleFunction<String> fmt)
            throws IOException {
        switch (config.operation) {
            case DET: {
                Result<Double> det = Linalg.determinantByPlu(a, config.options);
                if (det.isSuccess()) out.println("det = " + fmt.apply(det.get()));
                return det;
            }
            case DET_LU: {
                Result<Double> det = Linalg.determinant(a);
                if (det.isSuccess()) out.println("det = " + fmt.apply(det.get()));
                return det;
            }
            case PLU: {
                Result<PluDecomposition> plu = Linalg.plu(a, config.options);
                if (plu.isSuccess()) {
                    PluDecomposition d = plu.get();
                    printNamed(out, "LU", d.lu(), fmt);
                    StringBuilder sb = new StringBuilder("permutation");
                    int[] p = d.permutation();
                    for (int i = 0; i < p.length - 1; i++) sb.append(' ').append(p[i]);
                    out.println(sb);
                    out.println("swaps " + d.swapCount());
                }
                return plu;
            }
            case LU: {
                Result<LuDecomposition> lu = Linalg.doolittleLu(a);
                if (lu.isSuccess()) {
                    printNamed(out, "L", lu.get().l(), fmt);
                    printNamed(out, "U", lu.get().u(), fmt);
                }
                return lu;
            }
            case QR: {
                Result<QrDecomposition> qr = Linalg.qr(a, config.options);
                if (qr.isSuccess()) {
                    printNamed(out, "Q", qr.get().q(), fmt);
                    printNamed(out, "R", qr.get().r(), fmt);
                }
                return qr;
            }
            case HOUSEHOLDER: {
                Result<Matrix> h = Linalg.householder(a);
                if (h.isSuccess()) printNamed(out, "H", h.get(), fmt);
                return h;
            }
            case TRANSPOSE: {
                Matrix t = BuildUtilities.transpose(a);
                printNamed(out, "T", t, fmt);
                return Result.success(t);
            }
            default:
                throw new IllegalStateException("Unhandled operation " + config.operation);
        }
    }

    private static void printNamed(PrintWriter out, String name, Matrix m, DoubleFunction<String> fmt)
            throws IOException {
        out.println("* " + name);
        MatrixFile.write(m, out, fmt);
    }

    static DoubleFunction<String> formatter(int precision) {
        if (precision == 0) return Double::toString;
        String pattern = "%." + precision + "g";
        return x -> String.format(Locale.ROOT, pattern, x);
    }
}
