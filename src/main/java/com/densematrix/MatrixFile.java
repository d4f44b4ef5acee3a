package com.densematrix;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.DoubleFunction;

/**
 * Reads and writes matrices in a small line format:
 * <pre>
 * * optional comment or name lines
 * begin
 * 2 3
 * 1 2 3
 * 4 5 6
 * end
 * </pre>
 * Lines starting with {@code *} or {@code #} before {@code begin} are
 * comments; any other line there is taken as a name and ignored.
 */
public final class MatrixFile {

    private MatrixFile() {}

    public static Matrix read(Path path) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(br);
        }
    }

    public static Matrix read(Reader in) throws IOException {
        BufferedReader br = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        String line;

        boolean sawBegin = false;
        while ((line = br.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) continue;
            if (line.startsWith("*") || line.startsWith("#")) continue;
            if (line.toLowerCase(Locale.ROOT).equals("begin")) { sawBegin = true; break; }
        }
        if (!sawBegin) throw new IOException("No 'begin' line found");

        line = nextNonBlank(br);
        String[] header = line.split("\\s+");
        if (header.length != 2 || !header[0].matches("\\d+") || !header[1].matches("\\d+")) {
            throw new IOException("Expected '<rows> <cols>', got: " + line);
        }
        int m, n;
        try {
            m = Integer.parseInt(header[0]);
            n = Integer.parseInt(header[1]);
        } catch (NumberFormatException e) {
            throw new IOException("Expected '<rows> <cols>', got: " + line, e);
        }

        Matrix matrix = Matrix.read(br, m, n);

        line = nextNonBlank(br);
        if (!line.equalsIgnoreCase("end")) throw new IOException("Expected 'end', got: " + line);
        return matrix;
    }

    public static void write(Matrix matrix, PrintWriter out) throws IOException {
        write(matrix, out, Double::toString);
    }

    public static void write(Matrix matrix, PrintWriter out, DoubleFunction<String> format) throws IOException {
        out.println("begin");
        out.printf("%d %d%n", matrix.rows(), matrix.cols());
        matrix.write(out, format);
        out.println("end");
    }

    private static String nextNonBlank(BufferedReader br) throws IOException {
        String line;
        do {
            line = br.readLine();
            if (line == null) throw new IOException("Unexpected end of file");
            line = line.trim();
        } while (line.isEmpty());
        return line;
    }
}
