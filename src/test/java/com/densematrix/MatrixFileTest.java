package com.densematrix;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;

/**
 * Tests reading and writing matrices with {@link MatrixFile}.
 */
public class MatrixFileTest {

    @Test
    public void testReadWriteFile() throws IOException {
        String input = String.join(System.lineSeparator(),
                "* a 2x3 example",
                "example",
                "begin",
                "2 3",
                " 1  2.5  -3",
                "",
                " 4  0    6e-1",
                "end",
                "");
        Path temp = Files.createTempFile("matrix", ".mat");
        try {
            Files.writeString(temp, input);
            Matrix m = MatrixFile.read(temp);
            assertEquals(Matrix.build(new double[][] { { 1, 2.5, -3 }, { 4, 0, 0.6 } }).orElseThrow(), m);

            StringWriter sw = new StringWriter();
            PrintWriter pw = new PrintWriter(sw);
            MatrixFile.write(m, pw);
            pw.flush();
            String out = sw.toString();
            assertTrue(out.startsWith("begin"));
            assertTrue(out.contains("2 3"));
            assertTrue(out.trim().endsWith("end"));

            assertEquals(m, MatrixFile.read(new StringReader(out)));
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Test
    public void testMalformedInput() {
        assertThrows(IOException.class, () -> MatrixFile.read(new StringReader("2 2\n1 2\n3 4\nend\n")), "no begin");
        assertThrows(IOException.class, () -> MatrixFile.read(new StringReader("begin\n2\n1 2\nend\n")), "bad header");
        assertThrows(IOException.class, () -> MatrixFile.read(new StringReader("begin\n0 2\nend\n")), "zero rows");
        assertThrows(IOException.class, () -> MatrixFile.read(new StringReader("begin\n1 2\n1 2\n")), "no end");
        assertThrows(IOException.class, () -> MatrixFile.read(new StringReader("begin\n1 2\n1 2\n3 4\n")), "extra row");
        assertThrows(IOException.class, () -> MatrixFile.read(new StringReader("begin\n99999999999 1\n1\nend\n")),
                "row count beyond int");
        assertThrows(IOException.class, () -> MatrixFile.read(new StringReader("begin\n46341 46341\n1\nend\n")),
                "element count beyond int");
    }
}
