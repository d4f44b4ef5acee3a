package com.densematrix;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class LinalgOptionsTest {

    @Test
    public void testDefaults() {
        assertEquals(1e-15, LinalgOptions.DEFAULTS.pivotTolerance);
        assertEquals(1e-10, LinalgOptions.DEFAULTS.orthogonalityTolerance);
    }

    @Test
    public void testBuilder() {
        LinalgOptions o = LinalgOptions.builder().pivotTolerance(1e-8).orthogonalityTolerance(0).build();
        assertEquals(1e-8, o.pivotTolerance);
        assertEquals(0.0, o.orthogonalityTolerance);

        LinalgOptions copy = o.toBuilder().pivotTolerance(1e-3).build();
        assertEquals(1e-3, copy.pivotTolerance);
        assertEquals(0.0, copy.orthogonalityTolerance);
        assertEquals(1e-8, o.pivotTolerance, "original unchanged");
    }

    @Test
    public void testInvalidTolerances() {
        LinalgOptions.Builder b = LinalgOptions.builder();
        assertThrows(IllegalArgumentException.class, () -> b.pivotTolerance(-1));
        assertThrows(IllegalArgumentException.class, () -> b.pivotTolerance(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> b.orthogonalityTolerance(Double.POSITIVE_INFINITY));
    }
}
