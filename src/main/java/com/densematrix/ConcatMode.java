package com.densematrix;

/** How {@link BuildUtilities#concat} joins two matrices. */
public enum ConcatMode {
    /** Stack the second matrix's rows under the first's; column counts must match. */
    ROWS,
    /** Append each row of the second matrix to the same row of the first; row counts must match. */
    COLUMNS
}
