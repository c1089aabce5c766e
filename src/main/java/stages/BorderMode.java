package stages;

/** How 3×3 neighbourhoods are completed past the image edge. */
public enum BorderMode {
    /** Outside samples read as 0. */
    ZERO,
    /**
     * Whole-sample mirror: -1 reads 1, n reads n-2.
     * Keeps row/column parity, so CFA sites mirror onto sites of the same colour.
     * A dimension of length 1 has nothing to mirror onto; its outside samples are skipped.
     */
    MIRROR;

    /** Mirrored index, or -1 when the sample lies outside and cannot be mirrored (ZERO, or n == 1). */
    int resolve(int i, int n) {
        if (i >= 0 && i < n)
            return i;
        if (this == ZERO)
            return -1;
        if (n == 1)
            return -1;
        return i < 0 ? -i : 2 * n - 2 - i;
    }
}
