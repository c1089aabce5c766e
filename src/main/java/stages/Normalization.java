package stages;

/** Divisor used to bring samples into [0..1] before interpolation. */
public enum Normalization {
    /** Divide by the buffer's full scale (255 for 8-bit, 1 for float input). */
    FULL_SCALE,
    /** Divide by the largest sample of the frame. An all-zero frame stays zero. */
    PEAK
}
