package stages;

/**
 * 3×3 neighbourhood filters on single planes (row-major, width × height).
 * Pure Java, no external deps. All methods return a NEW array.
 */
public final class PlaneFilters {

    private PlaneFilters() {
    }

    // ---------------- Core helpers ----------------

    static int clamp8(double v) {
        if (v <= 0)
            return 0;
        if (v >= 255)
            return 255;
        return (int) v;
    }

    private static void checkPlane(int length, int w, int h) {
        if (w <= 0 || h <= 0 || length != w * h)
            throw new IllegalArgumentException("plane of length " + length + " is not " + w + "x" + h);
    }

    // ---------------- Convolution ----------------

    /**
     * 3×3 convolution with an integer row-major kernel of length 9.
     * Returns the raw weighted sums; the caller applies the kernel divisor.
     */
    public static double[] convolve3x3(float[] plane, int w, int h, int[] k, BorderMode border) {
        if (k == null || k.length != 9)
            throw new IllegalArgumentException("kernel must be length 9");
        checkPlane(plane.length, w, h);

        double[] out = new double[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double acc = 0;
                int t = 0;
                for (int j = -1; j <= 1; j++) {
                    int yy = border.resolve(y + j, h);
                    for (int i = -1; i <= 1; i++, t++) {
                        if (k[t] == 0 || yy < 0)
                            continue;
                        int xx = border.resolve(x + i, w);
                        if (xx < 0)
                            continue;
                        acc += k[t] * (double) plane[yy * w + xx];
                    }
                }
                out[y * w + x] = acc;
            }
        }
        return out;
    }

    // ---------------- Morphology ----------------

    /**
     * Grey dilation restricted to unsampled sites: every site with sampled[i] == false takes
     * the maximum of the sampled sites in its 3×3 neighbourhood (0 if there are none).
     * Sampled sites keep their own value.
     */
    public static int[] maxFill3x3(int[] plane, boolean[] sampled, int w, int h) {
        checkPlane(plane.length, w, h);
        checkPlane(sampled.length, w, h);

        int[] out = plane.clone();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (sampled[idx])
                    continue;
                int m = 0;
                for (int yy = Math.max(0, y - 1); yy <= Math.min(h - 1, y + 1); yy++) {
                    for (int xx = Math.max(0, x - 1); xx <= Math.min(w - 1, x + 1); xx++) {
                        int n = yy * w + xx;
                        if (sampled[n] && plane[n] > m)
                            m = plane[n];
                    }
                }
                out[idx] = m;
            }
        }
        return out;
    }
}
