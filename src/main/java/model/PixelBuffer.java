package model;

import java.util.Arrays;

/**
 * Immutable sensor sample array: row-major, channel-last floats.
 * A single-channel buffer is the 2-D case, more channels the 3-D case.
 *
 * fullScale is the value that maps to 1.0 after normalization:
 * 255 for 8-bit sources, 1 for float sources already in [0..1].
 */
public final class PixelBuffer {

    public static final float UNSIGNED_8_FULL_SCALE = 255f;
    public static final float NORMALIZED_FULL_SCALE = 1f;

    private final int width;
    private final int height;
    private final int channels;
    private final float fullScale;
    private final float[] data;

    private PixelBuffer(int width, int height, int channels, float fullScale, float[] data) {
        if (width <= 0 || height <= 0 || channels <= 0)
            throw new IllegalArgumentException(
                    "Buffer dimensions must be positive: " + width + "x" + height + "x" + channels);
        if ((long) width * height * channels != data.length)
            throw new IllegalArgumentException("Sample count " + data.length + " does not match "
                    + width + "x" + height + "x" + channels);
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.fullScale = fullScale;
        this.data = data;
    }

    /** 8-bit samples given as ints in [0..255]; the array is copied. */
    public static PixelBuffer ofUnsigned8(int width, int height, int channels, int[] samples) {
        float[] f = new float[samples.length];
        for (int i = 0; i < samples.length; i++) {
            int v = samples[i];
            if (v < 0 || v > 255)
                throw new IllegalArgumentException("8-bit sample out of range at " + i + ": " + v);
            f[i] = v;
        }
        return new PixelBuffer(width, height, channels, UNSIGNED_8_FULL_SCALE, f);
    }

    /** 8-bit samples given as raw bytes (read unsigned); the array is copied. */
    public static PixelBuffer ofUnsigned8(int width, int height, int channels, byte[] samples) {
        float[] f = new float[samples.length];
        for (int i = 0; i < samples.length; i++)
            f[i] = samples[i] & 0xFF;
        return new PixelBuffer(width, height, channels, UNSIGNED_8_FULL_SCALE, f);
    }

    /** Float samples nominally in [0..1]; the array is copied. */
    public static PixelBuffer ofNormalized(int width, int height, int channels, float[] samples) {
        return new PixelBuffer(width, height, channels, NORMALIZED_FULL_SCALE, samples.clone());
    }

    /** Single-channel 8-bit buffer filled with one value. */
    public static PixelBuffer uniform(int width, int height, int value) {
        int[] s = new int[width * height];
        Arrays.fill(s, value);
        return ofUnsigned8(width, height, 1, s);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int channels() {
        return channels;
    }

    public float fullScale() {
        return fullScale;
    }

    public boolean isUnsigned8() {
        return fullScale == UNSIGNED_8_FULL_SCALE;
    }

    public float get(int x, int y) {
        return get(x, y, 0);
    }

    public float get(int x, int y, int c) {
        if (x < 0 || x >= width || y < 0 || y >= height || c < 0 || c >= channels)
            throw new IndexOutOfBoundsException(
                    "(" + x + "," + y + "," + c + ") outside " + width + "x" + height + "x" + channels);
        return data[(y * width + x) * channels + c];
    }

    /** Largest sample in the buffer. */
    public float max() {
        float m = Float.NEGATIVE_INFINITY;
        for (float v : data)
            if (v > m)
                m = v;
        return m;
    }

    /** Copy of the w×h sub-region whose top-left corner is (x, y). */
    public PixelBuffer region(int x, int y, int w, int h) {
        if (x < 0 || y < 0 || w <= 0 || h <= 0 || x + w > width || y + h > height)
            throw new IndexOutOfBoundsException("Region " + w + "x" + h + "@(" + x + "," + y + ") outside "
                    + width + "x" + height);
        float[] out = new float[w * h * channels];
        int rowLen = w * channels;
        for (int yy = 0; yy < h; yy++)
            System.arraycopy(data, ((y + yy) * width + x) * channels, out, yy * rowLen, rowLen);
        return new PixelBuffer(w, h, channels, fullScale, out);
    }

    /** Mean across channels; returns this when already single-channel. */
    public PixelBuffer averageChannels() {
        if (channels == 1)
            return this;
        int n = width * height;
        float[] out = new float[n];
        for (int i = 0; i < n; i++) {
            double sum = 0;
            int base = i * channels;
            for (int c = 0; c < channels; c++)
                sum += data[base + c];
            out[i] = (float) (sum / channels);
        }
        return new PixelBuffer(width, height, 1, fullScale, out);
    }

    /** Copy of the single plane. Only valid for single-channel buffers. */
    public float[] toPlane() {
        if (channels != 1)
            throw new IllegalStateException("toPlane() needs a single-channel buffer, got " + channels);
        return data.clone();
    }
}
