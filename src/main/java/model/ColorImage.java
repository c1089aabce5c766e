package model;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Immutable 8-bit RGB or RGBA raster, row-major and channel-last.
 * All derived images (crops, conversions) are copies.
 */
public final class ColorImage {

    public static final int RGB = 3;
    public static final int RGBA = 4;

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] data;

    /** The sample array is copied. */
    public ColorImage(int width, int height, int channels, byte[] samples) {
        if (channels != RGB && channels != RGBA)
            throw new IllegalArgumentException("ColorImage needs 3 or 4 channels, got " + channels);
        if (width <= 0 || height <= 0)
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        if ((long) width * height * channels != samples.length)
            throw new IllegalArgumentException("Sample count " + samples.length + " does not match "
                    + width + "x" + height + "x" + channels);
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = samples.clone();
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

    public boolean hasAlpha() {
        return channels == RGBA;
    }

    /** Sample in [0..255]. */
    public int get(int x, int y, int c) {
        if (x < 0 || x >= width || y < 0 || y >= height || c < 0 || c >= channels)
            throw new IndexOutOfBoundsException(
                    "(" + x + "," + y + "," + c + ") outside " + width + "x" + height + "x" + channels);
        return data[(y * width + x) * channels + c] & 0xFF;
    }

    /** Alpha of a pixel; 255 for RGB images. */
    public int alpha(int x, int y) {
        if (hasAlpha())
            return get(x, y, 3);
        get(x, y, 0); // bounds check
        return 0xFF;
    }

    /** Copy of the w×h sub-image whose top-left corner is (x, y). */
    public ColorImage crop(int x, int y, int w, int h) {
        if (x < 0 || y < 0 || w <= 0 || h <= 0 || x + w > width || y + h > height)
            throw new IndexOutOfBoundsException("Crop " + w + "x" + h + "@(" + x + "," + y + ") outside "
                    + width + "x" + height);
        byte[] out = new byte[w * h * channels];
        int rowLen = w * channels;
        for (int yy = 0; yy < h; yy++)
            System.arraycopy(data, ((y + yy) * width + x) * channels, out, yy * rowLen, rowLen);
        return new ColorImage(w, h, channels, out);
    }

    /** Copy of the raw samples. */
    public byte[] samples() {
        return data.clone();
    }

    /** TYPE_INT_RGB for RGB images, TYPE_INT_ARGB for RGBA images. */
    public BufferedImage toBufferedImage() {
        BufferedImage out = new BufferedImage(width, height,
                hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = (y * width + x) * channels;
                int r = data[i] & 0xFF;
                int g = data[i + 1] & 0xFF;
                int b = data[i + 2] & 0xFF;
                int a = hasAlpha() ? data[i + 3] & 0xFF : 0xFF;
                row[x] = (a << 24) | (r << 16) | (g << 8) | b;
            }
            out.setRGB(0, y, width, 1, row, 0, width);
        }
        return out;
    }

    /** Packs any BufferedImage into RGB (or RGBA when keepAlpha). */
    public static ColorImage fromBufferedImage(BufferedImage src, boolean keepAlpha) {
        int w = src.getWidth(), h = src.getHeight();
        int ch = keepAlpha ? RGBA : RGB;
        byte[] out = new byte[w * h * ch];
        int[] row = new int[w];
        int idx = 0;
        for (int y = 0; y < h; y++) {
            src.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int p = row[x];
                out[idx++] = (byte) ((p >>> 16) & 0xFF);
                out[idx++] = (byte) ((p >>> 8) & 0xFF);
                out[idx++] = (byte) (p & 0xFF);
                if (keepAlpha)
                    out[idx++] = (byte) ((p >>> 24) & 0xFF);
            }
        }
        return new ColorImage(w, h, ch, out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ColorImage))
            return false;
        ColorImage other = (ColorImage) o;
        return width == other.width && height == other.height && channels == other.channels
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * width + height) + channels) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ColorImage[" + width + "x" + height + "x" + channels + "]";
    }
}
