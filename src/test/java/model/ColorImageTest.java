package model;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

public class ColorImageTest {

    private static ColorImage gradient(int w, int h) {
        byte[] s = new byte[w * h * 3];
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++) {
                int i = (y * w + x) * 3;
                s[i] = (byte) x;
                s[i + 1] = (byte) y;
                s[i + 2] = (byte) 200;
            }
        return new ColorImage(w, h, ColorImage.RGB, s);
    }

    @Test
    public void testCropIsTopLeftAnchoredCopy() {
        ColorImage img = gradient(5, 4);
        ColorImage c = img.crop(1, 2, 3, 2);
        assertEquals(3, c.width());
        assertEquals(2, c.height());
        assertEquals(1, c.get(0, 0, 0));
        assertEquals(2, c.get(0, 0, 1));
        assertEquals(3, c.get(2, 1, 0));
        assertEquals(3, c.get(2, 1, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> img.crop(3, 0, 3, 1));
    }

    @Test
    public void testSamplesAreDefensiveCopies() {
        byte[] s = new byte[3];
        ColorImage img = new ColorImage(1, 1, ColorImage.RGB, s);
        s[0] = 9;
        img.samples()[0] = 9;
        assertEquals(0, img.get(0, 0, 0));
    }

    @Test
    public void testAlpha() {
        ColorImage rgb = gradient(2, 2);
        assertEquals(255, rgb.alpha(1, 1));
        ColorImage rgba = new ColorImage(1, 1, ColorImage.RGBA, new byte[] { 1, 2, 3, 0 });
        assertEquals(0, rgba.alpha(0, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> rgb.alpha(2, 0));
    }

    @Test
    public void testBufferedImageConversion() {
        ColorImage rgba = new ColorImage(1, 1, ColorImage.RGBA, new byte[] { 10, 20, 30, (byte) 255 });
        BufferedImage bi = rgba.toBufferedImage();
        assertEquals(BufferedImage.TYPE_INT_ARGB, bi.getType());
        assertEquals(0xFF0A141E, bi.getRGB(0, 0));
        assertEquals(rgba, ColorImage.fromBufferedImage(bi, true));
    }

    @Test
    public void testRejectsBadChannelCount() {
        assertThrows(IllegalArgumentException.class, () -> new ColorImage(1, 1, 2, new byte[2]));
        assertThrows(IllegalArgumentException.class, () -> new ColorImage(2, 1, 3, new byte[3]));
    }
}
