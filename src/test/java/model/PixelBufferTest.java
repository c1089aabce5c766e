package model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PixelBufferTest {

    private static PixelBuffer ramp(int w, int h) {
        int[] s = new int[w * h];
        for (int i = 0; i < s.length; i++)
            s[i] = i;
        return PixelBuffer.ofUnsigned8(w, h, 1, s);
    }

    @Test
    public void testGetIsBoundsChecked() {
        PixelBuffer b = ramp(4, 3);
        assertEquals(6f, b.get(2, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> b.get(4, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> b.get(0, -1));
        assertThrows(IndexOutOfBoundsException.class, () -> b.get(0, 0, 1));
    }

    @Test
    public void testRegionCopiesSubArea() {
        PixelBuffer r = ramp(4, 3).region(1, 1, 2, 2);
        assertEquals(2, r.width());
        assertEquals(2, r.height());
        assertEquals(5f, r.get(0, 0));
        assertEquals(10f, r.get(1, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> ramp(4, 3).region(3, 0, 2, 1));
    }

    @Test
    public void testAverageChannels() {
        PixelBuffer rgb = PixelBuffer.ofUnsigned8(2, 1, 3, new int[] { 90, 100, 110, 0, 3, 0 });
        PixelBuffer mono = rgb.averageChannels();
        assertEquals(1, mono.channels());
        assertEquals(100f, mono.get(0, 0));
        assertEquals(1f, mono.get(1, 0));
        assertEquals(PixelBuffer.UNSIGNED_8_FULL_SCALE, mono.fullScale());
    }

    @Test
    public void testRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> PixelBuffer.ofUnsigned8(2, 2, 1, new int[3]));
        assertThrows(IllegalArgumentException.class, () -> PixelBuffer.ofUnsigned8(1, 1, 1, new int[] { 256 }));
        assertThrows(IllegalArgumentException.class, () -> PixelBuffer.ofNormalized(0, 1, 1, new float[0]));
    }

    @Test
    public void testFactoriesCopyInput() {
        int[] s = { 1, 2 };
        PixelBuffer b = PixelBuffer.ofUnsigned8(2, 1, 1, s);
        s[0] = 200;
        assertEquals(1f, b.get(0, 0));
        assertTrue(b.isUnsigned8());
        assertFalse(PixelBuffer.ofNormalized(1, 1, 1, new float[] { 0.5f }).isUnsigned8());
    }
}
