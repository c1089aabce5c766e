package io;

import model.CfaPattern;
import model.ColorImage;
import model.RawFrame;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FrameLoaderTest {

    @TempDir
    Path dir;

    private Path writeGray(String name, int w, int h, int value) throws IOException {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++)
                img.getRaster().setSample(x, y, 0, value + x);
        Path p = dir.resolve(name);
        ImageIO.write(img, "png", p.toFile());
        return p;
    }

    @Test
    public void testGrayPngLoadsAsSinglePlane() throws Exception {
        Path p = writeGray("CAM_0001_N01_03_ABCD.png", 4, 2, 50);

        RawFrame f = FrameLoader.load(p, CfaPattern.GRBG);

        assertEquals("CAM_0001_N01_03_ABCD", f.identifier());
        assertEquals(CfaPattern.GRBG, f.cfaPattern());
        assertEquals(1, f.pixels().channels());
        assertEquals(4, f.width());
        assertEquals(2, f.height());
        assertEquals(53f, f.pixels().get(3, 1));
    }

    @Test
    public void testColourPngKeepsThreeBands() throws Exception {
        BufferedImage img = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        img.setRGB(0, 0, 0x0A141E);
        Path p = dir.resolve("colour.png");
        ImageIO.write(img, "png", p.toFile());

        RawFrame f = FrameLoader.load(p, CfaPattern.RGGB);

        assertEquals(3, f.pixels().channels());
        assertEquals(10f, f.pixels().get(0, 0, 0));
        assertEquals(20f, f.pixels().get(0, 0, 1));
        assertEquals(30f, f.pixels().get(0, 0, 2));
    }

    @Test
    public void testDirectoryIsFilteredAndSorted() throws Exception {
        writeGray("b_01_ABCD.png", 2, 2, 0);
        writeGray("a_02_ABCD.PNG", 2, 2, 0);
        Files.writeString(dir.resolve("notes.txt"), "not an image");

        List<RawFrame> frames = FrameLoader.loadDirectory(dir, CfaPattern.RGGB);

        assertEquals(2, frames.size());
        assertEquals("a_02_ABCD", frames.get(0).identifier());
        assertEquals("b_01_ABCD", frames.get(1).identifier());
    }

    @Test
    public void testUnreadableInputs() throws Exception {
        Path bogus = dir.resolve("bogus.png");
        Files.writeString(bogus, "definitely not a png");
        assertThrows(IOException.class, () -> FrameLoader.load(bogus, CfaPattern.RGGB));
        assertThrows(IOException.class, () -> FrameLoader.load(dir.resolve("missing.png"), CfaPattern.RGGB));
        assertThrows(IOException.class, () -> FrameLoader.loadDirectory(dir.resolve("nope"), CfaPattern.RGGB));
    }

    @Test
    public void testWritePngRoundTripsRgba() throws Exception {
        ColorImage img = new ColorImage(2, 1, ColorImage.RGBA, new byte[] { 1, 2, 3, (byte) 255, 4, 5, 6, 0 });
        Path out = ImageWriter.writePng(img, dir.resolve("sub/out.png"));

        BufferedImage back = ImageIO.read(out.toFile());
        assertEquals(img, ColorImage.fromBufferedImage(back, true));
    }
}
