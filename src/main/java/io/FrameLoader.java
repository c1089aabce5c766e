package io;

import model.CfaPattern;
import model.PixelBuffer;
import model.RawFrame;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Reads mosaiced frames from ordinary image files.
 * Gray files give a 2-D buffer; colour files keep their R, G, B bands so the demosaicers
 * average them. The identifier is the file name without extension.
 */
public final class FrameLoader {

    private static final Logger logger = LoggerFactory.getLogger(FrameLoader.class);

    private static final List<String> EXTENSIONS = List.of(".png", ".jpg", ".jpeg", ".bmp", ".gif");

    private FrameLoader() {
    }

    public static RawFrame load(Path input, CfaPattern pattern) throws IOException {
        BufferedImage img;
        try (InputStream in = Files.newInputStream(input)) {
            img = ImageIO.read(in);
        } catch (IOException e) {
            throw new IOException("Failed to read frame: " + input + ": " + e.getMessage(), e);
        }
        if (img == null)
            throw new IOException("No ImageIO reader understands " + input);

        RawFrame frame = new RawFrame(toPixelBuffer(img), identifierOf(input), pattern);
        logger.debug("Loaded {} ({}x{}x{})", frame.identifier(), frame.width(), frame.height(),
                frame.pixels().channels());
        return frame;
    }

    /** Every readable image in the directory, sorted by file name. */
    public static List<RawFrame> loadDirectory(Path dir, CfaPattern pattern) throws IOException {
        if (!Files.isDirectory(dir))
            throw new IOException("Not a directory: " + dir);

        List<Path> files;
        try (Stream<Path> s = Files.list(dir)) {
            files = s.filter(Files::isRegularFile).filter(FrameLoader::isImageFile).sorted().toList();
        }
        List<RawFrame> frames = new ArrayList<>(files.size());
        for (Path p : files)
            frames.add(load(p, pattern));
        logger.info("Loaded {} frames from {}", frames.size(), dir);
        return frames;
    }

    static boolean isImageFile(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    static String identifierOf(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /** 8-bit gray plane for gray images, R, G, B bands for everything else. */
    static PixelBuffer toPixelBuffer(BufferedImage img) {
        int w = img.getWidth(), h = img.getHeight();
        int type = img.getType();
        if (type == BufferedImage.TYPE_BYTE_GRAY || type == BufferedImage.TYPE_USHORT_GRAY) {
            Raster r = img.getRaster();
            int shift = type == BufferedImage.TYPE_USHORT_GRAY ? 8 : 0;
            int[] samples = new int[w * h];
            for (int y = 0; y < h; y++)
                for (int x = 0; x < w; x++)
                    samples[y * w + x] = r.getSample(x, y, 0) >> shift;
            return PixelBuffer.ofUnsigned8(w, h, 1, samples);
        }

        int[] samples = new int[w * h * 3];
        int[] row = new int[w];
        int idx = 0;
        for (int y = 0; y < h; y++) {
            img.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int p = row[x];
                samples[idx++] = (p >>> 16) & 0xFF;
                samples[idx++] = (p >>> 8) & 0xFF;
                samples[idx++] = p & 0xFF;
            }
        }
        return PixelBuffer.ofUnsigned8(w, h, 3, samples);
    }
}
