package io;

import model.ColorImage;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes results as PNG, creating parent directories as needed. */
public final class ImageWriter {

    private ImageWriter() {
    }

    public static Path writePng(ColorImage img, Path out) throws IOException {
        Path abs = out.toAbsolutePath();
        if (abs.getParent() != null)
            Files.createDirectories(abs.getParent());
        if (!ImageIO.write(img.toBufferedImage(), "png", abs.toFile()))
            throw new IOException("No PNG writer available for " + abs);
        return abs;
    }
}
