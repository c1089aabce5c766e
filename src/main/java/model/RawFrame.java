package model;

import java.util.Objects;

/** One mosaiced sensor readout with its acquisition identifier and CFA layout. */
public record RawFrame(PixelBuffer pixels, String identifier, CfaPattern cfaPattern) implements Identified {

    public RawFrame {
        Objects.requireNonNull(pixels, "pixels");
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(cfaPattern, "cfaPattern");
    }

    public int width() {
        return pixels.width();
    }

    public int height() {
        return pixels.height();
    }
}
