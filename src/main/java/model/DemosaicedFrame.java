package model;

import java.util.Objects;

/** A reconstructed colour image that keeps the identifier of the frame it came from. */
public record DemosaicedFrame(String identifier, ColorImage image) implements IdentifiedImage {

    public DemosaicedFrame {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(image, "image");
    }
}
