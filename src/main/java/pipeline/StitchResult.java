package pipeline;

import grid.ClusterKey;
import model.ColorImage;

import java.util.List;

/**
 * Output of one assembled family: a single grid image, or 16 layers when layered.
 */
public record StitchResult(ClusterKey key, boolean layered, List<ColorImage> images) {

    public StitchResult {
        images = List.copyOf(images);
    }

    /** The composite of a grid-mode result. */
    public ColorImage grid() {
        if (layered)
            throw new IllegalStateException("Layered result for " + key + " has no single grid image");
        return images.get(0);
    }
}
