package stages;

import model.ColorImage;
import model.RawFrame;

/** Reconstructs a 3-channel 8-bit image from one mosaiced frame. Implementations are stateless. */
public interface Demosaicer {

    ColorImage demosaic(RawFrame frame);

    /** Short name used on the command line and in logs. */
    String name();
}
