package model;

/** An identified colour image, the unit the grid assembler stitches. */
public interface IdentifiedImage extends Identified {
    ColorImage image();
}
