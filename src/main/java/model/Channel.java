package model;

/** Colour channels of a demosaiced image, in output order. */
public enum Channel {
    R, G, B;

    /** Channel index in an RGB / RGBA sample. */
    public int index() {
        return ordinal();
    }
}
