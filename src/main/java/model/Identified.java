package model;

/** Anything carrying an acquisition identifier (used for clustering and tile order). */
public interface Identified {
    String identifier();
}
