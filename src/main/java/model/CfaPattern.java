package model;

import java.util.Locale;

/**
 * 2×2 Bayer tile, read row-major: (0,0), (0,1), (1,0), (1,1).
 * Both demosaicers take their site layout from here.
 */
public enum CfaPattern {
    RGGB(Channel.R, Channel.G, Channel.G, Channel.B),
    BGGR(Channel.B, Channel.G, Channel.G, Channel.R),
    GRBG(Channel.G, Channel.R, Channel.B, Channel.G),
    GBRG(Channel.G, Channel.B, Channel.R, Channel.G);

    private final Channel[] tile;

    CfaPattern(Channel c00, Channel c01, Channel c10, Channel c11) {
        this.tile = new Channel[] { c00, c01, c10, c11 };
    }

    /** Channel recorded at the given sensor site. */
    public Channel channelAt(int row, int col) {
        return tile[((row & 1) << 1) | (col & 1)];
    }

    /**
     * Parse a 4-letter tag such as "rggb".
     *
     * @throws IllegalArgumentException for anything that is not one of the four layouts
     */
    public static CfaPattern parse(String tag) {
        if (tag == null)
            throw new IllegalArgumentException("CFA pattern tag is null");
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown CFA pattern: '" + tag + "' (expected RGGB, BGGR, GRBG or GBRG)", e);
        }
    }
}
