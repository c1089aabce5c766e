package grid;

import java.util.Arrays;
import java.util.Objects;

/**
 * Family key of an acquisition identifier: the identifier without its last three
 * underscore-delimited components.
 * <p>
 * Example: {@code ZCAM_0047_0671379941_113EBY_N0031950_01_295J} has key
 * {@code ZCAM_0047_0671379941_113EBY}.
 */
public record ClusterKey(String value) {

    public static final String SEPARATOR = "_";
    /** Length of the trailing component that marks an identifier as a grid tile. */
    public static final int TILE_SUFFIX_LENGTH = 4;
    static final int DROPPED_COMPONENTS = 3;

    public ClusterKey {
        Objects.requireNonNull(value, "value");
    }

    /** True when the identifier's last component has exactly four characters. */
    public static boolean isTileIdentifier(String identifier) {
        String[] parts = split(identifier);
        return parts[parts.length - 1].length() == TILE_SUFFIX_LENGTH;
    }

    /** Key of an identifier; fewer than four components give the empty key. */
    public static ClusterKey of(String identifier) {
        String[] parts = split(identifier);
        int keep = Math.max(0, parts.length - DROPPED_COMPONENTS);
        return new ClusterKey(String.join(SEPARATOR, Arrays.asList(parts).subList(0, keep)));
    }

    static String[] split(String identifier) {
        return identifier.split(SEPARATOR, -1);
    }

    @Override
    public String toString() {
        return value;
    }
}
