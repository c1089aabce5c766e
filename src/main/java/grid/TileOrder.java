package grid;

import model.Identified;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Grid position key: the numeric second-to-last underscore component of an identifier. */
public final class TileOrder {

    private TileOrder() {
    }

    /**
     * @throws IllegalArgumentException if the identifier has no second-to-last component
     *                                  or it is not an integer
     */
    public static long of(String identifier) {
        String[] parts = ClusterKey.split(identifier);
        if (parts.length < 2)
            throw new IllegalArgumentException("Identifier has no tile order component: '" + identifier + "'");
        String order = parts[parts.length - 2];
        try {
            return Long.parseLong(order);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Tile order '" + order + "' of identifier '" + identifier + "' is not numeric", e);
        }
    }

    /** Copy sorted ascending by tile order; equal orders keep their input order. */
    public static <T extends Identified> List<T> sorted(List<? extends T> members) {
        List<T> out = new ArrayList<>(members);
        out.sort(Comparator.comparingLong(m -> of(m.identifier())));
        return out;
    }
}
