package grid;

import model.ColorImage;
import model.IdentifiedImage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import util.Tiles;

import java.util.ArrayList;
import java.util.List;

/**
 * Stitches a 16-frame family into a 4×4 RGBA composite.
 * <p>
 * Members are ordered by {@link TileOrder} and placed row-major. Every member is cropped
 * to the top-left min_h × min_w of the family, so cells never overlap and nothing is
 * resampled. In layer mode each of the 16 outputs is the full composite size with only
 * its own cell opaque.
 */
public final class GridAssembler {

    private static final Logger logger = LoggerFactory.getLogger(GridAssembler.class);

    public static final int GRID_SIDE = 4;
    public static final int CLUSTER_SIZE = GRID_SIDE * GRID_SIDE;

    private static final int OPAQUE = 0xFF;

    /** Cropped, ordered cells of one family and the composite size they fill. */
    private record Placement(List<Tiles.Tile> tiles, int width, int height) {
    }

    public ColorImage assembleGrid(Cluster<? extends IdentifiedImage> cluster) {
        return assembleGrid(cluster.members());
    }

    /**
     * @throws IllegalArgumentException unless there are exactly 16 members with numeric tile orders
     */
    public ColorImage assembleGrid(List<? extends IdentifiedImage> members) {
        Placement p = place(members);
        byte[] rgba = new byte[p.width() * p.height() * ColorImage.RGBA];
        for (Tiles.Tile t : p.tiles())
            Tiles.copy(t, rgba, p.width(), OPAQUE);
        return new ColorImage(p.width(), p.height(), ColorImage.RGBA, rgba);
    }

    public List<ColorImage> assembleLayers(Cluster<? extends IdentifiedImage> cluster) {
        return assembleLayers(cluster.members());
    }

    /**
     * @throws IllegalArgumentException unless there are exactly 16 members with numeric tile orders
     */
    public List<ColorImage> assembleLayers(List<? extends IdentifiedImage> members) {
        Placement p = place(members);
        List<ColorImage> layers = new ArrayList<>(CLUSTER_SIZE);
        for (Tiles.Tile t : p.tiles()) {
            byte[] rgba = new byte[p.width() * p.height() * ColorImage.RGBA];
            Tiles.copy(t, rgba, p.width(), OPAQUE);
            layers.add(new ColorImage(p.width(), p.height(), ColorImage.RGBA, rgba));
        }
        return layers;
    }

    private static Placement place(List<? extends IdentifiedImage> members) {
        if (members == null || members.size() != CLUSTER_SIZE)
            throw new IllegalArgumentException("Grid assembly needs exactly " + CLUSTER_SIZE + " frames, got "
                    + (members == null ? "null" : members.size()));

        List<IdentifiedImage> ordered = TileOrder.sorted(members);

        int minW = Integer.MAX_VALUE, minH = Integer.MAX_VALUE;
        for (IdentifiedImage f : ordered) {
            minW = Math.min(minW, f.image().width());
            minH = Math.min(minH, f.image().height());
        }

        List<ColorImage> cells = new ArrayList<>(CLUSTER_SIZE);
        for (IdentifiedImage f : ordered) {
            ColorImage img = f.image();
            cells.add(img.width() == minW && img.height() == minH ? img : img.crop(0, 0, minW, minH));
        }

        logger.debug("Placing {} tiles from {} .. {} as {}x{} cells", CLUSTER_SIZE,
                ordered.get(0).identifier(), ordered.get(CLUSTER_SIZE - 1).identifier(), minW, minH);
        return new Placement(Tiles.layout(cells, GRID_SIDE, minW, minH), GRID_SIDE * minW, GRID_SIDE * minH);
    }
}
