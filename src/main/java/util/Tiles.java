package util;

import model.ColorImage;

import java.util.ArrayList;
import java.util.List;

/** Row-major cell layout and RGBA blitting for grid composites. */
public class Tiles {
    public record Tile(ColorImage image, int x, int y) {
    }

    /** Places images left to right, top to bottom, on a grid of cellW × cellH cells. */
    public static List<Tile> layout(List<ColorImage> images, int columns, int cellW, int cellH) {
        List<Tile> tiles = new ArrayList<>(images.size());
        for (int k = 0; k < images.size(); k++)
            tiles.add(new Tile(images.get(k), (k % columns) * cellW, (k / columns) * cellH));
        return tiles;
    }

    /**
     * Copies the tile's RGB into an RGBA buffer of width dstW at the tile's offset,
     * with the given alpha. The tile must fit inside the buffer.
     */
    public static void copy(Tile tile, byte[] dst, int dstW, int alpha) {
        ColorImage img = tile.image();
        int w = img.width(), h = img.height();
        int dstH = dst.length / (dstW * ColorImage.RGBA);
        if (tile.x() < 0 || tile.y() < 0 || tile.x() + w > dstW || tile.y() + h > dstH)
            throw new IndexOutOfBoundsException("Tile " + w + "x" + h + "@(" + tile.x() + "," + tile.y()
                    + ") outside " + dstW + "x" + dstH);
        byte[] src = img.samples();
        int sc = img.channels();
        byte a = (byte) alpha;
        for (int y = 0; y < h; y++) {
            int s = y * w * sc;
            int d = ((tile.y() + y) * dstW + tile.x()) * ColorImage.RGBA;
            for (int x = 0; x < w; x++, s += sc, d += ColorImage.RGBA) {
                dst[d] = src[s];
                dst[d + 1] = src[s + 1];
                dst[d + 2] = src[s + 2];
                dst[d + 3] = a;
            }
        }
    }
}
