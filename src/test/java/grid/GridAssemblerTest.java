package grid;

import model.ColorImage;
import model.DemosaicedFrame;
import model.IdentifiedImage;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class GridAssemblerTest {

    private final GridAssembler assembler = new GridAssembler();

    /** Solid image whose colour encodes the tile order: (order * 10, 255 - order, 1). */
    private static ColorImage solid(int w, int h, int order) {
        byte[] s = new byte[w * h * 3];
        for (int i = 0; i < s.length; i += 3) {
            s[i] = (byte) (order * 10);
            s[i + 1] = (byte) (255 - order);
            s[i + 2] = 1;
        }
        return new ColorImage(w, h, ColorImage.RGB, s);
    }

    private static DemosaicedFrame tile(int order, int w, int h) {
        return new DemosaicedFrame(String.format("ZCAM_0047_N0031950_%02d_295J", order), solid(w, h, order));
    }

    private static List<DemosaicedFrame> shuffledFamily(int w, int h, long seed) {
        List<DemosaicedFrame> members = new ArrayList<>();
        for (int k = 0; k < 16; k++)
            members.add(tile(k, w, h));
        Collections.shuffle(members, new Random(seed));
        return members;
    }

    private static void assertCell(ColorImage img, int x, int y, int order) {
        assertEquals(order * 10, img.get(x, y, 0), "red at " + x + "," + y);
        assertEquals(255 - order, img.get(x, y, 1), "green at " + x + "," + y);
        assertEquals(255, img.get(x, y, 3), "alpha at " + x + "," + y);
    }

    @Test
    public void testOrderDrivesRowMajorPlacement() {
        ColorImage grid = assembler.assembleGrid(shuffledFamily(5, 3, 1));

        assertEquals(20, grid.width());
        assertEquals(12, grid.height());
        assertEquals(4, grid.channels());
        assertCell(grid, 0, 0, 0);
        assertCell(grid, 19, 11, 15);
        for (int k = 0; k < 16; k++)
            assertCell(grid, (k % 4) * 5 + 2, (k / 4) * 3 + 1, k);
    }

    @Test
    public void testOrderValuesNeedNotStartAtZero() {
        List<DemosaicedFrame> members = new ArrayList<>();
        for (int k = 0; k < 16; k++)
            members.add(new DemosaicedFrame(String.format("CAM_1_N01_%d_ABCD", 100 + k * 3), solid(2, 2, k)));
        Collections.reverse(members);

        ColorImage grid = assembler.assembleGrid(members);

        assertCell(grid, 0, 0, 0);
        assertCell(grid, 7, 7, 15);
    }

    @Test
    public void testSmallestMemberCropsTheWholeFamily() {
        List<DemosaicedFrame> members = new ArrayList<>();
        for (int k = 0; k < 16; k++)
            members.add(tile(k, 4, k == 9 ? 90 : 100));

        ColorImage grid = assembler.assembleGrid(members);

        assertEquals(4 * 90, grid.height());
        assertEquals(4 * 4, grid.width());
        // row 0 cells end at y = 89; y = 90 already belongs to order 4
        assertCell(grid, 0, 89, 0);
        assertCell(grid, 0, 90, 4);
        assertCell(grid, 15, 359, 15);
    }

    @Test
    public void testWidthCropTakesTopLeftRegion() {
        List<DemosaicedFrame> members = new ArrayList<>();
        for (int k = 0; k < 16; k++) {
            int w = k == 0 ? 3 : 6;
            byte[] s = new byte[w * 2 * 3];
            for (int x = 0; x < w; x++)
                for (int y = 0; y < 2; y++)
                    s[(y * w + x) * 3] = (byte) x;
            members.add(new DemosaicedFrame(String.format("C_%02d_ABCD", k), new ColorImage(w, 2, 3, s)));
        }

        ColorImage grid = assembler.assembleGrid(members);

        assertEquals(12, grid.width());
        // cell 1 shows columns 0..2 of a 6-wide image
        assertEquals(0, grid.get(3, 0, 0));
        assertEquals(2, grid.get(5, 1, 0));
    }

    @Test
    public void testLayersAreOneOpaqueCellEach() {
        List<DemosaicedFrame> members = shuffledFamily(3, 2, 5);
        List<ColorImage> layers = assembler.assembleLayers(members);

        assertEquals(16, layers.size());
        for (int k = 0; k < 16; k++) {
            ColorImage layer = layers.get(k);
            assertEquals(12, layer.width());
            assertEquals(8, layer.height());
            int cellX = (k % 4) * 3, cellY = (k / 4) * 2;
            int opaque = 0;
            for (int y = 0; y < 8; y++) {
                for (int x = 0; x < 12; x++) {
                    boolean inside = x >= cellX && x < cellX + 3 && y >= cellY && y < cellY + 2;
                    int a = layer.alpha(x, y);
                    if (inside) {
                        assertEquals(255, a);
                        assertCell(layer, x, y, k);
                        opaque++;
                    } else {
                        assertEquals(0, a, "layer " + k + " at " + x + "," + y);
                    }
                }
            }
            assertEquals(6, opaque);
        }
    }

    @Test
    public void testLayersAreDeterministic() {
        List<DemosaicedFrame> members = shuffledFamily(4, 4, 9);
        assertEquals(assembler.assembleLayers(members), assembler.assembleLayers(members));
        assertEquals(assembler.assembleGrid(members), assembler.assembleGrid(new ArrayList<>(members)));
    }

    @Test
    public void testWrongMemberCountFails() {
        List<DemosaicedFrame> members = shuffledFamily(2, 2, 3);
        List<DemosaicedFrame> fifteen = members.subList(0, 15);
        List<DemosaicedFrame> seventeen = new ArrayList<>(members);
        seventeen.add(tile(16, 2, 2));

        assertThrows(IllegalArgumentException.class, () -> assembler.assembleGrid(fifteen));
        assertThrows(IllegalArgumentException.class, () -> assembler.assembleGrid(seventeen));
        assertThrows(IllegalArgumentException.class, () -> assembler.assembleLayers(fifteen));
        assertThrows(IllegalArgumentException.class, () -> assembler.assembleLayers(seventeen));
    }

    @Test
    public void testNonNumericOrderFails() {
        List<DemosaicedFrame> members = new ArrayList<>(shuffledFamily(2, 2, 4));
        members.set(3, new DemosaicedFrame("ZCAM_0047_N0031950_xx_295J", solid(2, 2, 0)));
        assertThrows(IllegalArgumentException.class, () -> assembler.assembleGrid(members));
    }

    @Test
    public void testAcceptsCluster() {
        List<DemosaicedFrame> members = shuffledFamily(2, 2, 6);
        Cluster<DemosaicedFrame> cluster = new FrameClusterer().<DemosaicedFrame>cluster(members).get(0);
        assertEquals(assembler.assembleGrid(members), assembler.assembleGrid(cluster));
        assertEquals(16, assembler.assembleLayers(cluster).size());
    }

    /** A stitchable tile that did not come out of the demosaic pipeline. */
    private record Preview(String identifier, ColorImage image) implements IdentifiedImage {
    }

    @Test
    public void testAcceptsAnyIdentifiedImage() {
        List<Preview> previews = new ArrayList<>();
        for (int k = 15; k >= 0; k--)
            previews.add(new Preview(String.format("ZCAM_0047_N0031950_%02d_295J", k), solid(2, 3, k)));

        Cluster<Preview> cluster = new FrameClusterer().cluster(previews).get(0);
        ColorImage grid = assembler.assembleGrid(cluster);

        assertEquals(8, grid.width());
        assertEquals(12, grid.height());
        assertCell(grid, 0, 0, 0);
        assertCell(grid, 7, 11, 15);
        assertEquals(16, assembler.assembleLayers(previews).size());
    }
}
