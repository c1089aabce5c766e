package grid;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ClusterKeyTest {

    @Test
    public void testDropsLastThreeComponents() {
        assertEquals("ZCAM_0047_0671379941_113EBY",
                ClusterKey.of("ZCAM_0047_0671379941_113EBY_N0031950_01_295J").value());
        assertEquals("a_b", ClusterKey.of("a_b_c_d_e").value());
    }

    @Test
    public void testShortIdentifiersGiveEmptyKey() {
        assertEquals("", ClusterKey.of("x_01_abcd").value());
        assertEquals("", ClusterKey.of("abcd").value());
        assertEquals(ClusterKey.of("p_01_abcd"), ClusterKey.of("q_02_wxyz"));
    }

    @Test
    public void testTileIdentifierNeedsFourCharacterSuffix() {
        assertTrue(ClusterKey.isTileIdentifier("cam_1_02_AB12"));
        assertFalse(ClusterKey.isTileIdentifier("cam_1_02_AB1"));
        assertFalse(ClusterKey.isTileIdentifier("cam_1_02_AB123"));
        assertFalse(ClusterKey.isTileIdentifier("cam_1_02_"));
        assertTrue(ClusterKey.isTileIdentifier("ABCD"));
    }
}
