package helios.panelcal.utilities;

import helios.panelcal.model.ClipWindow;
import org.junit.jupiter.api.Test;

import java.awt.geom.AffineTransform;

import static org.junit.jupiter.api.Assertions.*;

class GeoTransformsTest {

    @Test
    void testCoefficientOrder() {
        double[] abcdef = {2.0, 0.1, 300.0, -0.2, -2.0, 4000.0};
        AffineTransform transform = GeoTransforms.fromCoefficients(abcdef);

        // x = a*col + b*row + c, y = d*col + e*row + f
        double[] world = GeoTransforms.pixelToWorld(transform, 10, 20);
        assertEquals(2.0 * 10 + 0.1 * 20 + 300.0, world[0], 1e-9);
        assertEquals(-0.2 * 10 - 2.0 * 20 + 4000.0, world[1], 1e-9);
        assertArrayEquals(abcdef, GeoTransforms.toCoefficients(transform), 1e-12);
    }

    @Test
    void testNormalize_IdentityBecomesNone() {
        assertNull(GeoTransforms.normalize(new AffineTransform()));
        assertNull(GeoTransforms.normalize(null));
        assertNotNull(GeoTransforms.normalize(AffineTransform.getTranslateInstance(1, 0)));
    }

    @Test
    void testWindowTransform_RotatedSourceKeepsWorldPosition() {
        AffineTransform source = GeoTransforms.fromCoefficients(new double[]{0.8, 0.3, 10, 0.3, -0.8, 50});
        ClipWindow window = new ClipWindow(7, 12, 5, 5);

        AffineTransform shifted = GeoTransforms.windowTransform(source, window);

        assertArrayEquals(GeoTransforms.pixelToWorld(source, 7, 12),
                GeoTransforms.pixelToWorld(shifted, 0, 0), 1e-9);
        assertArrayEquals(GeoTransforms.pixelToWorld(source, 9.5, 13),
                GeoTransforms.pixelToWorld(shifted, 2.5, 1), 1e-9);
        assertEquals(source.getScaleX(), shifted.getScaleX());
        assertEquals(source.getShearX(), shifted.getShearX());
    }

    @Test
    void testWindowTransform_NoneStaysNone() {
        assertNull(GeoTransforms.windowTransform(null, new ClipWindow(3, 3, 2, 2)));
    }

    @Test
    void testIsAxisAligned() {
        assertTrue(GeoTransforms.isAxisAligned(GeoTransforms.fromCoefficients(new double[]{1, 0, 5, 0, -1, 5})));
        assertFalse(GeoTransforms.isAxisAligned(GeoTransforms.fromCoefficients(new double[]{1, 0.5, 5, 0, -1, 5})));
    }

    @Test
    void testFromCoefficients_RejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> GeoTransforms.fromCoefficients(new double[5]));
    }
}
