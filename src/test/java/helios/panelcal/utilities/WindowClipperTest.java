package helios.panelcal.utilities;

import helios.panelcal.model.ClipWindow;
import helios.panelcal.model.RasterStack;
import helios.panelcal.model.WindowOutOfBoundsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.geom.AffineTransform;

import static org.junit.jupiter.api.Assertions.*;

class WindowClipperTest {

    private float[][] band;

    /** 100x100 band of increasing integers: value = row * 100 + col. */
    @BeforeEach
    void setUp() {
        band = new float[100][100];
        for (int r = 0; r < 100; r++) {
            for (int c = 0; c < 100; c++) {
                band[r][c] = r * 100 + c;
            }
        }
    }

    @Test
    @DisplayName("10x10 clip of a 100x100 raster is the exact center block")
    void clipIsCenterBlock() throws Exception {
        RasterStack clipped = new WindowClipper(10, 10).clip(new RasterStack(new float[][][]{band}, null));

        assertEquals(10, clipped.getWidth());
        assertEquals(10, clipped.getHeight());
        for (int r = 0; r < 10; r++) {
            for (int c = 0; c < 10; c++) {
                assertEquals((45 + r) * 100 + (45 + c), clipped.getBand(0)[r][c]);
            }
        }
        assertNull(clipped.getGeoTransform());
    }

    @Test
    @DisplayName("Clip transform is the source transform translated by (45, 45) pixels")
    void clipTransformComposesOffset() throws Exception {
        AffineTransform source = GeoTransforms.fromCoefficients(new double[]{0.5, 0, 1000, 0, -0.5, 2000});
        RasterStack clipped = new WindowClipper(10, 10).clip(new RasterStack(new float[][][]{band}, source));

        AffineTransform result = clipped.getGeoTransform();
        assertNotNull(result);
        assertEquals(1022.5, result.getTranslateX(), 1e-9);
        assertEquals(1977.5, result.getTranslateY(), 1e-9);
        assertEquals(0.5, result.getScaleX(), 1e-12);
        assertEquals(-0.5, result.getScaleY(), 1e-12);

        AffineTransform expected = new AffineTransform(source);
        expected.concatenate(AffineTransform.getTranslateInstance(45, 45));
        assertEquals(expected, result);
    }

    @Test
    void clipBandsStayAligned() throws Exception {
        float[][] second = new float[100][100];
        second[50][50] = 9f;
        RasterStack clipped = new WindowClipper(10, 10).clip(new RasterStack(new float[][][]{band, second}, null));

        assertEquals(2, clipped.getBandCount());
        assertEquals(9f, clipped.getBand(1)[5][5]);
        assertEquals(5050f, clipped.getBand(0)[5][5]);
    }

    @Test
    void oversizedClipThrows() {
        WindowClipper clipper = new WindowClipper(101, 10);
        RasterStack raster = new RasterStack(new float[][][]{band}, null);
        assertThrows(WindowOutOfBoundsException.class, () -> clipper.clip(raster));
    }

    @Test
    void clipOfFullSizeReturnsWholeRaster() throws Exception {
        RasterStack clipped = new WindowClipper(100, 100).clip(new RasterStack(new float[][][]{band}, null));
        assertEquals(99 * 100 + 99, clipped.getBand(0)[99][99]);
    }

    @Test
    void explicitWindowOutsideRasterIsRejected() {
        RasterStack raster = new RasterStack(new float[][][]{band}, null);
        assertThrows(IllegalArgumentException.class,
                () -> WindowClipper.clip(raster, new ClipWindow(95, 0, 10, 10)));
    }
}
