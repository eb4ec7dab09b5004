package helios.panelcal.service.geotiff;

import helios.panelcal.model.RasterStack;
import helios.panelcal.service.RasterReadException;
import helios.panelcal.utilities.GeoTransforms;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.geom.AffineTransform;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GeoTiffRoundTripTest {

    @TempDir
    Path tmp;

    private final GeoTiffRasterWriter writer = new GeoTiffRasterWriter();
    private final GeoTiffRasterReader reader = new GeoTiffRasterReader();

    private static float[][][] ramp(int bands, int width, int height) {
        float[][][] data = new float[bands][height][width];
        for (int b = 0; b < bands; b++) {
            for (int r = 0; r < height; r++) {
                for (int c = 0; c < width; c++) {
                    data[b][r][c] = (b + 1) * 0.125f * (r * width + c) - 3.5f;
                }
            }
        }
        return data;
    }

    @Test
    @DisplayName("3-band float raster with a north-up transform survives a write/read cycle")
    void threeBandsWithTransform() throws IOException {
        AffineTransform transform = GeoTransforms.fromCoefficients(new double[]{0.05, 0, 512000.0, 0, -0.05, 4100000.0});
        RasterStack original = new RasterStack(ramp(3, 17, 11), transform);
        Path file = tmp.resolve("corrected_image.tif");

        writer.write(file, original);
        RasterStack loaded = reader.read(file);

        assertEquals(3, loaded.getBandCount());
        assertEquals(17, loaded.getWidth());
        assertEquals(11, loaded.getHeight());
        for (int b = 0; b < 3; b++) {
            for (int r = 0; r < 11; r++) {
                assertArrayEquals(original.getBand(b)[r], loaded.getBand(b)[r]);
            }
        }
        assertArrayEquals(GeoTransforms.toCoefficients(transform),
                GeoTransforms.toCoefficients(loaded.getGeoTransform()), 1e-9);
    }

    @Test
    void rotatedTransformUsesModelTransformation() throws IOException {
        AffineTransform transform = GeoTransforms.fromCoefficients(new double[]{0.8, 0.3, 10, 0.3, -0.8, 50});
        Path file = tmp.resolve("rotated.tif");

        writer.write(file, new RasterStack(ramp(3, 4, 4), transform));

        assertArrayEquals(GeoTransforms.toCoefficients(transform),
                GeoTransforms.toCoefficients(reader.read(file).getGeoTransform()), 1e-9);
    }

    @Test
    void singleBandWithoutTransformReadsBackAsNone() throws IOException {
        RasterStack original = new RasterStack(ramp(1, 9, 6), null);
        Path file = tmp.resolve("plain.tif");

        writer.write(file, original);
        RasterStack loaded = reader.read(file);

        assertEquals(1, loaded.getBandCount());
        assertNull(loaded.getGeoTransform());
        assertArrayEquals(original.getBand(0)[5], loaded.getBand(0)[5]);
    }

    @Test
    void writeReplacesExistingFile() throws IOException {
        Path file = tmp.resolve("twice.tif");
        writer.write(file, new RasterStack(ramp(1, 4, 4), null));
        writer.write(file, new RasterStack(ramp(1, 8, 2), null));
        assertEquals(8, reader.read(file).getWidth());
    }

    @Test
    void missingFileIsReadException() {
        assertThrows(RasterReadException.class, () -> reader.read(tmp.resolve("absent.tif")));
    }

    @Test
    void garbageFileIsIOException() throws IOException {
        Path file = tmp.resolve("garbage.tif");
        Files.writeString(file, "this is not a tiff");
        assertThrows(IOException.class, () -> reader.read(file));
    }
}
