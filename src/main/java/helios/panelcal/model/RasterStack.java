package helios.panelcal.model;

import java.awt.geom.AffineTransform;

/**
 * All bands of one raster as 32-bit float arrays, plus the pixel-to-world transform.
 *
 * <p>Bands are indexed {@code [band][row][col]} and share the stack's width and height.
 * The geo-transform maps pixel {@code (col, row)} to world coordinates; {@code null} is the
 * "none" sentinel used for rasters without georeferencing (or with an identity transform).</p>
 *
 * <p>The stack does not copy its band arrays. Components that produce new pixel values
 * build a new stack through {@link #withBands(float[][][])}.</p>
 *
 * @author helios-panelcal contributors
 * @since 0.1.0
 */
public final class RasterStack {

    private final float[][][] bands;
    private final int width;
    private final int height;
    private final AffineTransform geoTransform;

    /**
     * @param bands        band data as {@code [band][row][col]}
     * @param geoTransform pixel-to-world transform, or null for none
     * @throws IllegalArgumentException if the bands are missing or not all {@code height x width}
     */
    public RasterStack(float[][][] bands, AffineTransform geoTransform) {
        if (bands == null || bands.length == 0) {
            throw new IllegalArgumentException("Raster needs at least one band");
        }
        if (bands[0] == null || bands[0].length == 0 || bands[0][0] == null || bands[0][0].length == 0) {
            throw new IllegalArgumentException("Raster bands must not be empty");
        }
        this.height = bands[0].length;
        this.width = bands[0][0].length;
        for (int b = 0; b < bands.length; b++) {
            if (bands[b] == null || bands[b].length != height) {
                throw new IllegalArgumentException("Band " + (b + 1) + " does not have " + height + " rows");
            }
            for (float[] row : bands[b]) {
                if (row == null || row.length != width) {
                    throw new IllegalArgumentException("Band " + (b + 1) + " does not have " + width + " columns");
                }
            }
        }
        this.bands = bands;
        this.geoTransform = geoTransform == null ? null : new AffineTransform(geoTransform);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getBandCount() {
        return bands.length;
    }

    /**
     * @param index zero-based band index
     * @return the band's pixel rows (not a copy)
     */
    public float[][] getBand(int index) {
        return bands[index];
    }

    /**
     * @return all bands (not a copy)
     */
    public float[][][] getBands() {
        return bands;
    }

    public boolean hasGeoTransform() {
        return geoTransform != null;
    }

    /**
     * @return a copy of the pixel-to-world transform, or null when the raster has none
     */
    public AffineTransform getGeoTransform() {
        return geoTransform == null ? null : new AffineTransform(geoTransform);
    }

    /**
     * Creates a stack with new pixel data and this stack's geo-transform.
     */
    public RasterStack withBands(float[][][] newBands) {
        return new RasterStack(newBands, geoTransform);
    }

    @Override
    public String toString() {
        return String.format("RasterStack[%d bands, %dx%d, transform=%s]",
                bands.length, width, height, geoTransform == null ? "none" : geoTransform);
    }
}
