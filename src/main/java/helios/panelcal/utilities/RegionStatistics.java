package helios.panelcal.utilities;

import helios.panelcal.model.ClipWindow;
import helios.panelcal.model.PanelPolygon;
import helios.panelcal.model.RasterStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Masks a raster with a panel polygon and computes the per-band panel statistic.
 *
 * <p>The polygon is rasterized over the pixel grid: a pixel belongs to the region when its
 * center {@code (col + 0.5, row + 0.5)} lies inside the ring or on its boundary. All bands
 * are cropped to the polygon's bounding window and pixels outside the mask are set to 0.</p>
 *
 * <p>Per band, the statistic is the mean of the {@code topK} largest masked values that are
 * non-zero, or of all of them when fewer survive. Zero doubles as the no-data marker, so
 * imagery with legitimate zero values inside the panel has those pixels ignored. NaN
 * values are ignored as well. A band with no surviving value has statistic 0, which the
 * correction step treats as degenerate.</p>
 *
 * @since 0.1.0
 * @author helios-panelcal contributors
 */
public class RegionStatistics {
    private static final Logger logger = LoggerFactory.getLogger(RegionStatistics.class);

    private final int topK;

    /**
     * @param topK number of brightest pixels to average per band
     */
    public RegionStatistics(int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1, got " + topK);
        }
        this.topK = topK;
    }

    /**
     * Region of a raster cut to a polygon's bounding window, with pixels outside the polygon
     * zeroed.
     *
     * @param window position of the crop in the source raster
     * @param mask   {@code [row][col]} membership, relative to the window
     * @param bands  {@code [band][row][col]} masked values, relative to the window
     */
    public record MaskedRegion(ClipWindow window, boolean[][] mask, float[][][] bands) {

        public int getPixelCount() {
            int count = 0;
            for (boolean[] row : mask) {
                for (boolean inside : row) {
                    if (inside) count++;
                }
            }
            return count;
        }
    }

    /**
     * Rasterizes the polygon and crops every band to its bounding window.
     *
     * @param polygon closed polygon in pixel coordinates
     * @param raster  source raster
     * @return the masked crop
     */
    public MaskedRegion maskRegion(PanelPolygon polygon, RasterStack raster) {
        int width = raster.getWidth();
        int height = raster.getHeight();

        int colStart = clamp((int) Math.floor(polygon.getMinX()), 0, width - 1);
        int rowStart = clamp((int) Math.floor(polygon.getMinY()), 0, height - 1);
        int colEnd = clamp((int) Math.ceil(polygon.getMaxX()), colStart + 1, width);
        int rowEnd = clamp((int) Math.ceil(polygon.getMaxY()), rowStart + 1, height);
        ClipWindow window = new ClipWindow(colStart, rowStart, colEnd - colStart, rowEnd - rowStart);

        boolean[][] mask = new boolean[window.height()][window.width()];
        for (int r = 0; r < window.height(); r++) {
            double cy = rowStart + r + 0.5;
            for (int c = 0; c < window.width(); c++) {
                mask[r][c] = polygon.contains(colStart + c + 0.5, cy);
            }
        }

        float[][][] bands = new float[raster.getBandCount()][window.height()][window.width()];
        for (int b = 0; b < raster.getBandCount(); b++) {
            float[][] src = raster.getBand(b);
            for (int r = 0; r < window.height(); r++) {
                for (int c = 0; c < window.width(); c++) {
                    if (mask[r][c]) {
                        bands[b][r][c] = src[rowStart + r][colStart + c];
                    }
                }
            }
        }

        MaskedRegion region = new MaskedRegion(window, mask, bands);
        logger.info("Masked region shape: {} bands x {} x {} ({} pixels inside polygon)",
                bands.length, window.height(), window.width(), region.getPixelCount());
        return region;
    }

    /**
     * Computes the panel statistic of every band.
     *
     * @param polygon closed polygon in pixel coordinates
     * @param raster  source raster
     * @return one statistic per band, in band order
     */
    public float[] extract(PanelPolygon polygon, RasterStack raster) {
        MaskedRegion region = maskRegion(polygon, raster);

        float[] statistics = new float[region.bands().length];
        for (int b = 0; b < statistics.length; b++) {
            statistics[b] = topKMean(region.bands()[b], topK);
            if (statistics[b] == 0f) {
                logger.warn("Band {}: no non-zero pixels inside the panel polygon; statistic is 0", b + 1);
            } else {
                logger.info("Band {}: mean of the highest {} values = {}", b + 1, topK, statistics[b]);
            }
        }
        return statistics;
    }

    /**
     * Mean of the {@code k} largest non-zero, non-NaN values of a band.
     *
     * @return the mean, or 0 when no value qualifies
     */
    static float topKMean(float[][] band, int k) {
        int count = 0;
        for (float[] row : band) {
            for (float v : row) {
                if (v != 0f && !Float.isNaN(v)) count++;
            }
        }
        if (count == 0) {
            return 0f;
        }

        float[] values = new float[count];
        int i = 0;
        for (float[] row : band) {
            for (float v : row) {
                if (v != 0f && !Float.isNaN(v)) values[i++] = v;
            }
        }
        Arrays.sort(values);

        int n = Math.min(k, count);
        double sum = 0;
        for (int j = count - n; j < count; j++) {
            sum += values[j];
        }
        return (float) (sum / n);
    }

    public int getTopK() {
        return topK;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
