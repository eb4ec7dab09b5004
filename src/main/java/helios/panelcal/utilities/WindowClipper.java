package helios.panelcal.utilities;

import helios.panelcal.model.ClipWindow;
import helios.panelcal.model.RasterStack;
import helios.panelcal.model.WindowOutOfBoundsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.AffineTransform;

/**
 * Cuts a fixed-size window out of the center of a raster and moves the geo-transform origin
 * to match.
 *
 * <p>The window offset is {@code ((srcWidth - width) / 2, (srcHeight - height) / 2)} with
 * floor division. A window larger than the source in either axis is rejected with
 * {@link WindowOutOfBoundsException} rather than read past the raster edge.</p>
 *
 * @author helios-panelcal contributors
 */
public class WindowClipper {
    private static final Logger logger = LoggerFactory.getLogger(WindowClipper.class);

    private final int width;
    private final int height;

    /**
     * @param width  clip width in pixels
     * @param height clip height in pixels
     */
    public WindowClipper(int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Clip size must be positive, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    /**
     * @return the centered window for the source raster
     * @throws WindowOutOfBoundsException if the clip does not fit
     */
    public ClipWindow centeredWindow(RasterStack source) throws WindowOutOfBoundsException {
        ClipWindow window = ClipWindow.centered(source.getWidth(), source.getHeight(), width, height);
        logger.debug("Centered {}x{} window in {}x{} raster at offset ({}, {})",
                width, height, source.getWidth(), source.getHeight(), window.offsetX(), window.offsetY());
        return window;
    }

    /**
     * Clips the centered window out of the source.
     *
     * @throws WindowOutOfBoundsException if the clip does not fit
     */
    public RasterStack clip(RasterStack source) throws WindowOutOfBoundsException {
        return clip(source, centeredWindow(source));
    }

    /**
     * Copies all bands over the window and derives the window's geo-transform.
     *
     * @param source source raster
     * @param window window inside the source
     * @return the clipped raster; its transform is null when the source has none
     */
    public static RasterStack clip(RasterStack source, ClipWindow window) {
        if (!window.fitsInside(source.getWidth(), source.getHeight())) {
            throw new IllegalArgumentException("Window " + window + " does not fit inside " + source);
        }

        float[][][] out = new float[source.getBandCount()][window.height()][];
        for (int b = 0; b < source.getBandCount(); b++) {
            float[][] src = source.getBand(b);
            for (int r = 0; r < window.height(); r++) {
                float[] row = new float[window.width()];
                System.arraycopy(src[window.offsetY() + r], window.offsetX(), row, 0, window.width());
                out[b][r] = row;
            }
        }

        AffineTransform transform = GeoTransforms.windowTransform(source.getGeoTransform(), window);
        logger.info("Clipped {} bands to {}x{} at offset ({}, {}), transform {}",
                source.getBandCount(), window.width(), window.height(),
                window.offsetX(), window.offsetY(), transform == null ? "none" : "shifted");
        return new RasterStack(out, transform);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }
}
