package helios.panelcal.model;

/**
 * Integer pixel window inside a raster.
 *
 * @param offsetX first column of the window
 * @param offsetY first row of the window
 * @param width   number of columns
 * @param height  number of rows
 */
public record ClipWindow(int offsetX, int offsetY, int width, int height) {

    public ClipWindow {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Window size must be positive, got " + width + "x" + height);
        }
    }

    /**
     * Computes the window of the requested size centered on a source raster.
     *
     * <p>Offsets use floor division of the size difference, so an odd difference leaves the
     * extra pixel on the right/bottom side.</p>
     *
     * @param sourceWidth  source raster width
     * @param sourceHeight source raster height
     * @param width        requested window width
     * @param height       requested window height
     * @return the centered window
     * @throws WindowOutOfBoundsException if the requested size exceeds the source in either axis
     */
    public static ClipWindow centered(int sourceWidth, int sourceHeight, int width, int height)
            throws WindowOutOfBoundsException {
        int offsetX = Math.floorDiv(sourceWidth - width, 2);
        int offsetY = Math.floorDiv(sourceHeight - height, 2);
        if (offsetX < 0 || offsetY < 0) {
            throw new WindowOutOfBoundsException(sourceWidth, sourceHeight, width, height);
        }
        return new ClipWindow(offsetX, offsetY, width, height);
    }

    /**
     * @return true when the window lies entirely inside a raster of the given size
     */
    public boolean fitsInside(int sourceWidth, int sourceHeight) {
        return offsetX >= 0 && offsetY >= 0
                && offsetX + width <= sourceWidth
                && offsetY + height <= sourceHeight;
    }
}
