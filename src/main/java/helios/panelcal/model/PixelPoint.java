package helios.panelcal.model;

/**
 * A point in image pixel space.
 *
 * <p>Coordinates follow the raster grid: x grows along columns, y grows along rows, and
 * pixel {@code (col, row)} covers {@code [col, col + 1) x [row, row + 1)}. The point is not
 * tied to any geographic reference.</p>
 *
 * @param x column coordinate in pixels
 * @param y row coordinate in pixels
 */
public record PixelPoint(double x, double y) {

    /**
     * Euclidean distance to another point, in pixels.
     */
    public double distanceTo(PixelPoint other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f)", x, y);
    }
}
