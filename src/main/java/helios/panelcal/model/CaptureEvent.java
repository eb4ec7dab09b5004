package helios.panelcal.model;

/**
 * One event delivered to a {@link PolygonCaptureSession}.
 *
 * <p>Only two kinds matter to the capture: a pointer click at a pixel position, and an
 * explicit commit that closes the polygon without snapping back to the first vertex.
 * Coordinates of a commit are {@code NaN}.</p>
 *
 * @param kind event kind
 * @param x    column coordinate of a click, in pixels
 * @param y    row coordinate of a click, in pixels
 */
public record CaptureEvent(Kind kind, double x, double y) {

    public enum Kind {
        POINT_CLICK,
        COMMIT
    }

    public CaptureEvent {
        if (kind == null) {
            throw new IllegalArgumentException("Event kind must not be null");
        }
    }

    public static CaptureEvent click(double x, double y) {
        return new CaptureEvent(Kind.POINT_CLICK, x, y);
    }

    public static CaptureEvent commit() {
        return new CaptureEvent(Kind.COMMIT, Double.NaN, Double.NaN);
    }

    public PixelPoint point() {
        return new PixelPoint(x, y);
    }
}
