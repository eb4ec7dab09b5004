package helios.panelcal.model;

/**
 * States of a {@link PolygonCaptureSession}. {@link #CLOSED} is terminal.
 */
public enum CaptureState {
    /** No vertex recorded yet. */
    EMPTY,
    /** At least one vertex recorded, polygon still open. */
    DRAWING,
    /** Ring closed; the polygon is immutable and the event source has been released. */
    CLOSED
}
