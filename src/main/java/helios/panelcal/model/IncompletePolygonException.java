package helios.panelcal.model;

/**
 * Thrown when a polygon is requested from a capture that never reached
 * {@link CaptureState#CLOSED}, or whose closed ring has too few distinct vertices to
 * enclose an area.
 */
public class IncompletePolygonException extends PanelCorrectionException {

    private final CaptureState state;

    public IncompletePolygonException(String message, CaptureState state) {
        super(message);
        this.state = state;
    }

    /**
     * @return the capture state at the time of the failure
     */
    public CaptureState getState() {
        return state;
    }
}
