package helios.panelcal.model;

/**
 * Thrown when a requested clip window does not fit inside the source raster.
 */
public class WindowOutOfBoundsException extends PanelCorrectionException {

    private final int sourceWidth;
    private final int sourceHeight;
    private final int requestedWidth;
    private final int requestedHeight;

    public WindowOutOfBoundsException(int sourceWidth, int sourceHeight, int requestedWidth, int requestedHeight) {
        super(String.format("Requested clip %dx%d does not fit inside source raster %dx%d",
                requestedWidth, requestedHeight, sourceWidth, sourceHeight));
        this.sourceWidth = sourceWidth;
        this.sourceHeight = sourceHeight;
        this.requestedWidth = requestedWidth;
        this.requestedHeight = requestedHeight;
    }

    public int getSourceWidth() { return sourceWidth; }
    public int getSourceHeight() { return sourceHeight; }
    public int getRequestedWidth() { return requestedWidth; }
    public int getRequestedHeight() { return requestedHeight; }
}
