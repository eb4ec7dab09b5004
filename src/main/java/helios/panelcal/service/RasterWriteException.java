package helios.panelcal.service;

import java.io.IOException;

/**
 * Thrown when a raster file cannot be written.
 */
public class RasterWriteException extends IOException {

    public RasterWriteException(String message) {
        super(message);
    }

    public RasterWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
