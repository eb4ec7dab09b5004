package helios.panelcal.service;

import java.io.IOException;

/**
 * Thrown when a raster file cannot be opened or decoded.
 */
public class RasterReadException extends IOException {

    public RasterReadException(String message) {
        super(message);
    }

    public RasterReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
