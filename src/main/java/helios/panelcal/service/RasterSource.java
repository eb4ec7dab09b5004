package helios.panelcal.service;

import helios.panelcal.model.RasterStack;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads all bands of a raster file as 32-bit floats, together with its geo-transform.
 */
public interface RasterSource {

    /**
     * @param path raster file
     * @return band data, size and transform ({@code null} transform when the file has none)
     * @throws RasterReadException if the file cannot be opened or decoded
     */
    RasterStack read(Path path) throws IOException;
}
