package helios.panelcal.service;

import helios.panelcal.model.RasterStack;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists a raster as a float32 GeoTIFF-equivalent file.
 */
public interface RasterSink {

    /**
     * Writes every band of the raster. The width, height and band count come from the stack;
     * a {@code null} geo-transform writes no georeferencing.
     *
     * @param path   target file, replaced if it exists
     * @param raster data to write
     * @throws RasterWriteException if the file cannot be written; no partial file is left behind
     */
    void write(Path path, RasterStack raster) throws IOException;
}
