package helios.panelcal.service;

import helios.panelcal.model.CaptureEventSource;
import helios.panelcal.model.RasterStack;

import java.nio.file.Path;

/**
 * Opens one capture event stream per input file, e.g. by showing the raster in a window.
 */
@FunctionalInterface
public interface CaptureEventSourceFactory {

    /**
     * @param file   input file being processed, for titles and logs
     * @param raster its raster, for display
     * @return a fresh event source; the capture session closes it
     */
    CaptureEventSource open(Path file, RasterStack raster);
}
