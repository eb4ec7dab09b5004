package helios.panelcal.controller;

import helios.panelcal.model.BandCorrection;
import helios.panelcal.model.CaptureEventSource;
import helios.panelcal.model.CaptureState;
import helios.panelcal.model.ClipWindow;
import helios.panelcal.model.IncompletePolygonException;
import helios.panelcal.model.PanelCorrectionException;
import helios.panelcal.model.PanelPolygon;
import helios.panelcal.model.PolygonCaptureSession;
import helios.panelcal.model.RasterStack;
import helios.panelcal.service.CaptureEventSourceFactory;
import helios.panelcal.service.CorrectionReport;
import helios.panelcal.service.CorrectionReportWriter;
import helios.panelcal.service.RasterSink;
import helios.panelcal.service.RasterSource;
import helios.panelcal.utilities.CorrectionConfig;
import helios.panelcal.utilities.GeoTransforms;
import helios.panelcal.utilities.RadiometricCorrection;
import helios.panelcal.utilities.RegionStatistics;
import helios.panelcal.utilities.RunLogger;
import helios.panelcal.utilities.WindowClipper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * PanelCorrectionWorkflow
 *
 * <p>Runs the correction of a single raster file:
 * <ol>
 *   <li>Reads the raster and computes the centered clip window</li>
 *   <li>Creates {@code <output-root>/<file-stem>/} and opens its run log</li>
 *   <li>Captures the panel polygon from the file's event source</li>
 *   <li>Extracts the per-band panel statistic and derives the correction factors</li>
 *   <li>Applies the correction and cuts the clip window</li>
 *   <li>Writes the corrected raster, the clipped raster and the JSON report</li>
 * </ol>
 *
 * <p>A clip that does not fit the raster fails the file before its output folder is created
 * or any capture event is read. A capture that ends without a usable polygon skips the
 * file; every other failure propagates to the caller.</p>
 *
 * @author helios-panelcal contributors
 * @since 0.1.0
 */
public class PanelCorrectionWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(PanelCorrectionWorkflow.class);

    private final CorrectionConfig config;
    private final RasterSource source;
    private final RasterSink sink;
    private final CaptureEventSourceFactory captureFactory;
    private final CorrectionReportWriter reportWriter;

    private final RegionStatistics statistics;
    private final RadiometricCorrection correction;
    private final WindowClipper clipper;

    public PanelCorrectionWorkflow(CorrectionConfig config, RasterSource source, RasterSink sink,
                                   CaptureEventSourceFactory captureFactory) {
        this(config, source, sink, captureFactory, new CorrectionReportWriter());
    }

    public PanelCorrectionWorkflow(CorrectionConfig config, RasterSource source, RasterSink sink,
                                   CaptureEventSourceFactory captureFactory, CorrectionReportWriter reportWriter) {
        this.config = config;
        this.source = source;
        this.sink = sink;
        this.captureFactory = captureFactory;
        this.reportWriter = reportWriter;
        this.statistics = new RegionStatistics(config.getTopK());
        this.correction = new RadiometricCorrection(config.getReflectanceFactor(), config.getDegenerateBandPolicy());
        this.clipper = new WindowClipper(config.getClipWidth(), config.getClipHeight());
    }

    /**
     * Processes one input file.
     *
     * @param inputFile  raster to correct
     * @param outputRoot folder receiving one subfolder per input file
     * @return CORRECTED, or SKIPPED_NO_POLYGON when no usable polygon was captured
     * @throws PanelCorrectionException on degenerate statistics (FAIL policy) or an oversized clip
     * @throws IOException              if reading or writing a file fails
     */
    public FileOutcome process(Path inputFile, Path outputRoot) throws PanelCorrectionException, IOException {
        Path outputFolder = outputRoot.resolve(stem(inputFile));

        RasterStack raster = source.read(inputFile);
        ClipWindow window = clipper.centeredWindow(raster);

        Files.createDirectories(outputFolder);
        try (RunLogger.Session ignored = config.isRunLog() ? RunLogger.start(outputFolder) : null) {
            logger.info("Processing {} -> {}", inputFile, outputFolder);
            logger.debug("Clip window {}", window);

            Optional<PanelPolygon> polygon = capturePolygon(inputFile, raster);
            if (polygon.isEmpty()) {
                logger.warn("No panel polygon captured for {}; skipping file", inputFile.getFileName());
                return FileOutcome.skipped(inputFile, outputFolder, "no polygon captured");
            }

            CorrectionResult result;
            try {
                result = correct(raster, polygon.get(), window);
            } catch (IncompletePolygonException e) {
                logger.warn("Unusable panel polygon for {}: {}", inputFile.getFileName(), e.getMessage());
                return FileOutcome.skipped(inputFile, outputFolder, e.getMessage());
            }

            writeOutputs(inputFile, outputFolder, raster, result);
            logger.info("Finished {}", inputFile.getFileName());
            return FileOutcome.corrected(inputFile, outputFolder);
        }
    }

    /**
     * Runs the numeric pipeline in memory: statistics, factors, correction and clip.
     *
     * @throws IncompletePolygonException   if the polygon encloses no area
     * @throws PanelCorrectionException     on a degenerate band under the FAIL policy, or an
     *                                      oversized clip
     */
    public CorrectionResult correct(RasterStack raster, PanelPolygon polygon) throws PanelCorrectionException {
        return correct(raster, polygon, clipper.centeredWindow(raster));
    }

    private CorrectionResult correct(RasterStack raster, PanelPolygon polygon, ClipWindow window)
            throws PanelCorrectionException {
        if (!polygon.isUsable()) {
            throw new IncompletePolygonException(
                    "Polygon has only " + polygon.getDistinctVertexCount() + " distinct vertices",
                    CaptureState.CLOSED);
        }

        float[] panelStatistics = statistics.extract(polygon, raster);
        List<BandCorrection> corrections = correction.deriveFactors(panelStatistics);
        RasterStack corrected = correction.apply(raster, corrections);
        RasterStack clipped = WindowClipper.clip(corrected, window);

        return new CorrectionResult(polygon, corrections, corrected, window, clipped);
    }

    private Optional<PanelPolygon> capturePolygon(Path inputFile, RasterStack raster) {
        PolygonCaptureSession session = new PolygonCaptureSession(
                config.getSnapDistance(), raster.getWidth(), raster.getHeight());
        CaptureEventSource events = captureFactory.open(inputFile, raster);
        Optional<PanelPolygon> polygon = session.capture(events);
        polygon.ifPresent(p -> logger.info("Captured panel polygon {}", p));
        return polygon;
    }

    private void writeOutputs(Path inputFile, Path outputFolder, RasterStack raster, CorrectionResult result)
            throws IOException {
        Path correctedPath = outputFolder.resolve(config.getCorrectedFileName());
        Path clippedPath = outputFolder.resolve(config.getClippedFileName());

        sink.write(correctedPath, result.corrected());
        logger.info("Saved corrected image to {}", correctedPath);

        sink.write(clippedPath, result.clipped());
        logger.info("Saved clipped image to {} (transform:\n{})",
                clippedPath, GeoTransforms.describe(result.clipped().getGeoTransform()));

        if (config.isWriteReport()) {
            CorrectionReport report = new CorrectionReport(
                    inputFile.toString(),
                    OffsetDateTime.now().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                    result.polygon().getVertices(),
                    config.getTopK(),
                    config.getReflectanceFactor(),
                    result.corrections(),
                    result.clipWindow(),
                    raster.getGeoTransform(),
                    result.clipped().getGeoTransform(),
                    correctedPath.getFileName().toString(),
                    clippedPath.getFileName().toString());
            reportWriter.write(outputFolder.resolve(CorrectionConfig.REPORT_FILE_NAME), report);
        }
    }

    /**
     * @return the file name without its last extension
     */
    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public CorrectionConfig getConfig() {
        return config;
    }
}
