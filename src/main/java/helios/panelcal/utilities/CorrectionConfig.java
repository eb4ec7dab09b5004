package helios.panelcal.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Immutable settings for one panel correction run.
 *
 * <p>Instances are built with {@link Builder}; every setting has a default so
 * {@code new CorrectionConfig.Builder().build()} is a valid configuration:</p>
 * <ul>
 *   <li>snap distance 5 pixels</li>
 *   <li>top-K 10 brightest panel pixels</li>
 *   <li>reference reflectance 0.5 (a 50% panel)</li>
 *   <li>clip size 1600 x 1300 pixels</li>
 *   <li>degenerate bands pass through uncorrected</li>
 *   <li>input files matched by extension {@code .tif}</li>
 * </ul>
 *
 * <p>The configuration is handed to the workflow at construction time; nothing in the
 * pipeline reads settings from global state.</p>
 *
 * @author helios-panelcal contributors
 * @since 0.1.0
 */
public class CorrectionConfig {

    public static final double DEFAULT_SNAP_DISTANCE = 5.0;
    public static final int DEFAULT_TOP_K = 10;
    public static final double DEFAULT_REFLECTANCE_FACTOR = 0.5;
    public static final int DEFAULT_CLIP_WIDTH = 1600;
    public static final int DEFAULT_CLIP_HEIGHT = 1300;
    public static final String DEFAULT_CORRECTED_FILE_NAME = "corrected_image.tif";
    public static final String DEFAULT_CLIPPED_FILE_NAME = "clipped_image.tif";
    public static final String REPORT_FILE_NAME = "correction_report.json";
    public static final String RUN_LOG_FILE_NAME = "correction.log";

    /**
     * What to do with a band whose panel statistic is zero, negative or NaN.
     */
    public enum DegenerateBandPolicy {
        /** Copy the band unchanged and log a warning. */
        PASS_THROUGH,
        /** Fail the file with a {@link helios.panelcal.model.ZeroCorrectionFactorException}. */
        FAIL
    }

    private double snapDistance = DEFAULT_SNAP_DISTANCE;
    private int topK = DEFAULT_TOP_K;
    private double reflectanceFactor = DEFAULT_REFLECTANCE_FACTOR;
    private int clipWidth = DEFAULT_CLIP_WIDTH;
    private int clipHeight = DEFAULT_CLIP_HEIGHT;
    private DegenerateBandPolicy degenerateBandPolicy = DegenerateBandPolicy.PASS_THROUGH;
    private List<String> inputExtensions = List.of(".tif");
    private String correctedFileName = DEFAULT_CORRECTED_FILE_NAME;
    private String clippedFileName = DEFAULT_CLIPPED_FILE_NAME;
    private boolean writeReport = true;
    private boolean runLog = true;

    private CorrectionConfig() {}

    /**
     * @return a configuration with every default applied
     */
    public static CorrectionConfig defaults() {
        return new Builder().build();
    }

    /**
     * Builder for {@link CorrectionConfig}. Setters log suspicious values; {@link #build()}
     * rejects invalid ones.
     */
    public static class Builder {
        private static final Logger logger = LoggerFactory.getLogger(Builder.class);
        private final CorrectionConfig config = new CorrectionConfig();

        public Builder snapDistance(double pixels) {
            logger.debug("Setting snap distance: {} px", pixels);
            config.snapDistance = pixels;
            return this;
        }

        public Builder topK(int count) {
            logger.debug("Setting top-K: {}", count);
            config.topK = count;
            return this;
        }

        /**
         * @param factor calibrated reflectance of the reference panel, in (0, 1]
         */
        public Builder reflectanceFactor(double factor) {
            logger.debug("Setting reflectance factor: {}", factor);
            if (factor > 1.0 && factor <= 100.0) {
                logger.warn("Reflectance factor {} looks like a percentage; expected a fraction in (0, 1]", factor);
            }
            config.reflectanceFactor = factor;
            return this;
        }

        public Builder clipSize(int width, int height) {
            logger.debug("Setting clip size: {}x{}", width, height);
            config.clipWidth = width;
            config.clipHeight = height;
            return this;
        }

        public Builder degenerateBandPolicy(DegenerateBandPolicy policy) {
            logger.debug("Setting degenerate band policy: {}", policy);
            config.degenerateBandPolicy = policy;
            return this;
        }

        /**
         * @param extensions file name suffixes, matched case-insensitively (e.g. ".tif")
         */
        public Builder inputExtensions(List<String> extensions) {
            logger.debug("Setting input extensions: {}", extensions);
            config.inputExtensions = extensions;
            return this;
        }

        public Builder correctedFileName(String name) {
            config.correctedFileName = name;
            return this;
        }

        public Builder clippedFileName(String name) {
            config.clippedFileName = name;
            return this;
        }

        public Builder writeReport(boolean write) {
            config.writeReport = write;
            return this;
        }

        public Builder runLog(boolean enabled) {
            config.runLog = enabled;
            return this;
        }

        /**
         * Validates and returns the configuration.
         *
         * @throws IllegalStateException if any setting is out of range
         */
        public CorrectionConfig build() {
            List<String> problems = new ArrayList<>();

            if (!(config.snapDistance > 0) || Double.isInfinite(config.snapDistance)) {
                problems.add("snap_distance must be a positive number, got " + config.snapDistance);
            }
            if (config.topK < 1) {
                problems.add("top_k must be at least 1, got " + config.topK);
            }
            if (!(config.reflectanceFactor > 0) || config.reflectanceFactor > 1.0) {
                problems.add("reflectance_factor must be in (0, 1], got " + config.reflectanceFactor);
            }
            if (config.clipWidth < 1 || config.clipHeight < 1) {
                problems.add(String.format("clip_size must be positive, got %dx%d", config.clipWidth, config.clipHeight));
            }
            if (config.degenerateBandPolicy == null) {
                problems.add("degenerate_band_policy must be set");
            }
            if (config.inputExtensions == null || config.inputExtensions.isEmpty()) {
                problems.add("input_extensions must contain at least one extension");
            }
            if (isBlank(config.correctedFileName) || isBlank(config.clippedFileName)) {
                problems.add("output file names must not be empty");
            } else if (config.correctedFileName.equals(config.clippedFileName)) {
                problems.add("corrected and clipped output file names must differ");
            }

            if (!problems.isEmpty()) {
                String error = String.join("; ", problems);
                logger.error("Build validation failed: {}", error);
                throw new IllegalStateException(error);
            }

            List<String> normalized = new ArrayList<>();
            for (String ext : config.inputExtensions) {
                normalized.add(ext.toLowerCase(Locale.ROOT));
            }

            // copy so later builder calls cannot reach the returned instance
            CorrectionConfig built = new CorrectionConfig();
            built.snapDistance = config.snapDistance;
            built.topK = config.topK;
            built.reflectanceFactor = config.reflectanceFactor;
            built.clipWidth = config.clipWidth;
            built.clipHeight = config.clipHeight;
            built.degenerateBandPolicy = config.degenerateBandPolicy;
            built.inputExtensions = Collections.unmodifiableList(normalized);
            built.correctedFileName = config.correctedFileName;
            built.clippedFileName = config.clippedFileName;
            built.writeReport = config.writeReport;
            built.runLog = config.runLog;

            logger.debug("Built CorrectionConfig: {}", built);
            return built;
        }

        private static boolean isBlank(String s) {
            return s == null || s.trim().isEmpty();
        }
    }

    public double getSnapDistance() { return snapDistance; }

    public int getTopK() { return topK; }

    public double getReflectanceFactor() { return reflectanceFactor; }

    public int getClipWidth() { return clipWidth; }

    public int getClipHeight() { return clipHeight; }

    public DegenerateBandPolicy getDegenerateBandPolicy() { return degenerateBandPolicy; }

    public List<String> getInputExtensions() { return inputExtensions; }

    public String getCorrectedFileName() { return correctedFileName; }

    public String getClippedFileName() { return clippedFileName; }

    public boolean isWriteReport() { return writeReport; }

    public boolean isRunLog() { return runLog; }

    /**
     * @return true when the file name ends with one of the configured input extensions
     */
    public boolean matchesInput(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String ext : inputExtensions) {
            if (lower.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format(
                "CorrectionConfig[snap=%s, topK=%d, reflectance=%s, clip=%dx%d, degenerate=%s, extensions=%s]",
                snapDistance, topK, reflectanceFactor, clipWidth, clipHeight, degenerateBandPolicy, inputExtensions);
    }
}
