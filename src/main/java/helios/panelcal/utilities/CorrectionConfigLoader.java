package helios.panelcal.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CorrectionConfigLoader
 *
 * <p>Reads a YAML settings file into a {@link CorrectionConfig}:
 *   - Parses nested YAML into a Map&lt;String,Object&gt;.
 *   - Offers typed getters over key paths (getDouble, getInteger, getSection, ...).
 *   - Falls back to the documented default for every missing or malformed key.
 *
 * <p>Recognized layout:</p>
 * <pre>
 * snap_distance: 5
 * top_k: 10
 * reflectance_factor: 0.5
 * clip_size:
 *   width: 1600
 *   height: 1300
 * degenerate_band_policy: pass_through   # or fail
 * input_extensions: [".tif", ".tiff"]
 * output:
 *   corrected_file_name: corrected_image.tif
 *   clipped_file_name: clipped_image.tif
 *   write_report: true
 *   run_log: true
 * </pre>
 *
 * @author helios-panelcal contributors
 */
public class CorrectionConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(CorrectionConfigLoader.class);

    private final Map<String, Object> configData;
    private final String origin;

    private CorrectionConfigLoader(Map<String, Object> configData, String origin) {
        this.configData = configData;
        this.origin = origin;
    }

    /**
     * Loads settings from a YAML file.
     *
     * @param path YAML file
     * @return loader over the parsed document
     * @throws IOException if the file cannot be read or is not valid YAML
     */
    public static CorrectionConfigLoader fromFile(Path path) throws IOException {
        logger.info("Loading correction settings from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return new CorrectionConfigLoader(parse(new Yaml().load(in), path.toString()), path.toString());
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML in " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads settings from YAML text.
     *
     * @throws IOException if the text is not valid YAML
     */
    public static CorrectionConfigLoader fromString(String yamlText) throws IOException {
        try (Reader reader = new StringReader(yamlText)) {
            return new CorrectionConfigLoader(parse(new Yaml().load(reader), "<string>"), "<string>");
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(Object loaded, String origin) {
        if (loaded == null) {
            logger.warn("YAML document {} is empty; using defaults", origin);
            return new LinkedHashMap<>();
        }
        if (loaded instanceof Map) {
            return new LinkedHashMap<>((Map<String, Object>) loaded);
        }
        logger.error("YAML root is not a map: {}", origin);
        return new LinkedHashMap<>();
    }

    /**
     * @return unmodifiable view of the whole parsed document
     */
    public Map<String, Object> getAllConfig() {
        return Collections.unmodifiableMap(configData);
    }

    /**
     * Retrieves a nested value by key path.
     *
     * @param keys sequence of keys (e.g. "clip_size", "width")
     * @return the value, or null if any key on the path is missing
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (String key : keys) {
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
            } else {
                logger.debug("Key {} not found in {}", String.join("/", keys), origin);
                return null;
            }
        }
        return current;
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return (v != null) ? v.toString() : null;
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return (v != null) ? Integer.parseInt(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Boolean getBoolean(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Boolean b) return b;
        return (v != null) ? Boolean.parseBoolean(v.toString().trim()) : null;
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof List<?>) ? (List<Object>) v : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof Map<?, ?>) ? (Map<String, Object>) v : null;
    }

    /**
     * Builds the configuration, applying defaults for absent keys.
     *
     * @return validated configuration
     * @throws IllegalStateException if a present value is out of range
     */
    public CorrectionConfig toConfig() {
        CorrectionConfig.Builder builder = new CorrectionConfig.Builder();

        Double snap = getDouble("snap_distance");
        if (snap != null) builder.snapDistance(snap);

        Integer topK = getInteger("top_k");
        if (topK != null) builder.topK(topK);

        Double reflectance = getDouble("reflectance_factor");
        if (reflectance != null) builder.reflectanceFactor(reflectance);

        Integer clipWidth = getInteger("clip_size", "width");
        Integer clipHeight = getInteger("clip_size", "height");
        builder.clipSize(
                clipWidth != null ? clipWidth : CorrectionConfig.DEFAULT_CLIP_WIDTH,
                clipHeight != null ? clipHeight : CorrectionConfig.DEFAULT_CLIP_HEIGHT);

        String policy = getString("degenerate_band_policy");
        if (policy != null) {
            try {
                builder.degenerateBandPolicy(
                        CorrectionConfig.DegenerateBandPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                logger.warn("Unknown degenerate_band_policy '{}'; using {}",
                        policy, CorrectionConfig.DegenerateBandPolicy.PASS_THROUGH);
            }
        }

        List<Object> extensions = getList("input_extensions");
        if (extensions != null) {
            List<String> exts = new ArrayList<>();
            for (Object ext : extensions) {
                if (ext != null) {
                    String s = ext.toString().trim();
                    exts.add(s.startsWith(".") ? s : "." + s);
                }
            }
            builder.inputExtensions(exts);
        }

        String corrected = getString("output", "corrected_file_name");
        if (corrected != null) builder.correctedFileName(corrected);

        String clipped = getString("output", "clipped_file_name");
        if (clipped != null) builder.clippedFileName(clipped);

        Boolean report = getBoolean("output", "write_report");
        if (report != null) builder.writeReport(report);

        Boolean runLog = getBoolean("output", "run_log");
        if (runLog != null) builder.runLog(runLog);

        CorrectionConfig config = builder.build();
        logger.info("Loaded {} from {}", config, origin);
        return config;
    }
}
