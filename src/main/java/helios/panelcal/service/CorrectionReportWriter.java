package helios.panelcal.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import helios.panelcal.utilities.GeoTransforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.AffineTransform;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves and loads {@link CorrectionReport}s as pretty-printed JSON.
 *
 * @author helios-panelcal contributors
 */
public class CorrectionReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(CorrectionReportWriter.class);

    private final Gson gson;

    public CorrectionReportWriter() {
        this.gson = new GsonBuilder()
                .registerTypeAdapter(AffineTransform.class, new GeoTransformAdapter())
                .serializeNulls()
                .setPrettyPrinting()
                .create();
    }

    public void write(Path file, CorrectionReport report) throws IOException {
        Files.writeString(file, gson.toJson(report), StandardCharsets.UTF_8);
        logger.info("Saved correction report to {}", file);
    }

    public CorrectionReport read(Path file) throws IOException {
        try {
            CorrectionReport report = gson.fromJson(Files.readString(file, StandardCharsets.UTF_8), CorrectionReport.class);
            if (report == null) {
                throw new IOException("Empty correction report: " + file);
            }
            return report;
        } catch (JsonParseException e) {
            throw new IOException("Invalid correction report " + file + ": " + e.getMessage(), e);
        }
    }

    String toJson(CorrectionReport report) {
        return gson.toJson(report);
    }

    /**
     * Writes transforms as their six named coefficients {@code a..f}; the none sentinel is null.
     */
    private static class GeoTransformAdapter extends TypeAdapter<AffineTransform> {
        private static final String[] NAMES = {"a", "b", "c", "d", "e", "f"};

        @Override
        public void write(JsonWriter out, AffineTransform transform) throws IOException {
            if (transform == null) {
                out.nullValue();
                return;
            }
            double[] coefficients = GeoTransforms.toCoefficients(transform);
            out.beginObject();
            for (int i = 0; i < NAMES.length; i++) {
                out.name(NAMES[i]).value(coefficients[i]);
            }
            out.endObject();
        }

        @Override
        public AffineTransform read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            double[] coefficients = {1, 0, 0, 0, 1, 0};
            in.beginObject();
            while (in.hasNext()) {
                String name = in.nextName();
                switch (name) {
                    case "a" -> coefficients[0] = in.nextDouble();
                    case "b" -> coefficients[1] = in.nextDouble();
                    case "c" -> coefficients[2] = in.nextDouble();
                    case "d" -> coefficients[3] = in.nextDouble();
                    case "e" -> coefficients[4] = in.nextDouble();
                    case "f" -> coefficients[5] = in.nextDouble();
                    default -> in.skipValue();
                }
            }
            in.endObject();
            return GeoTransforms.fromCoefficients(coefficients);
        }
    }
}
