package helios.panelcal.service.geotiff;

import helios.panelcal.utilities.GeoTransforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import java.awt.geom.AffineTransform;

/**
 * Reads and writes the GeoTIFF tags that carry a raster's affine geo-transform.
 *
 * <p>Axis-aligned transforms are stored as ModelPixelScale + ModelTiepoint, everything
 * else as a ModelTransformation matrix. The GeoKeyDirectory written alongside only declares
 * the raster type (PixelIsArea); no coordinate reference system is recorded.</p>
 */
final class GeoTiffTags {
    private static final Logger logger = LoggerFactory.getLogger(GeoTiffTags.class);

    // version 1.1.0, one key: GTRasterTypeGeoKey = RasterPixelIsArea
    private static final char[] PIXEL_IS_AREA_KEYS = {1, 1, 0, 1, 1025, 0, 1, 1};

    private static final GeoTIFFTagSet GEO_TAGS = GeoTIFFTagSet.getInstance();

    private GeoTiffTags() {}

    /**
     * Decodes the geo-transform of a TIFF directory.
     *
     * @return the transform, or null when the directory has no usable georeferencing
     */
    static AffineTransform readTransform(TIFFDirectory directory) {
        TIFFField matrixField = directory.getTIFFField(GeoTIFFTagSet.TAG_MODEL_TRANSFORMATION);
        if (matrixField != null) {
            double[] m = matrixField.getAsDoubles();
            if (m.length >= 16) {
                // row-major 4x4: x' = m0*col + m1*row + m3, y' = m4*col + m5*row + m7
                return GeoTransforms.normalize(GeoTransforms.fromCoefficients(
                        new double[]{m[0], m[1], m[3], m[4], m[5], m[7]}));
            }
            logger.warn("Ignoring ModelTransformation tag with {} values", m.length);
        }

        TIFFField scaleField = directory.getTIFFField(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE);
        TIFFField tieField = directory.getTIFFField(GeoTIFFTagSet.TAG_MODEL_TIE_POINT);
        if (scaleField == null || tieField == null) {
            return null;
        }
        double[] scale = scaleField.getAsDoubles();
        double[] tie = tieField.getAsDoubles();
        if (scale.length < 2 || tie.length < 6) {
            logger.warn("Ignoring malformed tiepoint/scale tags ({} and {} values)", tie.length, scale.length);
            return null;
        }
        // raster point (i, j) maps to model point (x, y); rows grow southward
        double originX = tie[3] - tie[0] * scale[0];
        double originY = tie[4] + tie[1] * scale[1];
        return GeoTransforms.normalize(GeoTransforms.fromCoefficients(
                new double[]{scale[0], 0, originX, 0, -scale[1], originY}));
    }

    /**
     * Adds the tags for a transform to a directory. Nothing is added for a null transform.
     */
    static void writeTransform(TIFFDirectory directory, AffineTransform transform) {
        if (transform == null) {
            return;
        }
        double[] g = GeoTransforms.toCoefficients(transform);
        if (GeoTransforms.isAxisAligned(transform) && g[0] > 0 && g[4] < 0) {
            directory.addTIFFField(new TIFFField(tag(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE), TIFFTag.TIFF_DOUBLE, 3,
                    new double[]{g[0], -g[4], 0}));
            directory.addTIFFField(new TIFFField(tag(GeoTIFFTagSet.TAG_MODEL_TIE_POINT), TIFFTag.TIFF_DOUBLE, 6,
                    new double[]{0, 0, 0, g[2], g[5], 0}));
        } else {
            double[] matrix = {
                    g[0], g[1], 0, g[2],
                    g[3], g[4], 0, g[5],
                    0, 0, 0, 0,
                    0, 0, 0, 1
            };
            directory.addTIFFField(new TIFFField(tag(GeoTIFFTagSet.TAG_MODEL_TRANSFORMATION), TIFFTag.TIFF_DOUBLE, 16, matrix));
        }
        directory.addTIFFField(new TIFFField(tag(GeoTIFFTagSet.TAG_GEO_KEY_DIRECTORY), TIFFTag.TIFF_SHORT,
                PIXEL_IS_AREA_KEYS.length, PIXEL_IS_AREA_KEYS.clone()));
    }

    private static TIFFTag tag(int number) {
        return GEO_TAGS.getTag(number);
    }
}
