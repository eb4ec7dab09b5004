package helios.panelcal.utilities;

import helios.panelcal.model.ClipWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;

/**
 * GeoTransforms - helpers for pixel-to-world affine transforms.
 *
 * <p>Coefficients travel in the GDAL/rasterio order {@code (a, b, c, d, e, f)}:</p>
 * <pre>
 * x_world = a * col + b * row + c
 * y_world = d * col + e * row + f
 * </pre>
 * <p>and are held in a {@link AffineTransform}, whose constructor takes them as
 * {@code (a, d, b, e, c, f)}. A {@code null} transform is the "none" sentinel; an identity
 * transform read from a file is normalized to it.</p>
 *
 * @author helios-panelcal contributors
 * @since 0.1.0
 */
public final class GeoTransforms {
    private static final Logger logger = LoggerFactory.getLogger(GeoTransforms.class);

    private GeoTransforms() {}

    /**
     * Builds a transform from GDAL-ordered coefficients.
     *
     * @param abcdef six coefficients {@code a, b, c, d, e, f}
     */
    public static AffineTransform fromCoefficients(double[] abcdef) {
        if (abcdef == null || abcdef.length != 6) {
            throw new IllegalArgumentException("Affine transform needs six coefficients");
        }
        return new AffineTransform(abcdef[0], abcdef[3], abcdef[1], abcdef[4], abcdef[2], abcdef[5]);
    }

    /**
     * @return the six GDAL-ordered coefficients {@code a, b, c, d, e, f}
     */
    public static double[] toCoefficients(AffineTransform transform) {
        return new double[]{
                transform.getScaleX(), transform.getShearX(), transform.getTranslateX(),
                transform.getShearY(), transform.getScaleY(), transform.getTranslateY()
        };
    }

    /**
     * Maps identity (and null) to the "none" sentinel.
     */
    public static AffineTransform normalize(AffineTransform transform) {
        if (transform == null || transform.isIdentity()) {
            return null;
        }
        return transform;
    }

    /**
     * True when the transform has no rotation or shear terms, so it can be written as a
     * pixel scale plus tie point.
     */
    public static boolean isAxisAligned(AffineTransform transform) {
        return transform.getShearX() == 0.0 && transform.getShearY() == 0.0;
    }

    /**
     * Computes the transform of a window cut out of a raster.
     *
     * <p>Windowing only moves the origin: the result is the source transform composed with a
     * pixel translation by the window offset, so pixel {@code (0, 0)} of the window maps to
     * the same world point as pixel {@code (offsetX, offsetY)} of the source.</p>
     *
     * @param source source transform, or null for none
     * @param window the window
     * @return the window's transform, or null when the source has none
     */
    public static AffineTransform windowTransform(AffineTransform source, ClipWindow window) {
        if (source == null) {
            return null;
        }
        AffineTransform result = new AffineTransform(source);
        result.translate(window.offsetX(), window.offsetY());

        logger.debug("Window offset ({}, {}) moves origin ({}, {}) -> ({}, {})",
                window.offsetX(), window.offsetY(),
                source.getTranslateX(), source.getTranslateY(),
                result.getTranslateX(), result.getTranslateY());
        return result;
    }

    /**
     * Maps a pixel position to world coordinates.
     *
     * @return world coordinates [x, y]; the input unchanged for the none sentinel
     */
    public static double[] pixelToWorld(AffineTransform transform, double col, double row) {
        if (transform == null) {
            return new double[]{col, row};
        }
        Point2D.Double dst = new Point2D.Double();
        transform.transform(new Point2D.Double(col, row), dst);
        return new double[]{dst.x, dst.y};
    }

    /**
     * Human-readable form used in logs and reports.
     */
    public static String describe(AffineTransform transform) {
        if (transform == null) {
            return "none";
        }
        double[] c = toCoefficients(transform);
        return String.format("| %s, %s, %s |%n| %s, %s, %s |", c[0], c[1], c[2], c[3], c[4], c[5]);
    }
}
