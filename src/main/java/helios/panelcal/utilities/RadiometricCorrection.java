package helios.panelcal.utilities;

import helios.panelcal.model.BandCorrection;
import helios.panelcal.model.RasterStack;
import helios.panelcal.model.ZeroCorrectionFactorException;
import helios.panelcal.utilities.CorrectionConfig.DegenerateBandPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Derives per-band correction factors from panel statistics and applies them.
 *
 * <p>With panel statistic {@code m} and reference reflectance {@code r}, the band's factor is
 * {@code m / r} and a pixel value {@code v} becomes {@code v / (m / r)}, i.e. the fraction of
 * the panel's brightness scaled to the panel's calibrated reflectance.</p>
 *
 * <p>A statistic that is zero, negative or NaN cannot produce a usable factor. Depending on
 * the {@link DegenerateBandPolicy} the band either passes through unchanged or the whole
 * derivation fails; Inf or NaN values are never produced by a zero divisor.</p>
 *
 * @author helios-panelcal contributors
 * @since 0.1.0
 */
public class RadiometricCorrection {
    private static final Logger logger = LoggerFactory.getLogger(RadiometricCorrection.class);

    private final double reflectanceFactor;
    private final DegenerateBandPolicy policy;

    /**
     * @param reflectanceFactor calibrated panel reflectance in (0, 1]
     * @param policy            handling of degenerate bands
     */
    public RadiometricCorrection(double reflectanceFactor, DegenerateBandPolicy policy) {
        if (!(reflectanceFactor > 0) || reflectanceFactor > 1.0) {
            throw new IllegalArgumentException("Reflectance factor must be in (0, 1], got " + reflectanceFactor);
        }
        if (policy == null) {
            throw new IllegalArgumentException("Degenerate band policy must not be null");
        }
        this.reflectanceFactor = reflectanceFactor;
        this.policy = policy;
    }

    /**
     * Computes the correction of every band.
     *
     * @param statistics panel statistic per band
     * @return one correction per band, in band order
     * @throws ZeroCorrectionFactorException if a band is degenerate and the policy is FAIL
     */
    public List<BandCorrection> deriveFactors(float[] statistics) throws ZeroCorrectionFactorException {
        List<BandCorrection> corrections = new ArrayList<>(statistics.length);
        for (int b = 0; b < statistics.length; b++) {
            float m = statistics[b];
            float factor = (float) (m / reflectanceFactor);

            if (isDegenerate(m) || !Float.isFinite(factor) || factor == 0f) {
                if (policy == DegenerateBandPolicy.FAIL) {
                    logger.error("Band {}: degenerate panel statistic {}", b + 1, m);
                    throw new ZeroCorrectionFactorException(b, m);
                }
                logger.warn("Band {}: degenerate panel statistic {}; band left uncorrected", b + 1, m);
                corrections.add(new BandCorrection(b, m, 1f, false));
                continue;
            }

            logger.info("Band {}: correction factor {} (statistic {} / reflectance {})",
                    b + 1, factor, m, reflectanceFactor);
            corrections.add(new BandCorrection(b, m, factor, true));
        }
        return Collections.unmodifiableList(corrections);
    }

    /**
     * Divides every pixel of each corrected band by its factor. The input is not modified.
     *
     * @param raster      full-resolution raster
     * @param corrections one correction per band
     * @return corrected raster with the same shape, band order and geo-transform
     */
    public RasterStack apply(RasterStack raster, List<BandCorrection> corrections) {
        checkBandCount(raster, corrections);

        float[][][] out = new float[raster.getBandCount()][][];
        for (BandCorrection correction : corrections) {
            float[][] src = raster.getBand(correction.bandIndex());
            float[][] dst = new float[raster.getHeight()][];
            for (int r = 0; r < dst.length; r++) {
                dst[r] = src[r].clone();
                if (correction.applied()) {
                    float factor = correction.factor();
                    for (int c = 0; c < dst[r].length; c++) {
                        dst[r][c] /= factor;
                    }
                }
            }
            out[correction.bandIndex()] = dst;
        }
        return raster.withBands(out);
    }

    /**
     * Undoes {@link #apply}: multiplies every corrected band by its factor.
     */
    public RasterStack revert(RasterStack corrected, List<BandCorrection> corrections) {
        checkBandCount(corrected, corrections);

        float[][][] out = new float[corrected.getBandCount()][][];
        for (BandCorrection correction : corrections) {
            float[][] src = corrected.getBand(correction.bandIndex());
            float[][] dst = new float[corrected.getHeight()][];
            for (int r = 0; r < dst.length; r++) {
                dst[r] = src[r].clone();
                if (correction.applied()) {
                    float factor = correction.factor();
                    for (int c = 0; c < dst[r].length; c++) {
                        dst[r][c] *= factor;
                    }
                }
            }
            out[correction.bandIndex()] = dst;
        }
        return corrected.withBands(out);
    }

    private static void checkBandCount(RasterStack raster, List<BandCorrection> corrections) {
        if (corrections.size() != raster.getBandCount()) {
            throw new IllegalArgumentException(String.format(
                    "Got %d corrections for a raster with %d bands", corrections.size(), raster.getBandCount()));
        }
        for (int b = 0; b < corrections.size(); b++) {
            if (corrections.get(b).bandIndex() != b) {
                throw new IllegalArgumentException("Corrections must be in band order");
            }
        }
    }

    private static boolean isDegenerate(float statistic) {
        return Float.isNaN(statistic) || statistic <= 0f;
    }

    public double getReflectanceFactor() {
        return reflectanceFactor;
    }

    public DegenerateBandPolicy getPolicy() {
        return policy;
    }
}
