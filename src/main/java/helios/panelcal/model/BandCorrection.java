package helios.panelcal.model;

/**
 * Correction derived for one band from the reference panel.
 *
 * @param bandIndex zero-based band index
 * @param statistic raw panel statistic (mean of the brightest panel pixels)
 * @param factor    correction factor {@code statistic / reflectance}; pixel values are divided by it
 * @param applied   false when the statistic was degenerate and the band passes through unchanged
 */
public record BandCorrection(int bandIndex, float statistic, float factor, boolean applied) {
}
