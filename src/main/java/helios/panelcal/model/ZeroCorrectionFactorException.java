package helios.panelcal.model;

/**
 * Thrown when a band's panel statistic is zero, negative or NaN and the configured
 * policy does not allow the band to pass through uncorrected.
 */
public class ZeroCorrectionFactorException extends PanelCorrectionException {

    private final int bandIndex;
    private final float statistic;

    public ZeroCorrectionFactorException(int bandIndex, float statistic) {
        super(String.format("Band %d has a degenerate panel statistic (%s); correction factor would be undefined",
                bandIndex + 1, statistic));
        this.bandIndex = bandIndex;
        this.statistic = statistic;
    }

    /**
     * @return zero-based index of the offending band
     */
    public int getBandIndex() {
        return bandIndex;
    }

    public float getStatistic() {
        return statistic;
    }
}
