package helios.panelcal.model;

/**
 * Base type for the domain errors of the panel correction pipeline.
 *
 * <p>Every subtype is scoped to a single input file: the batch workflow catches it,
 * logs it and moves on to the next file.</p>
 *
 * @author helios-panelcal contributors
 */
public class PanelCorrectionException extends Exception {

    public PanelCorrectionException(String message) {
        super(message);
    }

    public PanelCorrectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
