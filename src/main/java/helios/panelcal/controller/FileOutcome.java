package helios.panelcal.controller;

import java.nio.file.Path;

/**
 * Result of processing one input file in a batch.
 *
 * @param file         the input file
 * @param status       what happened
 * @param outputFolder folder the outputs went to, or null when none was created
 * @param message      short description for summaries and logs
 */
public record FileOutcome(Path file, Status status, Path outputFolder, String message) {

    public enum Status {
        CORRECTED,
        SKIPPED_NO_POLYGON,
        FAILED
    }

    public static FileOutcome corrected(Path file, Path outputFolder) {
        return new FileOutcome(file, Status.CORRECTED, outputFolder, "corrected");
    }

    public static FileOutcome skipped(Path file, Path outputFolder, String reason) {
        return new FileOutcome(file, Status.SKIPPED_NO_POLYGON, outputFolder, reason);
    }

    public static FileOutcome failed(Path file, Path outputFolder, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new FileOutcome(file, Status.FAILED, outputFolder, message);
    }

    public boolean isCorrected() {
        return status == Status.CORRECTED;
    }

    @Override
    public String toString() {
        return String.format("%s: %s (%s)", file.getFileName(), status, message);
    }
}
