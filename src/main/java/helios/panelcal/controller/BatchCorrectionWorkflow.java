package helios.panelcal.controller;

import helios.panelcal.model.PanelCorrectionException;
import helios.panelcal.utilities.CorrectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Corrects every matching raster of an input folder, one file at a time.
 *
 * <p>Files are processed in sorted order. A failure is confined to its own file: it is
 * logged, recorded as a {@link FileOutcome.Status#FAILED} outcome and the batch moves on.</p>
 *
 * @author helios-panelcal contributors
 * @since 0.1.0
 */
public class BatchCorrectionWorkflow {
    private static final Logger logger = LoggerFactory.getLogger(BatchCorrectionWorkflow.class);

    private final PanelCorrectionWorkflow fileWorkflow;

    public BatchCorrectionWorkflow(PanelCorrectionWorkflow fileWorkflow) {
        this.fileWorkflow = fileWorkflow;
    }

    /**
     * @param inputFolder  folder holding the input rasters (not searched recursively)
     * @param outputFolder folder receiving one subfolder per input file
     * @return one outcome per matching input file, in processing order
     * @throws IOException if the input folder cannot be listed or the output folder created
     */
    public List<FileOutcome> run(Path inputFolder, Path outputFolder) throws IOException {
        List<Path> inputs = listInputs(inputFolder);
        Files.createDirectories(outputFolder);
        logger.info("Found {} input files in {}", inputs.size(), inputFolder);

        List<FileOutcome> outcomes = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            Path file = inputs.get(i);
            logger.info("[{}/{}] {}", i + 1, inputs.size(), file.getFileName());
            outcomes.add(processSafely(file, outputFolder));
        }

        long corrected = outcomes.stream().filter(FileOutcome::isCorrected).count();
        logger.info("Batch finished: {} of {} files corrected", corrected, outcomes.size());
        return Collections.unmodifiableList(outcomes);
    }

    private FileOutcome processSafely(Path file, Path outputFolder) {
        Path target = outputFolder.resolve(PanelCorrectionWorkflow.stem(file));
        try {
            return fileWorkflow.process(file, outputFolder);
        } catch (PanelCorrectionException e) {
            logger.error("Correction failed for {}: {}", file.getFileName(), e.getMessage());
            return FileOutcome.failed(file, target, e);
        } catch (IOException e) {
            logger.error("I/O failure for {}", file.getFileName(), e);
            return FileOutcome.failed(file, target, e);
        } catch (RuntimeException e) {
            logger.error("Unexpected error for {}", file.getFileName(), e);
            return FileOutcome.failed(file, target, e);
        }
    }

    /**
     * Lists regular files of the folder whose extension is accepted by the configuration,
     * sorted by name.
     */
    List<Path> listInputs(Path inputFolder) throws IOException {
        if (!Files.isDirectory(inputFolder)) {
            throw new IOException("Input folder does not exist: " + inputFolder);
        }
        CorrectionConfig config = fileWorkflow.getConfig();
        try (Stream<Path> entries = Files.list(inputFolder)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> config.matchesInput(p.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
