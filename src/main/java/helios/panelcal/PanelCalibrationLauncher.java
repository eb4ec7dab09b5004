package helios.panelcal;

import helios.panelcal.controller.BatchCorrectionWorkflow;
import helios.panelcal.controller.FileOutcome;
import helios.panelcal.controller.PanelCorrectionWorkflow;
import helios.panelcal.service.geotiff.GeoTiffRasterReader;
import helios.panelcal.service.geotiff.GeoTiffRasterWriter;
import helios.panelcal.ui.PolygonCaptureWindow;
import helios.panelcal.utilities.CorrectionConfig;
import helios.panelcal.utilities.CorrectionConfigLoader;
import javafx.application.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point.
 *
 * <pre>
 * PanelCalibrationLauncher &lt;input-folder&gt; &lt;output-folder&gt; [config.yml]
 * </pre>
 *
 * <p>Starts the JavaFX toolkit for the capture windows, then corrects every input raster on
 * the main thread and prints one summary line per file.</p>
 *
 * @author helios-panelcal contributors
 * @since 0.1.0
 */
public class PanelCalibrationLauncher {
    private static final Logger logger = LoggerFactory.getLogger(PanelCalibrationLauncher.class);

    public static void main(String[] args) {
        if (args.length < 2 || args.length > 3) {
            System.err.println("Usage: PanelCalibrationLauncher <input-folder> <output-folder> [config.yml]");
            System.exit(2);
        }
        Path input = Paths.get(args[0]);
        Path output = Paths.get(args[1]);

        int exitCode;
        try {
            CorrectionConfig config = args.length == 3
                    ? CorrectionConfigLoader.fromFile(Paths.get(args[2])).toConfig()
                    : CorrectionConfig.defaults();

            startToolkit();
            List<FileOutcome> outcomes = run(config, input, output);
            outcomes.forEach(System.out::println);
            exitCode = outcomes.stream().allMatch(o -> o.status() != FileOutcome.Status.FAILED) ? 0 : 1;
        } catch (IOException | IllegalStateException e) {
            logger.error("Panel calibration failed: {}", e.getMessage(), e);
            exitCode = 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while starting JavaFX");
            exitCode = 1;
        } finally {
            Platform.exit();
        }
        System.exit(exitCode);
    }

    static List<FileOutcome> run(CorrectionConfig config, Path input, Path output) throws IOException {
        PanelCorrectionWorkflow workflow = new PanelCorrectionWorkflow(
                config, new GeoTiffRasterReader(), new GeoTiffRasterWriter(), new PolygonCaptureWindow());
        return new BatchCorrectionWorkflow(workflow).run(input, output);
    }

    private static void startToolkit() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        Platform.startup(started::countDown);
        started.await();
        Platform.setImplicitExit(false);
        logger.debug("JavaFX toolkit started");
    }
}
