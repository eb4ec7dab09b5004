package helios.panelcal.controller;

import helios.panelcal.model.WindowOutOfBoundsException;
import helios.panelcal.service.RasterReadException;
import helios.panelcal.utilities.CorrectionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchCorrectionWorkflowTest {

    @TempDir
    Path tmp;

    @Mock
    PanelCorrectionWorkflow fileWorkflow;

    private Path inputFolder;
    private Path outputFolder;

    @BeforeEach
    void setUp() throws IOException {
        inputFolder = Files.createDirectories(tmp.resolve("in"));
        outputFolder = tmp.resolve("out");
        for (String name : List.of("c.TIF", "a.tif", "b.tif", "notes.txt")) {
            Files.writeString(inputFolder.resolve(name), "x");
        }
        Files.createDirectories(inputFolder.resolve("sub.tif"));
        lenient().when(fileWorkflow.getConfig()).thenReturn(CorrectionConfig.defaults());
    }

    @Test
    @DisplayName("Failures are confined to their file and the batch continues in sorted order")
    void continuesAfterFailures() throws Exception {
        Path a = inputFolder.resolve("a.tif");
        Path b = inputFolder.resolve("b.tif");
        Path c = inputFolder.resolve("c.TIF");
        when(fileWorkflow.process(a, outputFolder)).thenThrow(new RasterReadException("corrupt"));
        when(fileWorkflow.process(b, outputFolder)).thenThrow(new WindowOutOfBoundsException(10, 10, 20, 20));
        when(fileWorkflow.process(c, outputFolder)).thenReturn(FileOutcome.corrected(c, outputFolder.resolve("c")));

        List<FileOutcome> outcomes = new BatchCorrectionWorkflow(fileWorkflow).run(inputFolder, outputFolder);

        assertEquals(3, outcomes.size());
        assertEquals(FileOutcome.Status.FAILED, outcomes.get(0).status());
        assertEquals("corrupt", outcomes.get(0).message());
        assertEquals(FileOutcome.Status.FAILED, outcomes.get(1).status());
        assertEquals(FileOutcome.Status.CORRECTED, outcomes.get(2).status());
        assertTrue(Files.isDirectory(outputFolder));

        InOrder order = inOrder(fileWorkflow);
        order.verify(fileWorkflow).process(a, outputFolder);
        order.verify(fileWorkflow).process(b, outputFolder);
        order.verify(fileWorkflow).process(c, outputFolder);
    }

    @Test
    void runtimeFailureIsRecorded() throws Exception {
        when(fileWorkflow.process(any(), any()))
                .thenThrow(new IllegalArgumentException("bad raster"))
                .thenReturn(FileOutcome.skipped(inputFolder.resolve("b.tif"), outputFolder.resolve("b"), "no polygon"))
                .thenReturn(FileOutcome.corrected(inputFolder.resolve("c.TIF"), outputFolder.resolve("c")));

        List<FileOutcome> outcomes = new BatchCorrectionWorkflow(fileWorkflow).run(inputFolder, outputFolder);

        assertEquals(FileOutcome.Status.FAILED, outcomes.get(0).status());
        assertEquals(outputFolder.resolve("a"), outcomes.get(0).outputFolder());
        assertEquals(FileOutcome.Status.SKIPPED_NO_POLYGON, outcomes.get(1).status());
        assertEquals(FileOutcome.Status.CORRECTED, outcomes.get(2).status());
    }

    @Test
    void listsOnlyMatchingRegularFilesSorted() throws IOException {
        List<Path> inputs = new BatchCorrectionWorkflow(fileWorkflow).listInputs(inputFolder);

        assertEquals(List.of(
                inputFolder.resolve("a.tif"),
                inputFolder.resolve("b.tif"),
                inputFolder.resolve("c.TIF")), inputs);
    }

    @Test
    void missingInputFolderIsIOException() {
        assertThrows(IOException.class,
                () -> new BatchCorrectionWorkflow(fileWorkflow).run(tmp.resolve("absent"), outputFolder));
    }
}
