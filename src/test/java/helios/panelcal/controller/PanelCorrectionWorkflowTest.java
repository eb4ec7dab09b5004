package helios.panelcal.controller;

import helios.panelcal.model.CaptureEvent;
import helios.panelcal.model.PolygonCaptureSession;
import helios.panelcal.model.RasterStack;
import helios.panelcal.model.WindowOutOfBoundsException;
import helios.panelcal.model.ZeroCorrectionFactorException;
import helios.panelcal.service.RasterReadException;
import helios.panelcal.service.RasterSink;
import helios.panelcal.service.RasterSource;
import helios.panelcal.service.ScriptedCaptureEvents;
import helios.panelcal.utilities.CorrectionConfig;
import helios.panelcal.utilities.GeoTransforms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.geom.AffineTransform;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PanelCorrectionWorkflowTest {

    @TempDir
    Path tmp;

    @Mock
    RasterSource source;

    @Mock
    RasterSink sink;

    private Path input;
    private AffineTransform transform;

    @BeforeEach
    void setUp() {
        input = tmp.resolve("IMG_0001.tif");
        transform = GeoTransforms.fromCoefficients(new double[]{0.1, 0, 300000, 0, -0.1, 5000000});
    }

    /**
     * 3-band 20x20 raster. Band 0 is 50 everywhere except a 4x4 patch of 100 at rows and
     * columns 4..7; bands 1 and 2 are constant 10 and 20.
     */
    private RasterStack syntheticRaster() {
        float[][][] bands = new float[3][20][20];
        for (int r = 0; r < 20; r++) {
            for (int c = 0; c < 20; c++) {
                bands[0][r][c] = (r >= 4 && r < 8 && c >= 4 && c < 8) ? 100f : 50f;
                bands[1][r][c] = 10f;
                bands[2][r][c] = 20f;
            }
        }
        return new RasterStack(bands, transform);
    }

    private static CorrectionConfig.Builder baseConfig() {
        return new CorrectionConfig.Builder()
                .snapDistance(1.0)
                .reflectanceFactor(0.5)
                .clipSize(10, 10);
    }

    private static ScriptedCaptureEvents patchPolygon() {
        return ScriptedCaptureEvents.closedRing(4, 4, 8, 4, 8, 8, 4, 8);
    }

    private PanelCorrectionWorkflow workflow(CorrectionConfig config, ScriptedCaptureEvents events) {
        return new PanelCorrectionWorkflow(config, source, sink, (file, raster) -> events);
    }

    // ==================== End-to-End Tests ====================

    @Test
    @DisplayName("Patch of 100 with reflectance 0.5 gives factor 200 and maps 50 to 0.25")
    void endToEndCorrection() throws Exception {
        when(source.read(input)).thenReturn(syntheticRaster());
        ScriptedCaptureEvents events = patchPolygon();

        FileOutcome outcome = workflow(baseConfig().build(), events).process(input, tmp);

        assertEquals(FileOutcome.Status.CORRECTED, outcome.status());
        Path folder = tmp.resolve("IMG_0001");
        assertEquals(folder, outcome.outputFolder());
        assertEquals(1, events.getCloseCount());

        ArgumentCaptor<RasterStack> written = ArgumentCaptor.forClass(RasterStack.class);
        verify(sink).write(eq(folder.resolve("corrected_image.tif")), written.capture());
        verify(sink).write(eq(folder.resolve("clipped_image.tif")), written.capture());

        RasterStack corrected = written.getAllValues().get(0);
        assertEquals(20, corrected.getWidth());
        assertEquals(0.25f, corrected.getBand(0)[0][0], 1e-7f);
        assertEquals(0.5f, corrected.getBand(0)[5][5], 1e-7f);
        assertEquals(0.5f, corrected.getBand(1)[0][0], 1e-7f);
        assertEquals(0.5f, corrected.getBand(2)[19][19], 1e-7f);
        assertEquals(transform, corrected.getGeoTransform());

        RasterStack clipped = written.getAllValues().get(1);
        assertEquals(10, clipped.getWidth());
        assertEquals(10, clipped.getHeight());
        assertEquals(3, clipped.getBandCount());
        // offset (5, 5): source pixel (5, 5) is inside the patch
        assertEquals(0.5f, clipped.getBand(0)[0][0], 1e-7f);
        assertEquals(300000.5, clipped.getGeoTransform().getTranslateX(), 1e-6);
        assertEquals(4999999.5, clipped.getGeoTransform().getTranslateY(), 1e-6);

        assertTrue(Files.exists(folder.resolve("correction_report.json")));
        assertTrue(Files.readString(folder.resolve("correction_report.json")).contains("\"factor\": 200.0"));
        assertTrue(Files.exists(folder.resolve("correction.log")));
    }

    @Test
    void correctExposesFactors() throws Exception {
        PanelCorrectionWorkflow workflow = workflow(baseConfig().build(), patchPolygon());
        CorrectionResult result = workflow.correct(syntheticRaster(),
                new PolygonCaptureSession(1.0, 20, 20).capture(patchPolygon()).orElseThrow());

        assertEquals(200f, result.corrections().get(0).factor());
        assertEquals(20f, result.corrections().get(1).factor());
        assertEquals(40f, result.corrections().get(2).factor());
        assertEquals(5, result.clipWindow().offsetX());
    }

    @Test
    @DisplayName("A second corner within snap distance of the first does not close the ring")
    void cornerNearFirstVertexIsKept() throws Exception {
        when(source.read(input)).thenReturn(syntheticRaster());
        ScriptedCaptureEvents events = ScriptedCaptureEvents.of(
                CaptureEvent.click(4, 4),
                CaptureEvent.click(4.5, 4),
                CaptureEvent.click(12, 4),
                CaptureEvent.click(12, 12),
                CaptureEvent.click(4, 12),
                CaptureEvent.click(4, 4));

        FileOutcome outcome = workflow(baseConfig().build(), events).process(input, tmp);

        assertEquals(FileOutcome.Status.CORRECTED, outcome.status());
        assertEquals(6, events.getConsumedCount());
        assertTrue(Files.readString(tmp.resolve("IMG_0001").resolve("correction_report.json"))
                .contains("\"factor\": 200.0"));
        verify(sink, times(2)).write(any(), any());
    }

    // ==================== Failure Tests ====================

    @Test
    @DisplayName("Oversized clip fails the file before anything is created or captured")
    void oversizedClipWritesNothing() throws Exception {
        when(source.read(input)).thenReturn(syntheticRaster());
        ScriptedCaptureEvents events = patchPolygon();
        PanelCorrectionWorkflow workflow = workflow(baseConfig().clipSize(30, 10).build(), events);

        assertThrows(WindowOutOfBoundsException.class, () -> workflow.process(input, tmp));

        verify(sink, never()).write(any(), any());
        assertFalse(Files.exists(tmp.resolve("IMG_0001")));
        assertEquals(0, events.getConsumedCount());
    }

    @Test
    void streamWithoutClosureSkipsFile() throws Exception {
        when(source.read(input)).thenReturn(syntheticRaster());
        ScriptedCaptureEvents events = ScriptedCaptureEvents.of(CaptureEvent.click(4, 4), CaptureEvent.click(8, 4));

        FileOutcome outcome = workflow(baseConfig().build(), events).process(input, tmp);

        assertEquals(FileOutcome.Status.SKIPPED_NO_POLYGON, outcome.status());
        assertEquals(1, events.getCloseCount());
        verify(sink, never()).write(any(), any());
    }

    @Test
    void degeneratePolygonSkipsFile() throws Exception {
        when(source.read(input)).thenReturn(syntheticRaster());
        ScriptedCaptureEvents events = ScriptedCaptureEvents.of(
                CaptureEvent.click(4, 4), CaptureEvent.click(8, 8), CaptureEvent.commit());

        FileOutcome outcome = workflow(baseConfig().build(), events).process(input, tmp);

        assertEquals(FileOutcome.Status.SKIPPED_NO_POLYGON, outcome.status());
        verify(sink, never()).write(any(), any());
    }

    @Test
    void degenerateBandUnderFailPolicyWritesNothing() throws Exception {
        RasterStack raster = syntheticRaster();
        for (float[] row : raster.getBand(2)) {
            Arrays.fill(row, 0f);
        }
        when(source.read(input)).thenReturn(raster);
        CorrectionConfig config = baseConfig()
                .degenerateBandPolicy(CorrectionConfig.DegenerateBandPolicy.FAIL)
                .build();

        ZeroCorrectionFactorException e = assertThrows(ZeroCorrectionFactorException.class,
                () -> workflow(config, patchPolygon()).process(input, tmp));

        assertEquals(2, e.getBandIndex());
        verify(sink, never()).write(any(), any());
    }

    @Test
    void readFailurePropagates() throws Exception {
        when(source.read(input)).thenThrow(new RasterReadException("corrupt"));
        ScriptedCaptureEvents events = patchPolygon();

        assertThrows(RasterReadException.class, () -> workflow(baseConfig().build(), events).process(input, tmp));
        assertEquals(0, events.getConsumedCount());
        verifyNoInteractions(sink);
    }

    @Test
    void reportCanBeDisabled() throws Exception {
        when(source.read(input)).thenReturn(syntheticRaster());
        CorrectionConfig config = baseConfig().writeReport(false).runLog(false).build();

        workflow(config, patchPolygon()).process(input, tmp);

        assertFalse(Files.exists(tmp.resolve("IMG_0001").resolve("correction_report.json")));
        assertFalse(Files.exists(tmp.resolve("IMG_0001").resolve("correction.log")));
        verify(sink, times(2)).write(any(), any());
    }

    @Test
    void stemDropsLastExtensionOnly() {
        assertEquals("IMG_0001", PanelCorrectionWorkflow.stem(Path.of("IMG_0001.tif")));
        assertEquals("scene.v2", PanelCorrectionWorkflow.stem(Path.of("scene.v2.tiff")));
        assertEquals("noext", PanelCorrectionWorkflow.stem(Path.of("noext")));
    }
}
