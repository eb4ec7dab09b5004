package helios.panelcal.service;

import helios.panelcal.model.BandCorrection;
import helios.panelcal.model.ClipWindow;
import helios.panelcal.model.PixelPoint;

import java.awt.geom.AffineTransform;
import java.util.List;

/**
 * Record of one corrected file, persisted as {@code correction_report.json} next to the
 * outputs so a correction can be audited or reverted later.
 */
public class CorrectionReport {
    private final String sourceFile;
    private final String createdAt;
    private final List<PixelPoint> polygon;
    private final int topK;
    private final double reflectanceFactor;
    private final List<BandCorrection> bands;
    private final ClipWindow clipWindow;
    private final AffineTransform sourceTransform;
    private final AffineTransform clipTransform;
    private final String correctedFile;
    private final String clippedFile;

    public CorrectionReport(String sourceFile, String createdAt, List<PixelPoint> polygon, int topK,
                            double reflectanceFactor, List<BandCorrection> bands, ClipWindow clipWindow,
                            AffineTransform sourceTransform, AffineTransform clipTransform,
                            String correctedFile, String clippedFile) {
        this.sourceFile = sourceFile;
        this.createdAt = createdAt;
        this.polygon = List.copyOf(polygon);
        this.topK = topK;
        this.reflectanceFactor = reflectanceFactor;
        this.bands = List.copyOf(bands);
        this.clipWindow = clipWindow;
        this.sourceTransform = sourceTransform == null ? null : new AffineTransform(sourceTransform);
        this.clipTransform = clipTransform == null ? null : new AffineTransform(clipTransform);
        this.correctedFile = correctedFile;
        this.clippedFile = clippedFile;
    }

    public String getSourceFile() { return sourceFile; }
    public String getCreatedAt() { return createdAt; }
    public List<PixelPoint> getPolygon() { return polygon; }
    public int getTopK() { return topK; }
    public double getReflectanceFactor() { return reflectanceFactor; }
    public List<BandCorrection> getBands() { return bands; }
    public ClipWindow getClipWindow() { return clipWindow; }
    public AffineTransform getSourceTransform() {
        return sourceTransform == null ? null : new AffineTransform(sourceTransform);
    }
    public AffineTransform getClipTransform() {
        return clipTransform == null ? null : new AffineTransform(clipTransform);
    }
    public String getCorrectedFile() { return correctedFile; }
    public String getClippedFile() { return clippedFile; }

    @Override
    public String toString() {
        return String.format("CorrectionReport[%s, %d bands, clip %s]", sourceFile, bands.size(), clipWindow);
    }
}
