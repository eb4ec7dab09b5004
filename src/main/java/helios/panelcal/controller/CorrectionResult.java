package helios.panelcal.controller;

import helios.panelcal.model.BandCorrection;
import helios.panelcal.model.ClipWindow;
import helios.panelcal.model.PanelPolygon;
import helios.panelcal.model.RasterStack;

import java.util.List;

/**
 * In-memory products of correcting one raster.
 *
 * @param polygon     the panel polygon the statistics came from
 * @param corrections per-band statistic and factor
 * @param corrected   full-size corrected raster
 * @param clipWindow  centered window cut out of the corrected raster
 * @param clipped     the clipped raster, with its shifted geo-transform
 */
public record CorrectionResult(PanelPolygon polygon,
                               List<BandCorrection> corrections,
                               RasterStack corrected,
                               ClipWindow clipWindow,
                               RasterStack clipped) {
}
