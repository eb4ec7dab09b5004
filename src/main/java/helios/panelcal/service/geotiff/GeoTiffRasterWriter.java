package helios.panelcal.service.geotiff;

import helios.panelcal.model.RasterStack;
import helios.panelcal.service.RasterSink;
import helios.panelcal.service.RasterWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Writes a {@link RasterStack} as an uncompressed float32 GeoTIFF.
 *
 * <p>All bands are written in order as one pixel-interleaved image. The geo-transform is
 * encoded with {@link GeoTiffTags}; a raster without one is written without GeoTIFF tags.
 * If the write fails the partial file is deleted.</p>
 *
 * @author helios-panelcal contributors
 * @since 0.1.0
 */
public class GeoTiffRasterWriter implements RasterSink {
    private static final Logger logger = LoggerFactory.getLogger(GeoTiffRasterWriter.class);

    @Override
    public void write(Path path, RasterStack raster) throws IOException {
        BufferedImage image = toImage(raster);

        ImageWriter writer = tiffWriter();
        try {
            Files.deleteIfExists(path);
            try (ImageOutputStream output = ImageIO.createImageOutputStream(path.toFile())) {
                if (output == null) {
                    throw new RasterWriteException("Cannot open " + path + " for writing");
                }
                writer.setOutput(output);

                ImageWriteParam param = writer.getDefaultWriteParam();
                IIOMetadata metadata = geoMetadata(writer, image, param, raster);
                writer.write(null, new IIOImage(image, null, metadata), param);
            }
            logger.info("Wrote {}: {} bands, {}x{}", path.getFileName(),
                    raster.getBandCount(), raster.getWidth(), raster.getHeight());
        } catch (IOException | RuntimeException e) {
            deletePartial(path);
            if (e instanceof RasterWriteException rwe) {
                throw rwe;
            }
            throw new RasterWriteException("Failed to write " + path + ": " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
    }

    private static IIOMetadata geoMetadata(ImageWriter writer, BufferedImage image,
                                           ImageWriteParam param, RasterStack raster) throws IIOInvalidTreeException {
        IIOMetadata defaults = writer.getDefaultImageMetadata(new ImageTypeSpecifier(image), param);
        if (!raster.hasGeoTransform()) {
            return defaults;
        }
        TIFFDirectory directory = TIFFDirectory.createFromMetadata(defaults);
        GeoTiffTags.writeTransform(directory, raster.getGeoTransform());
        return directory.getAsMetadata();
    }

    static BufferedImage toImage(RasterStack raster) {
        int bandCount = raster.getBandCount();
        ColorSpace colorSpace = switch (bandCount) {
            case 1 -> ColorSpace.getInstance(ColorSpace.CS_GRAY);
            case 3 -> ColorSpace.getInstance(ColorSpace.CS_sRGB);
            default -> new BandColorSpace(bandCount);
        };
        ComponentColorModel colorModel = new ComponentColorModel(
                colorSpace, false, false, Transparency.OPAQUE, DataBuffer.TYPE_FLOAT);
        WritableRaster out = colorModel.createCompatibleWritableRaster(raster.getWidth(), raster.getHeight());

        for (int b = 0; b < bandCount; b++) {
            float[][] band = raster.getBand(b);
            for (int r = 0; r < raster.getHeight(); r++) {
                out.setSamples(0, r, raster.getWidth(), 1, b, band[r]);
            }
        }
        return new BufferedImage(colorModel, out, false, null);
    }

    private static ImageWriter tiffWriter() throws RasterWriteException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("tiff");
        if (!writers.hasNext()) {
            throw new RasterWriteException("No TIFF writer available");
        }
        return writers.next();
    }

    private static void deletePartial(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                logger.warn("Removed partially written {}", path);
            }
        } catch (IOException e) {
            logger.error("Could not remove partially written {}", path, e);
        }
    }
}
