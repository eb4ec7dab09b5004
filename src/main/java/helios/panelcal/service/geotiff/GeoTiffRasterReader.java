package helios.panelcal.service.geotiff;

import helios.panelcal.model.RasterStack;
import helios.panelcal.service.RasterReadException;
import helios.panelcal.service.RasterSource;
import helios.panelcal.utilities.GeoTransforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.stream.ImageInputStream;
import java.awt.geom.AffineTransform;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Reads multi-band GeoTIFFs through the JDK's TIFF ImageIO plugin.
 *
 * <p>Every band is converted to float regardless of the stored sample type. Only the first
 * image of the file is read. The geo-transform comes from the GeoTIFF model tags, or is the
 * "none" sentinel when those are missing.</p>
 *
 * @author helios-panelcal contributors
 * @since 0.1.0
 */
public class GeoTiffRasterReader implements RasterSource {
    private static final Logger logger = LoggerFactory.getLogger(GeoTiffRasterReader.class);

    @Override
    public RasterStack read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new RasterReadException("Raster file not found: " + path);
        }

        ImageReader reader = tiffReader();
        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            if (input == null) {
                throw new RasterReadException("Cannot open " + path);
            }
            reader.setInput(input, true, false);

            AffineTransform transform = readTransform(reader.getImageMetadata(0), path);
            Raster raster = reader.read(0).getRaster();

            int width = raster.getWidth();
            int height = raster.getHeight();
            int bandCount = raster.getNumBands();
            float[][][] bands = new float[bandCount][height][width];
            for (int b = 0; b < bandCount; b++) {
                for (int r = 0; r < height; r++) {
                    raster.getSamples(raster.getMinX(), raster.getMinY() + r, width, 1, b, bands[b][r]);
                }
            }

            logger.info("Read {}: {} bands, {}x{}, transform {}",
                    path.getFileName(), bandCount, width, height, transform == null ? "none" : "present");
            return new RasterStack(bands, transform);
        } catch (IIOException e) {
            throw new RasterReadException("Cannot decode " + path + ": " + e.getMessage(), e);
        } finally {
            reader.dispose();
        }
    }

    private static AffineTransform readTransform(IIOMetadata metadata, Path path) {
        if (metadata == null) {
            return null;
        }
        try {
            AffineTransform transform = GeoTiffTags.readTransform(TIFFDirectory.createFromMetadata(metadata));
            logger.debug("Geo-transform of {}:\n{}", path.getFileName(), GeoTransforms.describe(transform));
            return transform;
        } catch (IIOInvalidTreeException e) {
            logger.warn("Unreadable TIFF metadata in {}; treating as ungeoreferenced", path, e);
            return null;
        }
    }

    private static ImageReader tiffReader() throws RasterReadException {
        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("tiff");
        if (!readers.hasNext()) {
            throw new RasterReadException("No TIFF reader available");
        }
        return readers.next();
    }
}
