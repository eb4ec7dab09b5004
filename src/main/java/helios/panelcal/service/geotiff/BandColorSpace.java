package helios.panelcal.service.geotiff;

import java.awt.color.ColorSpace;
import java.util.Arrays;

/**
 * Color space for band stacks that are neither gray nor RGB, such as 5-band multispectral
 * captures. Band values are treated as independent intensities; only the first band feeds
 * the color conversions, which exist solely to satisfy {@link java.awt.image.ColorModel}.
 */
final class BandColorSpace extends ColorSpace {

    private static final ColorSpace GRAY = ColorSpace.getInstance(ColorSpace.CS_GRAY);

    BandColorSpace(int bandCount) {
        super(colorSpaceType(bandCount), bandCount);
    }

    private static int colorSpaceType(int bandCount) {
        return switch (bandCount) {
            case 2 -> TYPE_2CLR;
            case 4 -> TYPE_4CLR;
            case 5 -> TYPE_5CLR;
            case 6 -> TYPE_6CLR;
            case 7 -> TYPE_7CLR;
            case 8 -> TYPE_8CLR;
            case 9 -> TYPE_9CLR;
            case 10 -> TYPE_ACLR;
            case 11 -> TYPE_BCLR;
            case 12 -> TYPE_CCLR;
            case 13 -> TYPE_DCLR;
            case 14 -> TYPE_ECLR;
            case 15 -> TYPE_FCLR;
            default -> throw new IllegalArgumentException("Unsupported band count: " + bandCount);
        };
    }

    @Override
    public float[] toRGB(float[] colorvalue) {
        float v = clamp(colorvalue[0]);
        return new float[]{v, v, v};
    }

    @Override
    public float[] fromRGB(float[] rgbvalue) {
        return fromGray((rgbvalue[0] + rgbvalue[1] + rgbvalue[2]) / 3f);
    }

    @Override
    public float[] toCIEXYZ(float[] colorvalue) {
        return GRAY.toCIEXYZ(new float[]{clamp(colorvalue[0])});
    }

    @Override
    public float[] fromCIEXYZ(float[] colorvalue) {
        return fromGray(GRAY.fromCIEXYZ(colorvalue)[0]);
    }

    @Override
    public float getMinValue(int component) {
        return -Float.MAX_VALUE;
    }

    @Override
    public float getMaxValue(int component) {
        return Float.MAX_VALUE;
    }

    private float[] fromGray(float value) {
        float[] out = new float[getNumComponents()];
        Arrays.fill(out, value);
        return out;
    }

    private static float clamp(float v) {
        return Float.isNaN(v) ? 0f : Math.max(0f, Math.min(1f, v));
    }
}
