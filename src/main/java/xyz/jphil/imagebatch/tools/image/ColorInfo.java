package xyz.jphil.imagebatch.tools.image;

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.WritableRaster;
import java.util.Arrays;

/**
 * Color type and bit depth of an image, and conversion between them.
 */
public record ColorInfo(ColorType colorType, BitDepth bitDepth) {

    public enum ColorType {
        RGB("RGB", false, false),
        RGBA("RGBA", false, true),
        LUMA("Luma", true, false),
        LUMA_ALPHA("LumaA", true, true);

        private final String label;
        private final boolean gray;
        private final boolean alpha;

        ColorType(String label, boolean gray, boolean alpha) {
            this.label = label;
            this.gray = gray;
            this.alpha = alpha;
        }

        public String label() {
            return label;
        }

        public boolean gray() {
            return gray;
        }

        public boolean alpha() {
            return alpha;
        }

        static ColorType of(boolean gray, boolean alpha) {
            if (gray) {
                return alpha ? LUMA_ALPHA : LUMA;
            }
            return alpha ? RGBA : RGB;
        }
    }

    public enum BitDepth {
        B8(8, DataBuffer.TYPE_BYTE),
        B16(16, DataBuffer.TYPE_USHORT),
        B32(32, DataBuffer.TYPE_FLOAT);

        private final int bits;
        private final int transferType;

        BitDepth(int bits, int transferType) {
            this.bits = bits;
            this.transferType = transferType;
        }

        public int bits() {
            return bits;
        }

        public static BitDepth of(int bits) {
            return Arrays.stream(values())
                .filter(depth -> depth.bits == bits)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Bit depth must be 8, 16 or 32."));
        }
    }

    public ColorInfo {
        if (colorType == null || bitDepth == null) {
            throw new IllegalArgumentException("color type and bit depth are required");
        }
    }

    public static ColorInfo fromImage(BufferedImage image) {
        var colorModel = image.getColorModel();
        boolean gray = colorModel.getColorSpace().getType() == ColorSpace.TYPE_GRAY;
        int componentBits = colorModel.getComponentSize(0);
        var depth = componentBits <= 8 ? BitDepth.B8 : componentBits <= 16 ? BitDepth.B16 : BitDepth.B32;
        return new ColorInfo(ColorType.of(gray, colorModel.hasAlpha()), depth);
    }

    /**
     * Luma has no 32-bit float variant, it is stored with 16 bits instead.
     */
    public BitDepth effectiveBitDepth() {
        return colorType.gray() && bitDepth == BitDepth.B32 ? BitDepth.B16 : bitDepth;
    }

    /**
     * Copy {@code source} into a new image with this color type and bit depth.
     * Gray values use the Rec. 601 luma weights.
     */
    public BufferedImage convert(BufferedImage source) throws OperationException {
        BufferedImage target;
        try {
            target = createImage(source.getWidth(), source.getHeight());
        } catch (IllegalArgumentException e) {
            throw new OperationException("Unsupported color conversion to " + this + ": " + e.getMessage(), e);
        }

        var depth = effectiveBitDepth();
        WritableRaster raster = target.getRaster();
        int bands = raster.getNumBands();
        var floats = new float[bands];
        var ints = new int[bands];

        for (int y = 0; y < source.getHeight(); y++) {
            for (int x = 0; x < source.getWidth(); x++) {
                int argb = source.getRGB(x, y);
                int a = (argb >>> 24) & 0xFF;
                int r = (argb >> 16) & 0xFF;
                int g = (argb >> 8) & 0xFF;
                int b = argb & 0xFF;

                int band = 0;
                if (colorType.gray()) {
                    floats[band++] = (float) Math.min(255.0, 0.299 * r + 0.587 * g + 0.114 * b);
                } else {
                    floats[band++] = r;
                    floats[band++] = g;
                    floats[band++] = b;
                }
                if (colorType.alpha()) {
                    floats[band] = a;
                }

                if (depth == BitDepth.B32) {
                    for (int i = 0; i < bands; i++) {
                        floats[i] = floats[i] / 255f;
                    }
                    raster.setPixel(x, y, floats);
                } else {
                    int scale = depth == BitDepth.B16 ? 257 : 1;
                    for (int i = 0; i < bands; i++) {
                        ints[i] = Math.round(floats[i]) * scale;
                    }
                    raster.setPixel(x, y, ints);
                }
            }
        }
        return target;
    }

    private BufferedImage createImage(int width, int height) {
        var depth = effectiveBitDepth();
        if (depth == BitDepth.B8 && colorType != ColorType.LUMA_ALPHA) {
            int type = switch (colorType) {
                case RGB -> BufferedImage.TYPE_INT_RGB;
                case RGBA -> BufferedImage.TYPE_INT_ARGB;
                default -> BufferedImage.TYPE_BYTE_GRAY;
            };
            return new BufferedImage(width, height, type);
        }
        if (depth == BitDepth.B16 && colorType == ColorType.LUMA) {
            return new BufferedImage(width, height, BufferedImage.TYPE_USHORT_GRAY);
        }

        var colorSpace = ColorSpace.getInstance(colorType.gray() ? ColorSpace.CS_GRAY : ColorSpace.CS_sRGB);
        var colorModel = new ComponentColorModel(colorSpace, colorType.alpha(), false,
            colorType.alpha() ? Transparency.TRANSLUCENT : Transparency.OPAQUE, depth.transferType);
        var raster = colorModel.createCompatibleWritableRaster(width, height);
        return new BufferedImage(colorModel, raster, false, null);
    }

    @Override
    public String toString() {
        return colorType.label() + "/" + bitDepth.bits() + "-bit";
    }
}
