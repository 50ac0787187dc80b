package xyz.jphil.imagebatch.tools.image;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Small BufferedImage helpers shared by the codec and the operations.
 */
public final class ImageBuffers {

    private ImageBuffers() {
        throw new IllegalStateException(String.format("Cannot instantiate: %s", ImageBuffers.class.getName()));
    }

    /**
     * Whether {@code format} cannot take {@code image} as is: alpha into an opaque
     * format, or samples wider than 8 bits into a format other than PNG/TIFF.
     */
    public static boolean needsFlattening(BufferedImage image, ImageFormat format) {
        var colorModel = image.getColorModel();
        if (colorModel.hasAlpha() && !format.supportsAlpha()) {
            return true;
        }
        if (format == ImageFormat.PNG || format == ImageFormat.TIFF) {
            return false;
        }
        for (int i = 0; i < colorModel.getNumComponents(); i++) {
            if (colorModel.getComponentSize(i) > 8) {
                return true;
            }
        }
        return false;
    }

    /**
     * Redraw into a packed 8-bit image. Opaque targets get a white background.
     */
    public static BufferedImage flatten(BufferedImage image, boolean keepAlpha) {
        var type = keepAlpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        var flat = new BufferedImage(image.getWidth(), image.getHeight(), type);
        Graphics2D g = flat.createGraphics();
        try {
            if (!keepAlpha) {
                g.setColor(Color.WHITE);
                g.fillRect(0, 0, image.getWidth(), image.getHeight());
            }
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return flat;
    }

    public static BufferedImage encodable(BufferedImage image, ImageFormat format) {
        return needsFlattening(image, format) ? flatten(image, format.supportsAlpha()) : image;
    }

    public static String describe(BufferedImage image) {
        var info = ColorInfo.fromImage(image);
        return String.format("%dx%d %s/%d-bit", image.getWidth(), image.getHeight(),
            info.colorType().label(), info.bitDepth().bits());
    }
}
