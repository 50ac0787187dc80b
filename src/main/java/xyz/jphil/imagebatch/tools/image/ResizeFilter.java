package xyz.jphil.imagebatch.tools.image;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Resampling filters offered on the command line, mapped onto Java2D
 * interpolation. Gaussian and Lanczos halve the image step by step before the
 * final pass, which keeps detail when shrinking a lot.
 */
public enum ResizeFilter {
    NEAREST(RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR, false),
    TRIANGLE(RenderingHints.VALUE_INTERPOLATION_BILINEAR, false),
    CATMULLROM(RenderingHints.VALUE_INTERPOLATION_BICUBIC, false),
    GAUSSIAN(RenderingHints.VALUE_INTERPOLATION_BILINEAR, true),
    LANCZOS(RenderingHints.VALUE_INTERPOLATION_BICUBIC, true);

    private final Object interpolation;
    private final boolean progressive;

    ResizeFilter(Object interpolation, boolean progressive) {
        this.interpolation = interpolation;
        this.progressive = progressive;
    }

    public BufferedImage resample(BufferedImage source, int width, int height) {
        var current = source;
        if (progressive) {
            int w = source.getWidth();
            int h = source.getHeight();
            while (w / 2 >= width && h / 2 >= height) {
                w /= 2;
                h /= 2;
                current = draw(current, w, h);
            }
        }
        return draw(current, width, height);
    }

    private BufferedImage draw(BufferedImage source, int width, int height) {
        var target = new BufferedImage(width, height, targetType(source));
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, interpolation);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    // indexed and custom layouts cannot be drawn into directly
    private static int targetType(BufferedImage source) {
        int type = source.getType();
        if (type == BufferedImage.TYPE_CUSTOM
            || type == BufferedImage.TYPE_BYTE_INDEXED
            || type == BufferedImage.TYPE_BYTE_BINARY) {
            return source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        }
        return type;
    }
}
