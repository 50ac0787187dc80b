package xyz.jphil.imagebatch.tools.image;

import java.awt.image.BufferedImage;

/**
 * Background removal: every pure white pixel becomes fully transparent.
 * The result is always 8-bit RGBA.
 */
public class TransparentizeOperation implements ImageOperation {

    private static final int RGB_MASK = 0x00FFFFFF;

    @Override
    public BufferedImage apply(BufferedImage image) {
        var target = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                int argb = image.getRGB(x, y);
                target.setRGB(x, y, (argb & RGB_MASK) == RGB_MASK ? argb & RGB_MASK : argb);
            }
        }
        return target;
    }

    @Override
    public String verb() {
        return "Removing background";
    }
}
