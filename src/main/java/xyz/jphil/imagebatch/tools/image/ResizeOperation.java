package xyz.jphil.imagebatch.tools.image;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.awt.image.BufferedImage;

/**
 * Resamples to WIDTH x HEIGHT, or to the largest size that fits inside that
 * box when the aspect ratio is preserved.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public class ResizeOperation implements ImageOperation {

    private final int width;
    private final int height;
    private final ResizeFilter filter;
    private final boolean preserveAspect;

    @Override
    public BufferedImage apply(BufferedImage image) throws OperationException {
        if (width <= 0 || height <= 0) {
            throw new OperationException(String.format("Invalid target size %dx%d", width, height));
        }

        int targetWidth = width;
        int targetHeight = height;
        if (preserveAspect) {
            double scale = Math.min((double) width / image.getWidth(), (double) height / image.getHeight());
            targetWidth = Math.max(1, (int) Math.round(image.getWidth() * scale));
            targetHeight = Math.max(1, (int) Math.round(image.getHeight() * scale));
        }
        return filter.resample(image, targetWidth, targetHeight);
    }

    @Override
    public String verb() {
        return "Resizing";
    }
}
