package xyz.jphil.imagebatch.tools.image;

import java.awt.image.BufferedImage;

/**
 * Transformation applied to every decoded image of a run.
 * Implementations are stateless and called concurrently by the worker pool.
 */
public interface ImageOperation {

    BufferedImage apply(BufferedImage image) throws OperationException;

    /**
     * Progress verb, e.g. "Resizing".
     */
    String verb();
}
