package xyz.jphil.imagebatch.tools.image;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Reads and writes image files.
 * Implementations must be safe to call from several worker threads at once.
 */
public interface ImageCodec {

    BufferedImage decode(Path path) throws DecodeException;

    /**
     * @param formatHint output format, or {@code null} to derive it from the file extension
     */
    void save(BufferedImage image, Path path, ImageFormat formatHint) throws SaveException;
}
