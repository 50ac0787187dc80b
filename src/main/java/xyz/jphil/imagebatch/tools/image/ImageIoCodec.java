package xyz.jphil.imagebatch.tools.image;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link ImageCodec} backed by the JDK ImageIO readers and writers.
 * Writes go to a temporary sibling file that is moved over the target.
 */
public class ImageIoCodec implements ImageCodec {

    static {
        ImageIO.setUseCache(false);
    }

    @Override
    public BufferedImage decode(Path path) throws DecodeException {
        if (!Files.exists(path)) {
            throw new DecodeException("File not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new DecodeException("Not a regular file: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new DecodeException("Permission denied: " + path);
        }

        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new DecodeException("Error decoding image " + path + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // some ImageIO plugins signal truncated data with unchecked exceptions
            throw new DecodeException("Corrupt image data in " + path + ": " + e, e);
        }

        if (image == null) {
            throw new DecodeException("Unsupported image format: " + path);
        }
        return image;
    }

    @Override
    public void save(BufferedImage image, Path path, ImageFormat formatHint) throws SaveException {
        var format = formatHint != null ? formatHint : ImageFormat.fromPath(path)
            .orElseThrow(() -> new SaveException("Could not obtain image format from output path: " + path));

        var encodable = ImageBuffers.encodable(image, format);
        var tempFile = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            if (!ImageIO.write(encodable, format.writerName(), tempFile.toFile())) {
                Files.deleteIfExists(tempFile);
                throw new SaveException(String.format("No %s writer can encode %s",
                    format, ImageBuffers.describe(encodable)));
            }
            Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            var failure = new SaveException("Error saving image file " + path + ": " + e.getMessage(), e);
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }
    }
}
