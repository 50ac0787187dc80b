package xyz.jphil.imagebatch.tools.image;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Metadata shown by the {@code info} command.
 * {@code decoderFormat} is the format name of the ImageIO reader that accepts
 * the file contents, whatever the extension says. {@code format} is null when
 * that is not a format the tool writes.
 */
public record ImageInfo(Path file, long fileSize, int width, int height, String decoderFormat,
                        ImageFormat format, ColorInfo color) {

    public static ImageInfo of(Path file, BufferedImage image) throws IOException {
        var decoderFormat = decoderFormat(file);
        return new ImageInfo(file, Files.size(file), image.getWidth(), image.getHeight(), decoderFormat,
            ImageFormat.fromExtension(decoderFormat).orElse(null), ColorInfo.fromImage(image));
    }

    /**
     * Format name reported by the first ImageIO reader that recognises the
     * file's bytes.
     */
    static String decoderFormat(Path file) throws IOException {
        try (var stream = ImageIO.createImageInputStream(file.toFile())) {
            if (stream == null) {
                throw new IOException("Cannot open image stream: " + file);
            }
            var readers = ImageIO.getImageReaders(stream);
            if (!readers.hasNext()) {
                throw new IOException("No image reader recognises " + file);
            }
            var reader = readers.next();
            try {
                return reader.getFormatName();
            } finally {
                reader.dispose();
            }
        }
    }

    public boolean hasAlpha() {
        return color.colorType().alpha();
    }

    public String formatName() {
        return format != null ? format.name() : decoderFormat.toUpperCase(Locale.ROOT);
    }

    public List<String> lines(boolean brief) {
        var lines = new ArrayList<String>();
        if (brief) {
            lines.add(String.format("%s: %dx%d %s %s", file.getFileName(), width, height, formatName(), color));
            return lines;
        }
        lines.add("Image file: " + file);
        lines.add(String.format("File size: %d bytes", fileSize));
        lines.add(String.format("Dimensions: %dx%d", width, height));
        lines.add("Format: " + formatName());
        lines.add("Color type: " + color.colorType().label());
        lines.add("Bit depth: " + color.bitDepth().bits());
        lines.add("Alpha channel: " + (hasAlpha() ? "yes" : "no"));
        return lines;
    }
}
