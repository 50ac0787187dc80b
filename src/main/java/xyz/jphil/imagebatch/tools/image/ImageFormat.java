package xyz.jphil.imagebatch.tools.image;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Image formats the tool can write through ImageIO.
 * The first extension of each format is the one used for output files.
 */
public enum ImageFormat {
    PNG("png", true, "png"),
    JPEG("jpeg", false, "jpg", "jpeg"),
    BMP("bmp", false, "bmp"),
    GIF("gif", true, "gif"),
    TIFF("tiff", true, "tif", "tiff");

    private final String writerName;
    private final boolean alpha;
    private final List<String> extensions;

    ImageFormat(String writerName, boolean alpha, String... extensions) {
        this.writerName = writerName;
        this.alpha = alpha;
        this.extensions = List.of(extensions);
    }

    public String writerName() {
        return writerName;
    }

    public boolean supportsAlpha() {
        return alpha;
    }

    public String extension() {
        return extensions.get(0);
    }

    public List<String> extensions() {
        return extensions;
    }

    /**
     * Look up a format by file extension, with or without the leading dot.
     */
    public static Optional<ImageFormat> fromExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return Optional.empty();
        }
        var normalized = extension.strip().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        var key = normalized;
        return Arrays.stream(values())
            .filter(format -> format.extensions.contains(key))
            .findFirst();
    }

    public static Optional<ImageFormat> fromPath(Path path) {
        return fromExtension(extensionOf(path));
    }

    /**
     * Extension of the file name without the dot, or an empty string.
     * Hidden files such as {@code .png} have no extension.
     */
    public static String extensionOf(Path path) {
        var name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot > 0 && dot < name.length() - 1 ? name.substring(dot + 1) : "";
    }

    /**
     * File name without its extension.
     */
    public static String stemOf(Path path) {
        var name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String fileName(Path path) {
        var fileName = path.getFileName();
        return fileName == null ? "" : fileName.toString();
    }

    public static String supportedExtensions() {
        return String.join(", ", Arrays.stream(values()).flatMap(f -> f.extensions.stream()).toList());
    }
}
