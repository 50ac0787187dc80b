package xyz.jphil.imagebatch.tools;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates small test images on disk.
 */
public final class TestImages {

    private TestImages() {
        throw new IllegalStateException(String.format("Cannot instantiate: %s", TestImages.class.getName()));
    }

    /**
     * Left half red, right half white.
     */
    public static BufferedImage halfWhite(int width, int height) {
        var image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, x < width / 2 ? 0xFF0000 : 0xFFFFFF);
            }
        }
        return image;
    }

    public static Path png(Path dir, String name, int width, int height) {
        return write(halfWhite(width, height), dir.resolve(name), "png");
    }

    public static Path write(BufferedImage image, Path file, String format) {
        try {
            if (!ImageIO.write(image, format, file.toFile())) {
                throw new IllegalStateException("No writer for " + format);
            }
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<Path> pngs(Path dir, String prefix, int count) {
        var files = new ArrayList<Path>();
        for (int i = 0; i < count; i++) {
            files.add(png(dir, prefix + i + ".png", 8 + i, 6));
        }
        return files;
    }

    public static BufferedImage read(Path file) {
        try {
            return ImageIO.read(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] bytes(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
