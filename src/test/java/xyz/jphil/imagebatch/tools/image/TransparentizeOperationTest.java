package xyz.jphil.imagebatch.tools.image;

import org.junit.jupiter.api.Test;
import xyz.jphil.imagebatch.tools.TestImages;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.*;

public class TransparentizeOperationTest {

    private final TransparentizeOperation operation = new TransparentizeOperation();

    @Test
    void whiteBecomesTransparent() {
        var result = operation.apply(TestImages.halfWhite(4, 2));

        assertEquals(BufferedImage.TYPE_INT_ARGB, result.getType());
        assertEquals(0xFFFF0000, result.getRGB(0, 0));
        assertEquals(0, result.getRGB(3, 1) >>> 24);
    }

    @Test
    void nearWhiteStaysOpaque() {
        var source = new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB);
        source.setRGB(0, 0, 0xFEFFFF);

        assertEquals(0xFF, operation.apply(source).getRGB(0, 0) >>> 24);
    }

    @Test
    void grayWhiteIsCleared() {
        var gray = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_GRAY);
        gray.getRaster().setSample(0, 0, 0, 255);
        gray.getRaster().setSample(1, 0, 0, 10);

        var result = operation.apply(gray);
        assertEquals(0, result.getRGB(0, 0) >>> 24);
        assertEquals(0xFF, result.getRGB(1, 0) >>> 24);
    }
}
