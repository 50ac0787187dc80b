package xyz.jphil.imagebatch.tools.image;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Re-encodes the image in memory through the target format, so that lossy
 * formats and dropped alpha channels are visible before the save step.
 * Without a target format the image passes through and is saved under the
 * format of its output path.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public class ConvertOperation implements ImageOperation {

    private final ImageFormat format;

    @Override
    public BufferedImage apply(BufferedImage image) throws OperationException {
        if (format == null) {
            return image;
        }

        var buffer = new ByteArrayOutputStream();
        try {
            var encodable = ImageBuffers.encodable(image, format);
            if (!ImageIO.write(encodable, format.writerName(), buffer)) {
                throw new OperationException(String.format("Cannot convert %s image to %s",
                    ImageBuffers.describe(image), format));
            }
            var converted = ImageIO.read(new ByteArrayInputStream(buffer.toByteArray()));
            if (converted == null) {
                throw new OperationException("Could not read back image converted to " + format);
            }
            return converted;
        } catch (IOException e) {
            throw new OperationException("Error converting image to " + format + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String verb() {
        return "Converting";
    }
}
