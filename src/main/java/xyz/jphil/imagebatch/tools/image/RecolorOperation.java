package xyz.jphil.imagebatch.tools.image;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.awt.image.BufferedImage;

@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public class RecolorOperation implements ImageOperation {

    private final ColorInfo target;

    @Override
    public BufferedImage apply(BufferedImage image) throws OperationException {
        return target.convert(image);
    }

    @Override
    public String verb() {
        return "Recoloring";
    }
}
