package xyz.jphil.imagebatch.tools.command;

import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.TypeConversionException;
import xyz.jphil.imagebatch.tools.batch.ConfigurationException;
import xyz.jphil.imagebatch.tools.image.ColorInfo;
import xyz.jphil.imagebatch.tools.image.ColorInfo.BitDepth;
import xyz.jphil.imagebatch.tools.image.ColorInfo.ColorType;
import xyz.jphil.imagebatch.tools.image.ImageOperation;
import xyz.jphil.imagebatch.tools.image.RecolorOperation;

import java.util.Locale;

@Command(
    name = "recolor",
    description = "Change the color type and bit depth of images",
    mixinStandardHelpOptions = true
)
public class RecolorCommand extends AbstractImageCommand {

    @Option(
        names = {"-c", "--color-type"},
        required = true,
        converter = ColorTypeConverter.class,
        description = "rgb, rgba, luma or luma-alpha"
    )
    private ColorType colorType;

    @Option(names = {"-b", "--bit-depth"}, description = "8, 16 or 32 bits per channel (default: ${DEFAULT-VALUE})")
    private int bitDepth = 8;

    @Override
    protected ImageOperation operation() throws ConfigurationException {
        try {
            return new RecolorOperation(new ColorInfo(colorType, BitDepth.of(bitDepth)));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage());
        }
    }

    @Override
    protected String commandName() {
        return "recolor";
    }

    static class ColorTypeConverter implements ITypeConverter<ColorType> {
        @Override
        public ColorType convert(String value) {
            return switch (value.strip().toLowerCase(Locale.ROOT).replace('_', '-')) {
                case "rgb" -> ColorType.RGB;
                case "rgba" -> ColorType.RGBA;
                case "luma", "gray" -> ColorType.LUMA;
                case "luma-alpha", "lumaa" -> ColorType.LUMA_ALPHA;
                default -> throw new TypeConversionException(
                    "Invalid color type '" + value + "', expected rgb, rgba, luma or luma-alpha");
            };
        }
    }
}
