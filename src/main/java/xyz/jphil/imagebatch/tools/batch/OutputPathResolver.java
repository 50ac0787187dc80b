package xyz.jphil.imagebatch.tools.batch;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import xyz.jphil.imagebatch.tools.image.ImageFormat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps input files onto output files inside one destination directory.
 *
 * <p>Extension: an explicit target format wins, then the extension of the
 * naming expression, then each file keeps its own. File stem: the naming
 * expression's stem plus {@code _<index>}, or the input file's stem.
 *
 * <p>Examples, destination {@code /out}:
 * <ul>
 *   <li>{@code a/cat.png}, no expression, no format: {@code /out/cat.png}</li>
 *   <li>{@code a/cat.png}, format {@code jpg}: {@code /out/cat.jpg}</li>
 *   <li>{@code a/cat.png}, {@code b/dog.bmp}, expression {@code pet.gif}: {@code /out/pet_0.gif}, {@code /out/pet_1.gif}</li>
 * </ul>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public class OutputPathResolver {

    private final Path destination;
    private final String nameExpression;
    private final String targetFormat;

    /**
     * Checks everything that does not depend on the input files. Run before any
     * file is touched.
     */
    public void validate() throws ConfigurationException {
        if (destination == null) {
            throw new ConfigurationException("No output directory given");
        }
        if (Files.isRegularFile(destination)) {
            throw new ConfigurationException("Chosen path is a file, please choose a directory: " + destination);
        }
        if (!Files.isDirectory(destination)) {
            throw new ConfigurationException("Directory " + destination + " does not exist.");
        }
        parsedTargetFormat();
        expressionFormat();
    }

    /**
     * @return one output path per input, in input order
     */
    public List<Path> resolve(List<Path> sources) throws ConfigurationException {
        validate();

        var explicit = parsedTargetFormat();
        var fromExpression = expressionFormat();
        var extension = explicit != null ? explicit.extension()
            : fromExpression != null ? ImageFormat.extensionOf(Path.of(nameExpression)) : null;

        var outputs = new ArrayList<Path>(sources.size());
        // keyed case-insensitively: Cat.png and cat.png are one file on NTFS and APFS
        Map<String, Path> claimed = new LinkedHashMap<>();

        for (int index = 0; index < sources.size(); index++) {
            var source = sources.get(index);
            var stem = nameExpression != null
                ? ImageFormat.stemOf(Path.of(nameExpression)) + "_" + index
                : ImageFormat.stemOf(source);

            var fileExtension = extension != null ? extension : ImageFormat.extensionOf(source);
            if (fileExtension.isEmpty()) {
                throw new ConfigurationException("File does not have an extension: " + source);
            }

            var output = destination.resolve(stem + "." + fileExtension);
            var previous = claimed.putIfAbsent(
                output.toAbsolutePath().normalize().toString().toLowerCase(Locale.ROOT), source);
            if (previous != null) {
                throw new ConfigurationException(String.format(
                    "Output path collision: %s and %s would both be written to %s", previous, source, output));
            }
            outputs.add(output);
        }
        return outputs;
    }

    private ImageFormat parsedTargetFormat() throws ConfigurationException {
        if (targetFormat == null) {
            return null;
        }
        return ImageFormat.fromExtension(targetFormat).orElseThrow(() -> new ConfigurationException(
            "Unknown image format '" + targetFormat + "', expected one of: " + ImageFormat.supportedExtensions()));
    }

    private ImageFormat expressionFormat() throws ConfigurationException {
        if (nameExpression == null) {
            return null;
        }
        if (nameExpression.isBlank()
            || nameExpression.contains("/")
            || nameExpression.contains("\\")
            || nameExpression.equals(".")
            || nameExpression.equals("..")) {
            throw new ConfigurationException("Invalid name expression '" + nameExpression
                + "': expected a plain file name such as photo or photo.png");
        }
        var extension = ImageFormat.extensionOf(Path.of(nameExpression));
        if (extension.isEmpty()) {
            return null;
        }
        return ImageFormat.fromExtension(extension).orElseThrow(() -> new ConfigurationException(
            "Name expression '" + nameExpression + "' has unknown image extension '" + extension + "'"));
    }
}
