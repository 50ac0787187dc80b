package xyz.jphil.imagebatch.tools.batch;

import lombok.RequiredArgsConstructor;
import xyz.jphil.imagebatch.tools.image.ImageCodec;
import xyz.jphil.imagebatch.tools.image.ImageFormat;
import xyz.jphil.imagebatch.tools.image.ImageOperation;
import xyz.jphil.imagebatch.tools.image.TaskException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Sequential path for a single input image. Unlike a batch, any failure ends
 * the run and is thrown to the caller.
 */
@RequiredArgsConstructor
public class SingleImageRunner {

    private final ImageCodec codec;
    private final ImageOperation operation;
    private final ProgressReporter reporter;
    private final OverwritePrompt prompt;

    /**
     * @param output       target file or existing directory, null to write next to (or over) the input
     * @param targetFormat extension of the output format, null to keep the input's
     * @return the file written
     */
    public Path run(Path source, Path output, String targetFormat, boolean overwrite)
            throws TaskException, BatchException {
        var format = parseFormat(targetFormat);
        reporter.stage("Processing " + source.getFileName(), 4);
        try {
            reporter.taskStarted("Decoding " + source);
            var image = codec.decode(source);
            reporter.taskFinished("Decoded " + source);

            var destination = outputPath(source, output, format);
            reporter.taskStarted("Checking " + destination);
            new OverwriteGuard(reporter, prompt).check(List.of(destination), overwrite);
            reporter.taskFinished("Output " + destination);

            reporter.taskStarted(operation.verb() + " " + source.getFileName());
            var result = operation.apply(image);
            reporter.taskFinished("Processed " + source.getFileName());

            reporter.taskStarted("Saving " + destination);
            codec.save(result, destination, format);
            reporter.taskFinished("Saved " + destination);

            reporter.finish("Saved " + destination);
            return destination;
        } catch (TaskException | BatchException e) {
            reporter.finish("Stopped: " + e.getMessage());
            throw e;
        }
    }

    /**
     * Output defaults to the input itself; an existing directory receives a
     * file of the input's name. A target format replaces the extension.
     */
    static Path outputPath(Path source, Path output, ImageFormat format) {
        Path target;
        if (output == null) {
            target = source;
        } else if (Files.isDirectory(output)) {
            target = output.resolve(source.getFileName());
        } else {
            target = output;
        }
        if (format == null || format.extensions().contains(ImageFormat.extensionOf(target).toLowerCase())) {
            return target;
        }
        var name = ImageFormat.stemOf(target) + "." + format.extension();
        var parent = target.getParent();
        return parent != null ? parent.resolve(name) : Path.of(name);
    }

    private static ImageFormat parseFormat(String targetFormat) throws ConfigurationException {
        if (targetFormat == null) {
            return null;
        }
        return ImageFormat.fromExtension(targetFormat).orElseThrow(() -> new ConfigurationException(
            "Unknown image format '" + targetFormat + "', expected one of: " + ImageFormat.supportedExtensions()));
    }
}
