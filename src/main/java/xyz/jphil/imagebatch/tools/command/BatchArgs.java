package xyz.jphil.imagebatch.tools.command;

import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * Input and output options shared by every image operation command.
 */
public class BatchArgs {

    @Option(
        names = {"-i", "--images"},
        arity = "1..*",
        required = true,
        paramLabel = "IMAGE",
        description = "Input image file(s); two or more run as a parallel batch"
    )
    List<Path> images;

    @Option(
        names = {"-o", "--output"},
        description = "Output file or directory for a single image (default: the input file), "
            + "output directory for a batch (default: current directory)"
    )
    Path output;

    @Option(
        names = {"-n", "--name-expr"},
        description = "Batch output name, e.g. photo.png gives photo_0.png, photo_1.png, ..."
    )
    String nameExpression;

    @Option(
        names = {"-f", "--format"},
        description = "Output format by extension: png, jpg, jpeg, bmp, gif, tif, tiff"
    )
    String format;

    @Option(names = {"-x", "--overwrite"}, description = "Replace existing output files without asking")
    boolean overwrite;

    @Option(names = {"-a", "--abort-on-error"}, description = "Stop a batch before processing if any image fails to decode")
    boolean abortOnError;

    @Option(names = {"--abort-on-process-error"}, description = "Stop a batch before saving if the operation fails for any image")
    boolean abortOnProcessError;

    @Option(names = {"--report"}, paramLabel = "FILE", description = "Write a JSON report of a batch run")
    Path report;

    public List<Path> images() {
        return images;
    }

    public Path output() {
        return output;
    }

    public String nameExpression() {
        return nameExpression;
    }

    public String format() {
        return format;
    }

    public boolean overwrite() {
        return overwrite;
    }

    public Path report() {
        return report;
    }

    public boolean isBatch() {
        return images.size() > 1;
    }
}
