package xyz.jphil.imagebatch.tools.command;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import xyz.jphil.imagebatch.tools.image.ImageOperation;
import xyz.jphil.imagebatch.tools.image.ResizeFilter;
import xyz.jphil.imagebatch.tools.image.ResizeOperation;

@Command(
    name = "resize",
    description = "Resample images to WIDTH x HEIGHT pixels",
    mixinStandardHelpOptions = true
)
public class ResizeCommand extends AbstractImageCommand {

    @Parameters(index = "0", paramLabel = "WIDTH", description = "Target width in pixels")
    private int width;

    @Parameters(index = "1", paramLabel = "HEIGHT", description = "Target height in pixels")
    private int height;

    @Option(
        names = {"--filter"},
        description = "Resampling filter: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private ResizeFilter filter = ResizeFilter.NEAREST;

    @Option(names = {"-p", "--preserve-aspect"}, description = "Fit within WIDTH x HEIGHT keeping the aspect ratio")
    private boolean preserveAspect;

    @Override
    protected ImageOperation operation() {
        return new ResizeOperation(width, height, filter, preserveAspect);
    }

    @Override
    protected String commandName() {
        return "resize";
    }
}
