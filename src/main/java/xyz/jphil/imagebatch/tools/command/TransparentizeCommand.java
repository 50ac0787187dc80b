package xyz.jphil.imagebatch.tools.command;

import picocli.CommandLine.Command;
import xyz.jphil.imagebatch.tools.image.ImageOperation;
import xyz.jphil.imagebatch.tools.image.TransparentizeOperation;

@Command(
    name = "transparentize",
    description = "Make pure white pixels fully transparent",
    mixinStandardHelpOptions = true
)
public class TransparentizeCommand extends AbstractImageCommand {

    @Override
    protected ImageOperation operation() {
        return new TransparentizeOperation();
    }

    @Override
    protected String commandName() {
        return "transparentize";
    }
}
