package xyz.jphil.imagebatch.tools.command;

import picocli.CommandLine.Command;
import xyz.jphil.imagebatch.tools.batch.ConfigurationException;
import xyz.jphil.imagebatch.tools.image.ConvertOperation;
import xyz.jphil.imagebatch.tools.image.ImageOperation;

@Command(
    name = "convert",
    description = "Re-encode images into the format given with -f",
    mixinStandardHelpOptions = true
)
public class ConvertCommand extends AbstractImageCommand {

    @Override
    protected ImageOperation operation() throws ConfigurationException {
        return new ConvertOperation(targetFormat());
    }

    @Override
    protected String commandName() {
        return "convert";
    }
}
