package xyz.jphil.imagebatch.tools.command;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import xyz.jphil.imagebatch.tools.ExitCode;
import xyz.jphil.imagebatch.tools.ImageTool;
import xyz.jphil.imagebatch.tools.LogFormatter;
import xyz.jphil.imagebatch.tools.image.DecodeException;
import xyz.jphil.imagebatch.tools.image.ImageInfo;
import xyz.jphil.imagebatch.tools.image.ImageIoCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "info",
    description = "Print dimensions, format and color information of an image",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @ParentCommand
    private ImageTool parentCommand;

    @Parameters(index = "0", paramLabel = "IMAGE", description = "Image file")
    private Path image;

    @Option(names = {"-s", "--short"}, description = "One line summary")
    private boolean brief;

    @Override
    public Integer call() {
        var log = LogFormatter.standard(parentCommand != null && parentCommand.isVerbose());
        try {
            var decoded = new ImageIoCodec().decode(image);
            ImageInfo.of(image, decoded).lines(brief).forEach(System.out::println);
            return ExitCode.OK;
        } catch (DecodeException e) {
            log.error("DECODE", e.getMessage());
            return ExitCode.ERROR;
        } catch (IOException e) {
            log.error("IO", e.getMessage());
            return ExitCode.ERROR;
        }
    }
}
