package xyz.jphil.imagebatch.tools;

import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import picocli.AutoComplete;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;
import xyz.jphil.imagebatch.tools.command.ConvertCommand;
import xyz.jphil.imagebatch.tools.command.InfoCommand;
import xyz.jphil.imagebatch.tools.command.RecolorCommand;
import xyz.jphil.imagebatch.tools.command.ResizeCommand;
import xyz.jphil.imagebatch.tools.command.TransparentizeCommand;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Command-line image tool: convert, resize, recolor or transparentize one
 * image, or a whole batch of them in parallel.
 */
@Command(
    name = "imagebatch",
    mixinStandardHelpOptions = true,
    version = "1.0",
    description = "Apply an image operation to one or many image files",
    subcommands = {
        ConvertCommand.class,
        ResizeCommand.class,
        RecolorCommand.class,
        TransparentizeCommand.class,
        InfoCommand.class,
    }
)
public class ImageTool implements Callable<Integer> {

    @Option(
        names = {"--threads"},
        description = "Worker threads for batch runs (default: available processors)"
    )
    private int threads = Runtime.getRuntime().availableProcessors();

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public int getThreads() {
        return threads;
    }

    public boolean isVerbose() {
        return verbose;
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return ExitCode.OK;
    }

    /**
     * Terminal used for the progress bar width and the overwrite prompt.
     * Falls back to a dumb terminal when stdin/stderr are not a console.
     */
    public static Terminal openTerminal() throws IOException {
        return TerminalBuilder.builder().system(true).dumb(true).build();
    }

    public static CommandLine commandLine() {
        var cli = new CommandLine(new ImageTool());
        // picocli generates a bash script, which zsh also loads through bashcompinit
        cli.addSubcommand("completions", new AutoComplete.GenerateCompletion());
        cli.getSubcommands().get("completions").getCommandSpec().usageMessage()
            .hidden(false)
            .description("Print a bash/zsh completion script for imagebatch");
        cli.setCaseInsensitiveEnumValuesAllowed(true);
        cli.setExecutionExceptionHandler(new ShortErrorHandler());
        return cli;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    static class ShortErrorHandler implements IExecutionExceptionHandler {
        @Override
        public int handleExecutionException(Exception ex, CommandLine cmd, ParseResult parseResult) {
            cmd.getErr().println(cmd.getColorScheme().errorText("ERROR: " + ex.getMessage()));
            return ExitCode.ERROR;
        }
    }
}
