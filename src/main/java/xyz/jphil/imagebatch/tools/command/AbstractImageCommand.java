package xyz.jphil.imagebatch.tools.command;

import picocli.CommandLine.Mixin;
import picocli.CommandLine.ParentCommand;
import xyz.jphil.imagebatch.tools.BatchReportJson;
import xyz.jphil.imagebatch.tools.ConsoleOverwritePrompt;
import xyz.jphil.imagebatch.tools.ConsoleProgressReporter;
import xyz.jphil.imagebatch.tools.ExitCode;
import xyz.jphil.imagebatch.tools.ImageTool;
import xyz.jphil.imagebatch.tools.LogFormatter;
import xyz.jphil.imagebatch.tools.batch.BatchException;
import xyz.jphil.imagebatch.tools.batch.BatchOptions;
import xyz.jphil.imagebatch.tools.batch.BatchReport;
import xyz.jphil.imagebatch.tools.batch.BatchRunner;
import xyz.jphil.imagebatch.tools.batch.ConfigurationException;
import xyz.jphil.imagebatch.tools.batch.OverwritePrompt;
import xyz.jphil.imagebatch.tools.batch.ProgressReporter;
import xyz.jphil.imagebatch.tools.batch.SingleImageRunner;
import xyz.jphil.imagebatch.tools.image.ImageCodec;
import xyz.jphil.imagebatch.tools.image.ImageFormat;
import xyz.jphil.imagebatch.tools.image.ImageIoCodec;
import xyz.jphil.imagebatch.tools.image.ImageOperation;
import xyz.jphil.imagebatch.tools.image.TaskException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Base of the operation commands: one image runs sequentially, two or more
 * through the {@link BatchRunner}.
 */
public abstract class AbstractImageCommand implements Callable<Integer> {

    @ParentCommand
    protected ImageTool parentCommand;

    @Mixin
    protected BatchArgs args;

    /**
     * Builds the operation from the command's own options.
     */
    protected abstract ImageOperation operation() throws ConfigurationException;

    protected abstract String commandName();

    protected ImageCodec codec() {
        return new ImageIoCodec();
    }

    private int getThreads() {
        return parentCommand != null ? parentCommand.getThreads() : 1;
    }

    private boolean isVerbose() {
        return parentCommand != null && parentCommand.isVerbose();
    }

    @Override
    public Integer call() {
        var log = LogFormatter.standard(isVerbose());
        try (var terminal = ImageTool.openTerminal();
             var reporter = new ConsoleProgressReporter(terminal, System.err, isVerbose())) {
            var prompt = new ConsoleOverwritePrompt(terminal);
            var operation = operation();
            if (args.isBatch()) {
                return runBatch(operation, reporter, prompt, log);
            }
            new SingleImageRunner(codec(), operation, reporter, prompt)
                .run(args.images().get(0), args.output(), args.format(), args.overwrite());
            return ExitCode.OK;
        } catch (ConfigurationException e) {
            log.error("CONFIG", e.getMessage());
            return ExitCode.INVALID_INPUT;
        } catch (BatchException e) {
            log.error("BATCH", e.getMessage());
            return ExitCode.ERROR;
        } catch (TaskException e) {
            log.error(e.kind().label().toUpperCase(Locale.ROOT), e.getMessage());
            return ExitCode.ERROR;
        } catch (IOException e) {
            log.error("IO", e.getMessage());
            return ExitCode.ERROR;
        }
    }

    private int runBatch(ImageOperation operation, ProgressReporter reporter, OverwritePrompt prompt,
                         LogFormatter log) throws BatchException, IOException {
        var destination = args.output() != null ? args.output() : Path.of(".");
        var options = new BatchOptions(destination, args.nameExpression(), args.format(), args.overwrite(),
            args.abortOnError, args.abortOnProcessError, Math.max(1, getThreads()));
        log.info("BATCH", String.format("%d images, %d threads, output %s",
            args.images().size(), options.workerCount(), destination.toAbsolutePath()));

        BatchReport report = new BatchRunner(codec(), operation, reporter, prompt, options).run(args.images());

        if (args.report() != null) {
            BatchReportJson.write(report, commandName(), args.report());
            log.info("REPORT", "Written " + args.report());
        }
        return report.hasFailures() && options.abortsOnFailure() ? ExitCode.ERROR : ExitCode.OK;
    }

    /**
     * Parses {@code -f}; null when not given.
     */
    protected ImageFormat targetFormat() throws ConfigurationException {
        if (args.format() == null) {
            return null;
        }
        return ImageFormat.fromExtension(args.format()).orElseThrow(() -> new ConfigurationException(
            "Unknown image format '" + args.format() + "', expected one of: " + ImageFormat.supportedExtensions()));
    }
}
