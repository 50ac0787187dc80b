package xyz.jphil.imagebatch.tools;

import java.io.PrintStream;

/**
 * Log formatter that keeps a live progress bar intact: clear the bar, print,
 * redraw. Verbose output is timestamped. Not thread-safe; the progress
 * renderer thread is its only caller.
 */
public class ProgressAwareLogFormatter extends LogFormatter {

    private final ProgressTracker progressTracker;

    public ProgressAwareLogFormatter(boolean verbose, boolean includeTimestamp, PrintStream out,
                                     ProgressTracker progressTracker) {
        super(verbose, includeTimestamp, out);
        this.progressTracker = progressTracker;
    }

    @Override
    public void info(String category, String message) {
        logWithCoordination(() -> super.info(category, message));
    }

    @Override
    public void notice(String category, String message) {
        logWithCoordination(() -> super.notice(category, message));
    }

    @Override
    public void error(String category, String message) {
        logWithCoordination(() -> super.error(category, message));
    }

    @Override
    public void debug(String category, String message) {
        if (!verbose()) return;
        logWithCoordination(() -> super.debug(category, message));
    }

    @Override
    public void step(String category, String message) {
        if (!verbose()) return;
        logWithCoordination(() -> super.step(category, message));
    }

    @Override
    public void complete(String category, String message) {
        logWithCoordination(() -> super.complete(category, message));
    }

    private void logWithCoordination(Runnable logAction) {
        if (progressTracker == null) {
            logAction.run();
            return;
        }
        progressTracker.clearLine();
        logAction.run();
        out().flush();
        progressTracker.forceRedraw();
    }

    public static ProgressAwareLogFormatter create(boolean verbose, PrintStream out, ProgressTracker progressTracker) {
        return new ProgressAwareLogFormatter(verbose, verbose, out, progressTracker);
    }
}
