package xyz.jphil.imagebatch.tools;

import org.jline.terminal.Terminal;
import xyz.jphil.imagebatch.tools.batch.ProgressReporter;

import java.io.PrintStream;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Console {@link ProgressReporter}. A single renderer thread owns the progress
 * bar and the log formatter; callers on any thread only queue events to it,
 * so console output never interleaves.
 */
public class ConsoleProgressReporter implements ProgressReporter, AutoCloseable {

    private final ExecutorService renderer = Executors.newSingleThreadExecutor(runnable -> {
        var thread = new Thread(runnable, "progress-renderer");
        thread.setDaemon(true);
        return thread;
    });

    private final Terminal terminal;
    private final PrintStream out;
    private final boolean verbose;

    // renderer thread only
    private ProgressTracker tracker;
    private LogFormatter log;

    public ConsoleProgressReporter(Terminal terminal, PrintStream out, boolean verbose) {
        this.terminal = terminal;
        this.out = out;
        this.verbose = verbose;
        this.log = ProgressAwareLogFormatter.create(verbose, out, null);
    }

    @Override
    public void stage(String title, int size) {
        submit(() -> {
            if (tracker != null) {
                tracker.finish();
            }
            tracker = new ProgressTracker(title, size, verbose, terminal, out);
            log = ProgressAwareLogFormatter.create(verbose, out, tracker);
            tracker.start();
        });
    }

    @Override
    public void taskStarted(String message) {
        submit(() -> log.step("START", message));
    }

    @Override
    public void taskFinished(String message) {
        submit(() -> {
            if (tracker != null) {
                tracker.inc();
            }
            log.debug("DONE", message);
        });
    }

    @Override
    public void taskFailed(String message) {
        submit(() -> {
            if (tracker != null) {
                tracker.fail();
            }
            log.error("FAILED", message);
        });
    }

    @Override
    public void message(String message) {
        submit(() -> log.notice("BATCH", message));
    }

    /**
     * Runs {@code action} on the renderer thread with the bar paused and
     * cleared, so a prompt owns the console until it returns.
     */
    @Override
    public <T> T suspendFor(Supplier<T> action) {
        if (renderer.isShutdown()) {
            return action.get();
        }
        var result = renderer.submit(() -> {
            if (tracker != null) {
                tracker.pause();
                tracker.clearLine();
            }
            try {
                return action.get();
            } finally {
                if (tracker != null) {
                    tracker.resume();
                }
            }
        });
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for console input", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    @Override
    public void finish(String summary) {
        submit(() -> {
            if (tracker != null) {
                tracker.finish();
                tracker = null;
            }
            log = ProgressAwareLogFormatter.create(verbose, out, null);
            log.complete("SUMMARY", summary);
        });
        close();
    }

    /**
     * Drains queued events and stops the renderer thread.
     */
    @Override
    public void close() {
        if (renderer.isShutdown()) {
            return;
        }
        renderer.shutdown();
        try {
            if (!renderer.awaitTermination(10, TimeUnit.SECONDS)) {
                renderer.shutdownNow();
            }
        } catch (InterruptedException e) {
            renderer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        out.flush();
    }

    private void submit(Runnable event) {
        if (!renderer.isShutdown()) {
            renderer.execute(event);
        }
    }
}
