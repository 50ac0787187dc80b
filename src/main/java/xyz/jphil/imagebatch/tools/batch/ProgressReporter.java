package xyz.jphil.imagebatch.tools.batch;

import java.util.function.Supplier;

/**
 * Receives lifecycle events of a run. Workers call it concurrently; an
 * implementation serializes the calls itself.
 */
public interface ProgressReporter {

    /**
     * A new stage with {@code size} units of work starts.
     */
    void stage(String title, int size);

    void taskStarted(String message);

    void taskFinished(String message);

    void taskFailed(String message);

    /**
     * Stage-level status line that does not advance progress.
     */
    void message(String message);

    /**
     * Runs {@code action} with live rendering paused, for interactive input.
     */
    <T> T suspendFor(Supplier<T> action);

    void finish(String summary);

    ProgressReporter NOOP = new ProgressReporter() {
        @Override
        public void stage(String title, int size) {
        }

        @Override
        public void taskStarted(String message) {
        }

        @Override
        public void taskFinished(String message) {
        }

        @Override
        public void taskFailed(String message) {
        }

        @Override
        public void message(String message) {
        }

        @Override
        public <T> T suspendFor(Supplier<T> action) {
            return action.get();
        }

        @Override
        public void finish(String summary) {
        }
    };
}
