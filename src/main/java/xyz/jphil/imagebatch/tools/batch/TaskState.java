package xyz.jphil.imagebatch.tools.batch;

/**
 * Lifecycle of one image. Declaration order is pipeline order; the
 * {@code *ING} states mark a task a worker has claimed but not finished.
 */
public enum TaskState {
    PENDING,
    DECODING,
    DECODED,
    PROCESSING,
    PROCESSED,
    SAVING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    public boolean isInFlight() {
        return this == DECODING || this == PROCESSING || this == SAVING;
    }

    boolean precedes(TaskState next) {
        return next != FAILED && ordinal() < next.ordinal();
    }
}
