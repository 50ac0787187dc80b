package xyz.jphil.imagebatch.tools.batch;

/**
 * Ends a whole run. Per-image problems are never raised this way, they are
 * recorded on the task instead.
 */
public abstract class BatchException extends Exception {

    protected BatchException(String message) {
        super(message);
    }

    protected BatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
