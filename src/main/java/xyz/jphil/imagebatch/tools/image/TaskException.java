package xyz.jphil.imagebatch.tools.image;

/**
 * Failure of a single image at one pipeline step. Recorded against the image,
 * never fatal to a batch.
 */
public abstract class TaskException extends Exception {

    private final FailureKind kind;

    protected TaskException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TaskException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
