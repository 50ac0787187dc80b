package xyz.jphil.imagebatch.tools.image;

public class OperationException extends TaskException {

    public OperationException(String message) {
        super(FailureKind.OPERATION, message);
    }

    public OperationException(String message, Throwable cause) {
        super(FailureKind.OPERATION, message, cause);
    }
}
