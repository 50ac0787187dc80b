package xyz.jphil.imagebatch.tools.image;

public class SaveException extends TaskException {

    public SaveException(String message) {
        super(FailureKind.SAVE, message);
    }

    public SaveException(String message, Throwable cause) {
        super(FailureKind.SAVE, message, cause);
    }
}
