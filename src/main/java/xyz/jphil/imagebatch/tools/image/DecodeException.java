package xyz.jphil.imagebatch.tools.image;

public class DecodeException extends TaskException {

    public DecodeException(String message) {
        super(FailureKind.DECODE, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(FailureKind.DECODE, message, cause);
    }
}
