package xyz.jphil.imagebatch.tools.batch;

public class BatchInterruptedException extends BatchException {

    public BatchInterruptedException(String stage, InterruptedException cause) {
        super("Interrupted while " + stage, cause);
    }
}
