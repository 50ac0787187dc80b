package xyz.jphil.imagebatch.tools.batch;

import java.util.List;

/**
 * Aggregate error raised when an abort policy stops the run between stages.
 * The message carries one line per failed image.
 */
public class BatchFailedException extends BatchException {

    private final List<TaskFailure> failures;

    public BatchFailedException(String headline, List<TaskFailure> failures) {
        super(render(headline, failures));
        this.failures = List.copyOf(failures);
    }

    public List<TaskFailure> failures() {
        return failures;
    }

    private static String render(String headline, List<TaskFailure> failures) {
        var message = new StringBuilder(headline);
        for (var failure : failures) {
            message.append(System.lineSeparator()).append("  ").append(failure.describe());
        }
        return message.toString();
    }
}
