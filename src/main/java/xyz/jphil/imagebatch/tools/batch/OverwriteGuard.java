package xyz.jphil.imagebatch.tools.batch;

import lombok.RequiredArgsConstructor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * One confirmation for the whole run before existing files are replaced.
 * Only called once all output paths are known, with the progress display
 * suspended while the user answers.
 */
@RequiredArgsConstructor
public class OverwriteGuard {

    private final ProgressReporter reporter;
    private final OverwritePrompt prompt;

    public static List<Path> existing(List<Path> outputs) {
        return outputs.stream().filter(Files::exists).toList();
    }

    /**
     * @return the outputs that already existed
     * @throws UserAbortException if the user declined
     */
    public List<Path> check(List<Path> outputs, boolean overwrite) throws UserAbortException {
        var existing = existing(outputs);
        if (existing.isEmpty() || overwrite) {
            return existing;
        }
        boolean confirmed = reporter.suspendFor(() -> prompt.confirmOverwrite(existing));
        if (!confirmed) {
            throw new UserAbortException(existing);
        }
        return existing;
    }
}
