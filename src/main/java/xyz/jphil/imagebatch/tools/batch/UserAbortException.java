package xyz.jphil.imagebatch.tools.batch;

import java.nio.file.Path;
import java.util.List;

/**
 * The user declined to overwrite existing output files.
 */
public class UserAbortException extends BatchException {

    private final List<Path> existing;

    public UserAbortException(List<Path> existing) {
        super(String.format("Aborted: %d output file(s) already exist and overwriting was declined", existing.size()));
        this.existing = List.copyOf(existing);
    }

    public List<Path> existing() {
        return existing;
    }
}
