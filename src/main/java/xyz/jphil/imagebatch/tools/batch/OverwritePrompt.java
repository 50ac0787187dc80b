package xyz.jphil.imagebatch.tools.batch;

import java.nio.file.Path;
import java.util.List;

/**
 * Asks once whether existing output files may be replaced.
 */
@FunctionalInterface
public interface OverwritePrompt {

    boolean confirmOverwrite(List<Path> existing);

    OverwritePrompt DECLINE = existing -> false;
}
