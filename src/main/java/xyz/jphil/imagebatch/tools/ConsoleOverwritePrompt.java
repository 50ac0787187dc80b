package xyz.jphil.imagebatch.tools;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import xyz.jphil.imagebatch.tools.batch.OverwritePrompt;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Asks once on the terminal whether existing output files may be replaced.
 * Anything but an explicit yes, including end of input and Ctrl-C, is a no.
 */
public class ConsoleOverwritePrompt implements OverwritePrompt {

    private static final int MAX_LISTED = 10;

    private final Terminal terminal;
    private final LineReader reader;

    public ConsoleOverwritePrompt(Terminal terminal) {
        this.terminal = terminal;
        this.reader = LineReaderBuilder.builder().terminal(terminal).build();
    }

    @Override
    public boolean confirmOverwrite(List<Path> existing) {
        var writer = terminal.writer();
        writer.printf("%d output file(s) already exist:%n", existing.size());
        existing.stream().limit(MAX_LISTED).forEach(path -> writer.println("  " + path));
        if (existing.size() > MAX_LISTED) {
            writer.printf("  ... and %d more%n", existing.size() - MAX_LISTED);
        }
        writer.flush();

        String answer;
        try {
            answer = reader.readLine("Overwrite? [y/N] ");
        } catch (EndOfFileException | UserInterruptException e) {
            return false;
        }
        return isYes(answer);
    }

    static boolean isYes(String answer) {
        if (answer == null) {
            return false;
        }
        var normalized = answer.strip().toLowerCase(Locale.ROOT);
        return normalized.equals("y") || normalized.equals("yes");
    }
}
