package xyz.jphil.imagebatch.tools;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Category-tagged log lines for the console, e.g. {@code ❌ [DECODE] missing.png: File not found}.
 * Errors, notices and completion lines are always printed; everything else only
 * in verbose mode.
 */
public class LogFormatter {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final boolean verbose;
    private final boolean includeTimestamp;
    private final PrintStream out;

    public LogFormatter(boolean verbose, boolean includeTimestamp, PrintStream out) {
        this.verbose = verbose;
        this.includeTimestamp = includeTimestamp;
        this.out = out;
    }

    public boolean verbose() {
        return verbose;
    }

    protected PrintStream out() {
        return out;
    }

    public void info(String category, String message) {
        if (!verbose) return;
        print("", category, message);
    }

    /**
     * Shown regardless of verbose.
     */
    public void notice(String category, String message) {
        print("ℹ️ ", category, message);
    }

    public void error(String category, String message) {
        print("❌ ", category, message);
    }

    public void debug(String category, String message) {
        if (!verbose) return;
        print("🔍 ", category, message);
    }

    public void step(String category, String message) {
        if (!verbose) return;
        print("▶️ ", category, message);
    }

    public void complete(String category, String message) {
        print("🏁 ", category, message);
    }

    private void print(String marker, String category, String message) {
        out.printf("%s%s[%s] %s%n", timestamp(), marker, category, message);
    }

    private String timestamp() {
        if (!includeTimestamp) return "";
        return "[" + LocalDateTime.now().format(TIME_FORMAT) + "] ";
    }

    public static LogFormatter standard(boolean verbose) {
        return new LogFormatter(verbose, false, System.err);
    }
}
