package xyz.jphil.imagebatch.tools;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.jline.terminal.Terminal;

import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-line progress bar of one pipeline stage, sized to the terminal width.
 * Counts finished and failed units separately; both advance the bar.
 */
@Getter
@Accessors(fluent = true)
public class ProgressTracker {
    private final String stage;
    private final int total;
    private final boolean verbose;
    private final Instant start = Instant.now();
    private final Terminal terminal;
    private final PrintStream out;

    private final AtomicInteger completed = new AtomicInteger(0);
    private final AtomicInteger failed = new AtomicInteger(0);
    private final AtomicReference<Instant> lastUpdate = new AtomicReference<>(Instant.now());
    private final AtomicLong lastDone = new AtomicLong(0);

    private volatile boolean paused = false;

    public record Stats(double pct, Duration elapsed, String eta, String rate) {}

    public ProgressTracker(String stage, int total, boolean verbose, Terminal terminal, PrintStream out) {
        this.stage = stage;
        this.total = total;
        this.verbose = verbose;
        this.terminal = terminal;
        this.out = out;
    }

    public ProgressTracker start() {
        if (verbose) out.printf("▶ %s (%d items)%n", stage, total);
        show();
        return this;
    }

    public ProgressTracker inc() {
        completed.incrementAndGet();
        show();
        return this;
    }

    public ProgressTracker fail() {
        failed.incrementAndGet();
        show();
        return this;
    }

    public int done() {
        return completed.get() + failed.get();
    }

    public ProgressTracker finish() {
        if (total == 0) return this;
        clearLine();
        var elapsed = Duration.between(start, Instant.now());
        if (failed.get() > 0) {
            out.printf("✓ %s finished (%d ok, %d failed) in %s%n", stage, completed.get(), failed.get(), fmt(elapsed));
        } else {
            out.printf("✓ %s finished (%d items) in %s%n", stage, completed.get(), fmt(elapsed));
        }
        return this;
    }

    public ProgressTracker pause() {
        this.paused = true;
        return this;
    }

    public ProgressTracker resume() {
        this.paused = false;
        show();
        return this;
    }

    public void clearLine() {
        if (total == 0) return;
        int termWidth = effectiveTerminalWidth();
        if (termWidth > 50) {
            out.printf("\r%s\r", " ".repeat(termWidth));
            out.flush();
        }
    }

    public void forceRedraw() {
        if (!paused) {
            show();
        }
    }

    private void show() {
        if (total == 0 || paused) return;

        var stats = calcStats();
        int current = done();
        var failures = failed.get() > 0 ? " ✗" + failed.get() : "";

        int termWidth = effectiveTerminalWidth();
        if (termWidth > 50) {
            if (verbose) {
                var bar = bar(stats.pct(), Math.min(25, termWidth - 55));
                out.printf("\r%s %5.1f%% (%d/%d)%s %s %s",
                    bar, stats.pct(), current, total, failures, stats.eta(), stats.rate());
            } else {
                var bar = bar(stats.pct(), Math.min(20, termWidth - 30));
                out.printf("\r%s %5.1f%% (%d/%d)%s", bar, stats.pct(), current, total, failures);
            }
            out.flush();
        } else if (current % Math.max(1, total / 10) == 0 || current == total) {
            out.printf("  %s: %d/%d (%.1f%%)%s%n", stage, current, total, stats.pct(), failures);
        }
    }

    private int effectiveTerminalWidth() {
        if (terminal == null) return 80;
        int width = terminal.getWidth();
        // dumb terminals report 0
        return width > 20 ? width : 80;
    }

    Stats calcStats() {
        int current = done();
        var pct = total == 0 ? 100.0 : (double) current / total * 100;
        var elapsed = Duration.between(start, Instant.now());
        return new Stats(pct, elapsed, eta(elapsed, current), rate(elapsed, current));
    }

    private String bar(double pct, int width) {
        var filled = (int) (pct / 100 * width);
        var sb = new StringBuilder("[");
        for (int i = 0; i < width; i++) {
            sb.append(i < filled ? "█" :
                     i == filled && pct % (100.0 / width) > 0 ? "▌" : "░");
        }
        return sb.append("]").toString();
    }

    private String eta(Duration elapsed, int current) {
        if (current == 0) return "ETA: --:--";
        var avgMillis = elapsed.toMillis() / current;
        return "ETA: " + fmt(Duration.ofMillis((total - current) * avgMillis));
    }

    private String rate(Duration elapsed, int current) {
        if (elapsed.getSeconds() == 0) return "Rate: --/s";

        var now = Instant.now();
        var sinceLast = Duration.between(lastUpdate.get(), now);
        double rate;
        if (sinceLast.getSeconds() >= 2) {
            rate = (current - lastDone.get()) / (double) sinceLast.getSeconds();
            lastUpdate.set(now);
            lastDone.set(current);
        } else {
            rate = current / (double) elapsed.getSeconds();
        }
        return rate >= 1 ? "Rate: %.1f/s".formatted(rate) : "Rate: %.1f/min".formatted(rate * 60);
    }

    static String fmt(Duration d) {
        var h = d.toHours();
        var m = d.toMinutesPart();
        var s = d.toSecondsPart();

        return h > 0 ? "%dh %02dm".formatted(h, m) :
               m > 0 ? "%dm %02ds".formatted(m, s) :
                       "%ds".formatted(s);
    }
}
