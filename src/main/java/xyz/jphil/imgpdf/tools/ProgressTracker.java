package xyz.jphil.imgpdf.tools;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;

/**
 * Single-line progress bar on stderr for short bounded loops: compression trials, images added to a PDF.
 * Each step may carry a detail (the last trial's size, the image just added) shown after the bar.
 * Terminal width comes from JLine; narrow or dumb terminals get plain text lines instead.
 */
@Getter
@Accessors(fluent = true)
public class ProgressTracker implements AutoCloseable {
    private static final int MIN_BAR_WIDTH = 50;

    private final String task;
    private final int total;
    private final boolean verbose;
    private final Instant start = Instant.now();
    private final Terminal terminal;
    private final PrintStream out;

    private int completed;
    private String detail = "";
    private boolean finished;

    public ProgressTracker(String task, int total, boolean verbose) {
        this.task = task;
        this.total = total;
        this.verbose = verbose;
        this.out = System.err;
        try {
            this.terminal = TerminalBuilder.builder().system(true).dumb(true).build();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize terminal", e);
        }
    }

    public ProgressTracker start() {
        if (verbose) out.printf("▶ %s (up to %d)%n", task, total);
        show();
        return this;
    }

    /** Absolute position, for callbacks that report a 1-based index */
    public ProgressTracker update(int n) {
        completed = Math.max(0, Math.min(n, total));
        show();
        return this;
    }

    public ProgressTracker inc() {
        return inc("");
    }

    public ProgressTracker inc(String stepDetail) {
        if (completed < total) completed++;
        detail = stepDetail;
        show();
        return this;
    }

    /**
     * Closes the bar at the real count; loops that stop early report e.g. 3/10. Idempotent.
     */
    public ProgressTracker done() {
        if (finished) return this;
        finished = true;
        clearLine();
        out.printf("✓ %s: %d/%d in %s%n", task, completed, total, fmt(Duration.between(start, Instant.now())));
        return this;
    }

    public ProgressTracker err(String msg) {
        clearLine();
        out.printf("✗ %s failed at %d/%d: %s%n", task, completed, total, msg);
        return this;
    }

    public void clearLine() {
        if (total == 0) return;
        int width = terminalWidth();
        if (width > MIN_BAR_WIDTH) {
            out.printf("\r%s\r", " ".repeat(width));
            out.flush();
        }
    }

    /** Repaint after something else wrote to the console */
    public void redraw() {
        show();
    }

    @Override
    public void close() {
        try {
            terminal.close();
        } catch (IOException e) {
            out.println("Warning: failed to close terminal: " + e.getMessage());
        }
    }

    double percent() {
        return total == 0 ? 100.0 : completed * 100.0 / total;
    }

    private void show() {
        if (total == 0 || finished) return;
        int width = terminalWidth();
        if (width > MIN_BAR_WIDTH) {
            var line = String.format("%s %5.1f%% (%d/%d)", bar(percent(), 20), percent(), completed, total);
            if (verbose && !detail.isEmpty()) {
                line += " " + detail;
            }
            // never wrap, a wrapped line cannot be cleared with \r
            if (line.length() >= width) line = line.substring(0, width - 1);
            out.print("\r" + line);
            out.flush();
        } else if (verbose) {
            out.printf("  %s %d/%d %s%n", task, completed, total, detail);
        }
    }

    private int terminalWidth() {
        try {
            int width = terminal.getWidth();
            // dumb terminals report 0
            return width > 20 ? width : 80;
        } catch (RuntimeException e) {
            return 80;
        }
    }

    static String bar(double pct, int width) {
        int filled = (int) (pct / 100 * width);
        return "[" + "█".repeat(filled) + "░".repeat(width - filled) + "]";
    }

    static String fmt(Duration d) {
        long m = d.toMinutes();
        int s = d.toSecondsPart();
        return m > 0 ? "%dm %02ds".formatted(m, s) : "%d.%01ds".formatted(s, d.toMillisPart() / 100);
    }
}
