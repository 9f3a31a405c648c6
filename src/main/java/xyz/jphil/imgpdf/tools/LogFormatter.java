package xyz.jphil.imgpdf.tools;

import java.io.PrintStream;

/**
 * Category-tagged console logging shared by all subcommands.
 * Everything goes to stderr so stdout only carries the result summary.
 * Progress detail is verbose-only; errors and warnings always show.
 */
public class LogFormatter {

    private final boolean verbose;
    private final PrintStream out;

    public LogFormatter(boolean verbose, PrintStream out) {
        this.verbose = verbose;
        this.out = out;
    }

    public LogFormatter(boolean verbose) {
        this(verbose, System.err);
    }

    public boolean verbose() {
        return verbose;
    }

    public void info(String category, String message) {
        if (!verbose) return;
        print("", category, message);
    }

    public void success(String category, String message) {
        if (!verbose) return;
        print("✅ ", category, message);
    }

    /**
     * Always shown: a warning means the output differs from what was asked for
     */
    public void warning(String category, String message) {
        print("⚠️ ", category, message);
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

    /**
     * Stack trace of a failure, verbose only
     */
    public void trace(Throwable t) {
        if (!verbose) return;
        t.printStackTrace(out);
    }

    private void print(String marker, String category, String message) {
        emit(marker + "[" + category + "] " + message);
    }

    /** Single output point; subclasses coordinate with whatever else owns the console */
    protected void emit(String line) {
        out.println(line);
        out.flush();
    }

    public static LogFormatter standard(boolean verbose) {
        return new LogFormatter(verbose);
    }

    public static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + "B";
        if (bytes < 1024 * 1024) return String.format("%.2fKB", bytes / 1024.0);
        return String.format("%.2fMB", bytes / (1024.0 * 1024.0));
    }
}
