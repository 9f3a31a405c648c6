package xyz.jphil.imgpdf.tools;

/**
 * Log lines written while a progress bar is on screen: clear the bar, print, repaint it.
 */
public class ProgressAwareLogFormatter extends LogFormatter {

    private final ProgressTracker progress;

    public ProgressAwareLogFormatter(boolean verbose, ProgressTracker progress) {
        super(verbose);
        this.progress = progress;
    }

    @Override
    protected synchronized void emit(String line) {
        if (progress == null) {
            super.emit(line);
            return;
        }
        progress.clearLine();
        super.emit(line);
        progress.redraw();
    }

    public static ProgressAwareLogFormatter create(boolean verbose, ProgressTracker progress) {
        return new ProgressAwareLogFormatter(verbose, progress);
    }
}
