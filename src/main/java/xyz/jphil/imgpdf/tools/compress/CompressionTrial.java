package xyz.jphil.imgpdf.tools.compress;

/**
 * One trial encode: scale tried, resulting dimensions and encoded size.
 */
public record CompressionTrial(int attempt, double scale, int width, int height, long bytes) {

    public boolean fits(long targetBytes) {
        return bytes <= targetBytes;
    }

    @Override
    public String toString() {
        return String.format("#%d scale=%.4f %dx%d %d bytes", attempt, scale, width, height, bytes);
    }
}
