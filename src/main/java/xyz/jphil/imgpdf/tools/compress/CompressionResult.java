package xyz.jphil.imgpdf.tools.compress;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Outcome of a target-size compression.
 *
 * @param image     final image (possibly downscaled)
 * @param encoded   its JPEG bytes, exactly what should be written to disk
 * @param trials    every resize-and-encode attempt, in order; empty when the original already fit
 * @param budgetMet false when no candidate fit; the image is then the smallest one encoded
 */
public record CompressionResult(
    BufferedImage image,
    byte[] encoded,
    List<CompressionTrial> trials,
    boolean budgetMet
) {

    public long size() {
        return encoded.length;
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
