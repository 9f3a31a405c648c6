package xyz.jphil.imgpdf.tools.compress;

import lombok.RequiredArgsConstructor;
import xyz.jphil.imgpdf.tools.EncodeException;
import xyz.jphil.imgpdf.tools.image.ImageOps;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Shrinks an image until its encoded size fits a byte budget, keeping encode quality fixed.
 * <p>
 * Encoded size versus scale has no closed form (it depends on content), so it is sampled with
 * real encodes. The first guess assumes size is proportional to pixel area, hence the square
 * root, with a 5% margin. After that the scale moves geometrically: +5% after a trial that fits,
 * -10% after one that does not. The search ends once a fitting trial reaches 90% of the budget,
 * when a dimension hits the 50px floor, or after {@value #MAX_TRIALS} trials.
 * <p>
 * When no trial fits, the result is the smallest trial encoded. If the trials ran out before
 * reaching the floor, the original resized to 10% of its dimensions is encoded as well and
 * the smaller of the two wins. Compression therefore always yields an image; only an encoder
 * failure throws.
 */
@RequiredArgsConstructor
public class TargetSizeCompressor {

    public static final int MAX_TRIALS = 10;
    public static final int MIN_DIMENSION = 50;

    static final double SAFETY_MARGIN = 0.95;
    static final double GROW_STEP = 1.05;
    static final double SHRINK_STEP = 0.9;
    static final double CLOSE_ENOUGH = 0.90;
    static final double FALLBACK_SCALE = 0.1;

    private final ImageEncoder encoder;

    public TargetSizeCompressor() {
        this(new JpegEncoder());
    }

    public CompressionResult compress(BufferedImage image, long targetBytes) throws EncodeException {
        return compress(image, targetBytes, trial -> {});
    }

    /**
     * @param onTrial called after every resize-and-encode attempt, for progress reporting
     */
    public CompressionResult compress(BufferedImage image, long targetBytes, Consumer<CompressionTrial> onTrial)
            throws EncodeException {
        if (targetBytes <= 0) {
            throw new IllegalArgumentException("Target size must be positive: " + targetBytes);
        }
        var working = ImageOps.toRgb(image);
        int width = working.getWidth();
        int height = working.getHeight();

        byte[] full = encoder.encode(working);
        if (full.length <= targetBytes) {
            return new CompressionResult(working, full, List.of(), true);
        }

        List<CompressionTrial> trials = new ArrayList<>();
        double scale = Math.sqrt((double) targetBytes / full.length) * SAFETY_MARGIN;
        BufferedImage bestImage = null;
        byte[] bestBytes = null;
        BufferedImage smallestImage = null;
        byte[] smallestBytes = null;
        boolean floorReached = false;

        for (int attempt = 1; attempt <= MAX_TRIALS; attempt++) {
            int w = dimension(width, scale);
            int h = dimension(height, scale);
            var resized = ImageOps.resize(working, w, h);
            byte[] encoded = encoder.encode(resized);

            var trial = new CompressionTrial(attempt, scale, w, h, encoded.length);
            trials.add(trial);
            onTrial.accept(trial);

            if (smallestBytes == null || encoded.length < smallestBytes.length) {
                smallestImage = resized;
                smallestBytes = encoded;
            }
            if (trial.fits(targetBytes)) {
                bestImage = resized;
                bestBytes = encoded;
                // probe for a larger image that still fits
                scale *= GROW_STEP;
            } else {
                scale *= SHRINK_STEP;
            }

            if (bestBytes != null && bestBytes.length >= targetBytes * CLOSE_ENOUGH) {
                break;
            }
            if (w <= MIN_DIMENSION || h <= MIN_DIMENSION) {
                floorReached = true;
                break;
            }
        }

        if (bestImage != null) {
            return new CompressionResult(bestImage, bestBytes, List.copyOf(trials), true);
        }
        if (!floorReached) {
            var fallback = ImageOps.resize(working, dimension(width, FALLBACK_SCALE), dimension(height, FALLBACK_SCALE));
            byte[] fallbackBytes = encoder.encode(fallback);
            if (fallbackBytes.length < smallestBytes.length) {
                smallestImage = fallback;
                smallestBytes = fallbackBytes;
            }
        }
        return new CompressionResult(smallestImage, smallestBytes, List.copyOf(trials), smallestBytes.length <= targetBytes);
    }

    /**
     * Scaled length, floored at {@value #MIN_DIMENSION}px and never above the original
     */
    static int dimension(int original, double scale) {
        return Math.min(original, Math.max(MIN_DIMENSION, (int) (original * scale)));
    }
}
