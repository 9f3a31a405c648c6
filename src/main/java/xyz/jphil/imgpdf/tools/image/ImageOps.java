package xyz.jphil.imgpdf.tools.image;

import xyz.jphil.imgpdf.tools.DecodeException;
import xyz.jphil.imgpdf.tools.EncodeException;
import xyz.jphil.imgpdf.tools.InvalidGeometryException;
import xyz.jphil.imgpdf.tools.OutputNaming;
import xyz.jphil.imgpdf.tools.crop.SelectionRect;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Decode, resample, crop, flatten and encode primitives over java.awt images.
 * Every operation returns a new image; inputs are never modified.
 */
public final class ImageOps {

    /** Output extension to ImageIO format name */
    private static final Map<String, String> FORMATS = Map.of(
        "jpg", "jpeg",
        "jpeg", "jpeg",
        "png", "png",
        "bmp", "bmp",
        "gif", "gif"
    );

    /** Formats whose writers cannot store an alpha channel */
    private static final Set<String> OPAQUE_FORMATS = Set.of("jpeg", "bmp");

    private ImageOps() {}

    public static BufferedImage read(Path file) throws DecodeException {
        if (!Files.isRegularFile(file)) {
            throw new DecodeException("Input file does not exist: " + file);
        }
        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException | RuntimeException e) {
            throw DecodeException.unreadable(file, e);
        }
        if (image == null) {
            throw new DecodeException("Unsupported or corrupt image file: " + file);
        }
        return image;
    }

    public static boolean hasAlpha(BufferedImage image) {
        return image.getColorModel().hasAlpha();
    }

    /**
     * Drops alpha and palette by drawing onto a white TYPE_INT_RGB canvas.
     * Images that are already plain RGB are returned as-is.
     */
    public static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        var rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    /**
     * High-quality resample to exactly width x height. Large reductions are done in
     * successive halving steps before the final bicubic pass, which keeps detail that a
     * single bicubic step would alias away.
     */
    public static BufferedImage resize(BufferedImage image, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidGeometryException(String.format("Target size must be positive: %dx%d", width, height));
        }
        int type = hasAlpha(image) ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage current = image;
        int w = image.getWidth();
        int h = image.getHeight();

        while (w / 2 >= width && h / 2 >= height) {
            w /= 2;
            h /= 2;
            current = draw(current, w, h, type);
        }
        if (current == image || w != width || h != height) {
            current = draw(current, width, height, type);
        }
        return current;
    }

    private static BufferedImage draw(BufferedImage source, int width, int height, int type) {
        var target = new BufferedImage(width, height, type);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ALPHA_INTERPOLATION, RenderingHints.VALUE_ALPHA_INTERPOLATION_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    /**
     * Copies the source-space region [x1,x2) x [y1,y2) into a new image.
     */
    public static BufferedImage crop(BufferedImage image, SelectionRect region) {
        if (region.x2() > image.getWidth() || region.y2() > image.getHeight()) {
            throw new InvalidGeometryException(String.format("Crop region %s exceeds image bounds %dx%d",
                region, image.getWidth(), image.getHeight()));
        }
        if (region.width() == 0 || region.height() == 0) {
            throw new InvalidGeometryException("Crop region is empty: " + region);
        }
        var view = image.getSubimage(region.x1(), region.y1(), region.width(), region.height());
        var copy = new BufferedImage(region.width(), region.height(),
            hasAlpha(image) ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(view, 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }

    /**
     * ImageIO format name for the output file's extension
     */
    public static String formatFor(Path output) throws EncodeException {
        var ext = OutputNaming.extension(output);
        var format = FORMATS.get(ext);
        if (format == null) {
            throw new EncodeException("Unsupported output format '" + ext + "' (use jpg, png, bmp or gif): " + output);
        }
        return format;
    }

    /**
     * Writes the image in the format implied by the file extension, flattening alpha first
     * for formats that cannot hold it.
     */
    public static void write(BufferedImage image, Path output) throws EncodeException {
        var format = formatFor(output);
        var toWrite = OPAQUE_FORMATS.contains(format) ? toRgb(image) : image;
        boolean written;
        try {
            written = ImageIO.write(toWrite, format, output.toFile());
        } catch (IOException e) {
            throw new EncodeException("Failed to write " + output + ": " + e.getMessage(), e);
        }
        if (!written) {
            throw new EncodeException("No " + format + " writer accepts this image: " + output);
        }
    }
}
