package xyz.jphil.imgpdf.tools.compress;

import xyz.jphil.imgpdf.tools.EncodeException;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.plugins.jpeg.JPEGImageWriteParam;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * JPEG at an explicit quality with optimized Huffman tables, through the ImageIO writer.
 * Input must already be RGB; JPEG cannot carry alpha.
 */
public class JpegEncoder implements ImageEncoder {

    public static final float DEFAULT_QUALITY = 0.85f;

    private final float quality;

    public JpegEncoder() {
        this(DEFAULT_QUALITY);
    }

    public JpegEncoder(float quality) {
        if (quality <= 0f || quality > 1f) {
            throw new IllegalArgumentException("JPEG quality must be in (0, 1]: " + quality);
        }
        this.quality = quality;
    }

    public float quality() {
        return quality;
    }

    @Override
    public byte[] encode(BufferedImage image) throws EncodeException {
        if (image.getColorModel().hasAlpha()) {
            throw new EncodeException("JPEG cannot encode an image with alpha; convert to RGB first");
        }
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new EncodeException("No JPEG ImageWriter available");
        }
        ImageWriter writer = writers.next();
        var buffer = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(buffer)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            if (param instanceof JPEGImageWriteParam jpegParam) {
                jpegParam.setOptimizeHuffmanTables(true);
            }
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException | RuntimeException e) {
            throw new EncodeException("JPEG encoding failed: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
        return buffer.toByteArray();
    }
}
