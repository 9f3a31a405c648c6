package xyz.jphil.imgpdf.tools.compress;

import xyz.jphil.imgpdf.tools.EncodeException;

import java.awt.image.BufferedImage;

/**
 * Encodes an image to an in-memory buffer at fixed settings.
 */
@FunctionalInterface
public interface ImageEncoder {
    byte[] encode(BufferedImage image) throws EncodeException;
}
