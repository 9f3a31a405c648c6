package xyz.jphil.imgpdf.tools;

import java.io.IOException;

/**
 * Target format has no writer, or the writer rejected the image
 */
public class EncodeException extends IOException {

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
