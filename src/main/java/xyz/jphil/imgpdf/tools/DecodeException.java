package xyz.jphil.imgpdf.tools;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Source file could not be read as an image or PDF (missing, unreadable, corrupt, unsupported format)
 */
public class DecodeException extends IOException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DecodeException unreadable(Path file, Throwable cause) {
        return new DecodeException("Unable to read file: " + file + (cause != null ? " (" + cause.getMessage() + ")" : ""), cause);
    }
}
