package xyz.jphil.imgpdf.tools;

/**
 * A rectangle, size or scale violates its bounds. Signals a caller bug, so it is unchecked.
 */
public class InvalidGeometryException extends IllegalArgumentException {

    public InvalidGeometryException(String message) {
        super(message);
    }
}
