package xyz.jphil.imgpdf.tools.crop;

import xyz.jphil.imgpdf.tools.InvalidGeometryException;

/**
 * Axis-aligned rectangle by its corners, x1 <= x2 and y1 <= y2, non-negative.
 * Used both in display space (the preview) and in source space (the original image).
 */
public record SelectionRect(int x1, int y1, int x2, int y2) {

    public SelectionRect {
        if (x1 < 0 || y1 < 0) {
            throw new InvalidGeometryException(String.format("Negative corner (%d,%d)", x1, y1));
        }
        if (x1 > x2 || y1 > y2) {
            throw new InvalidGeometryException(String.format("Inverted rectangle (%d,%d)-(%d,%d)", x1, y1, x2, y2));
        }
    }

    public static SelectionRect full(int width, int height) {
        return new SelectionRect(0, 0, width, height);
    }

    /**
     * Parses "x1,y1,x2,y2"
     */
    public static SelectionRect parse(String text) {
        var parts = text.trim().split("\\s*,\\s*");
        if (parts.length != 4) {
            throw new InvalidGeometryException("Expected x1,y1,x2,y2 but got: " + text);
        }
        try {
            return new SelectionRect(
                Integer.parseInt(parts[0]), Integer.parseInt(parts[1]),
                Integer.parseInt(parts[2]), Integer.parseInt(parts[3]));
        } catch (NumberFormatException e) {
            throw new InvalidGeometryException("Not a number in region: " + text);
        }
    }

    public int width() {
        return x2 - x1;
    }

    public int height() {
        return y2 - y1;
    }

    /** strictly inside, the border itself excluded */
    public boolean containsStrictly(int x, int y) {
        return x1 < x && x < x2 && y1 < y && y < y2;
    }

    public int midX() {
        return (x1 + x2) / 2;
    }

    public int midY() {
        return (y1 + y2) / 2;
    }

    @Override
    public String toString() {
        return String.format("(%d,%d)-(%d,%d)", x1, y1, x2, y2);
    }
}
