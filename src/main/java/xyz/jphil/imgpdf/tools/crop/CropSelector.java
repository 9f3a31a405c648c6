package xyz.jphil.imgpdf.tools.crop;

import lombok.Getter;
import lombok.experimental.Accessors;
import xyz.jphil.imgpdf.tools.InvalidGeometryException;

/**
 * Crop selection over a scaled-down preview of an image.
 * <p>
 * Holds the selection in display coordinates, resolves pointer positions to handles,
 * applies drags against a snapshot taken at pointer-down, and converts the final
 * selection back to source pixels. No widget state is involved, so every pointer
 * sequence can be replayed without a display.
 * <p>
 * Invariant after any mutation: {@code 0 <= x1 <= x2 <= displayWidth},
 * {@code 0 <= y1 <= y2 <= displayHeight}, and each span is at least the minimum
 * selection size (or the whole display when the display is smaller than that).
 */
@Getter
@Accessors(fluent = true)
public class CropSelector {

    /** Hit tolerance around corner and edge-midpoint handles */
    public static final int HANDLE_SIZE = 10;
    /** Hit tolerance along the full length of an edge */
    public static final int EDGE_TOLERANCE = 8;
    public static final int MIN_SELECTION = 20;
    public static final int MAX_PREVIEW_WIDTH = 800;
    public static final int MAX_PREVIEW_HEIGHT = 600;

    // absorbs binary fraction error such as 400 / 0.2 = 1999.9999999999998
    private static final double ROUNDING_SLACK = 1e-6;

    private final int sourceWidth;
    private final int sourceHeight;
    private final double scale;
    private final int displayWidth;
    private final int displayHeight;
    private final int minWidth;
    private final int minHeight;

    private SelectionRect selection;
    private DragSession drag;

    public CropSelector(int sourceWidth, int sourceHeight) {
        this(sourceWidth, sourceHeight, MAX_PREVIEW_WIDTH, MAX_PREVIEW_HEIGHT);
    }

    public CropSelector(int sourceWidth, int sourceHeight, int maxDisplayWidth, int maxDisplayHeight) {
        if (sourceWidth <= 0 || sourceHeight <= 0) {
            throw new InvalidGeometryException(String.format("Source size must be positive: %dx%d", sourceWidth, sourceHeight));
        }
        if (maxDisplayWidth <= 0 || maxDisplayHeight <= 0) {
            throw new InvalidGeometryException(String.format("Preview bounds must be positive: %dx%d", maxDisplayWidth, maxDisplayHeight));
        }
        this.sourceWidth = sourceWidth;
        this.sourceHeight = sourceHeight;
        // never upscale
        this.scale = Math.min(Math.min((double) maxDisplayWidth / sourceWidth, (double) maxDisplayHeight / sourceHeight), 1.0);
        this.displayWidth = Math.max(1, truncate(sourceWidth * scale));
        this.displayHeight = Math.max(1, truncate(sourceHeight * scale));
        this.minWidth = Math.min(MIN_SELECTION, displayWidth);
        this.minHeight = Math.min(MIN_SELECTION, displayHeight);
        this.selection = SelectionRect.full(displayWidth, displayHeight);
    }

    /**
     * Handle under the pointer, or null. Priority: corners, edge midpoints, anywhere along
     * an edge, then strictly inside (move). Handles win over "inside" so edges stay
     * resizable even though they lie within the selection's area.
     */
    public CropHandle hitTest(int x, int y) {
        var r = selection;
        int hs = HANDLE_SIZE;

        if (near(x, r.x1(), hs) && near(y, r.y1(), hs)) return CropHandle.NW;
        if (near(x, r.x2(), hs) && near(y, r.y1(), hs)) return CropHandle.NE;
        if (near(x, r.x1(), hs) && near(y, r.y2(), hs)) return CropHandle.SW;
        if (near(x, r.x2(), hs) && near(y, r.y2(), hs)) return CropHandle.SE;

        if (near(x, r.midX(), hs) && near(y, r.y1(), hs)) return CropHandle.N;
        if (near(x, r.midX(), hs) && near(y, r.y2(), hs)) return CropHandle.S;
        if (near(x, r.x1(), hs) && near(y, r.midY(), hs)) return CropHandle.W;
        if (near(x, r.x2(), hs) && near(y, r.midY(), hs)) return CropHandle.E;

        int tol = EDGE_TOLERANCE;
        if (r.x1() - tol <= x && x <= r.x2() + tol) {
            if (near(y, r.y1(), tol)) return CropHandle.N;
            if (near(y, r.y2(), tol)) return CropHandle.S;
        }
        if (r.y1() - tol <= y && y <= r.y2() + tol) {
            if (near(x, r.x1(), tol)) return CropHandle.W;
            if (near(x, r.x2(), tol)) return CropHandle.E;
        }

        if (r.containsStrictly(x, y)) return CropHandle.MOVE;
        return null;
    }

    /**
     * Starts a drag on the given handle. A null handle (failed hit-test) is ignored.
     */
    public void beginDrag(CropHandle handle, int x, int y) {
        if (handle == null) return;
        drag = new DragSession(handle, x, y, selection);
    }

    /**
     * Applies the pointer offset since {@link #beginDrag} to the snapshot. Ignored without an
     * active drag. Out-of-range pointers are clamped, never rejected.
     */
    public void updateDrag(int x, int y) {
        if (drag == null) return;
        int dx = x - drag.startX();
        int dy = y - drag.startY();
        var o = drag.origin();
        var handle = drag.handle();

        int x1 = o.x1(), y1 = o.y1(), x2 = o.x2(), y2 = o.y2();

        if (handle == CropHandle.MOVE) {
            int w = o.width();
            int h = o.height();
            x1 = clamp(o.x1() + dx, 0, displayWidth - w);
            y1 = clamp(o.y1() + dy, 0, displayHeight - h);
            x2 = x1 + w;
            y2 = y1 + h;
        } else {
            if (handle.movesWest()) x1 = clamp(o.x1() + dx, 0, x2 - minWidth);
            if (handle.movesEast()) x2 = clamp(o.x2() + dx, x1 + minWidth, displayWidth);
            if (handle.movesNorth()) y1 = clamp(o.y1() + dy, 0, y2 - minHeight);
            if (handle.movesSouth()) y2 = clamp(o.y2() + dy, y1 + minHeight, displayHeight);
        }
        selection = new SelectionRect(x1, y1, x2, y2);
    }

    /** Idempotent */
    public void endDrag() {
        drag = null;
    }

    public boolean dragging() {
        return drag != null;
    }

    /** Selection back to the full preview, whatever happened before */
    public void reset() {
        selection = SelectionRect.full(displayWidth, displayHeight);
    }

    /**
     * Current selection in source pixels: divide by scale, truncate, clamp to the source.
     * An edge on the preview boundary maps to the source boundary. The result is never empty.
     */
    public SelectionRect finalizeSelection() {
        var r = selection;
        int x1 = toSource(r.x1(), displayWidth, sourceWidth);
        int y1 = toSource(r.y1(), displayHeight, sourceHeight);
        int x2 = toSource(r.x2(), displayWidth, sourceWidth);
        int y2 = toSource(r.y2(), displayHeight, sourceHeight);
        if (x1 >= x2 || y1 >= y2) {
            throw new InvalidGeometryException(String.format(
                "Selection %s maps to inverted or empty source rectangle (%d,%d)-(%d,%d) at scale %f", r, x1, y1, x2, y2, scale));
        }
        return new SelectionRect(x1, y1, x2, y2);
    }

    /**
     * Size the current selection would have in the source image
     */
    public int[] sourceSelectionSize() {
        var s = finalizeSelection();
        return new int[]{s.width(), s.height()};
    }

    private int toSource(int displayCoord, int displayLimit, int sourceLimit) {
        if (displayCoord >= displayLimit) return sourceLimit;
        return clamp(truncate(displayCoord / scale), 0, sourceLimit);
    }

    private static int truncate(double value) {
        return (int) Math.floor(value + ROUNDING_SLACK);
    }

    private static boolean near(int value, int target, int tolerance) {
        return Math.abs(value - target) <= tolerance;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(value, max));
    }
}
