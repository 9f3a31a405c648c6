package xyz.jphil.imgpdf.tools.crop;

import java.awt.Cursor;

/**
 * Draggable hotspots of a crop selection: four corners, four edges and the interior.
 */
public enum CropHandle {
    NW(true, false, true, false, Cursor.NW_RESIZE_CURSOR),
    NE(false, true, true, false, Cursor.NE_RESIZE_CURSOR),
    SW(true, false, false, true, Cursor.SW_RESIZE_CURSOR),
    SE(false, true, false, true, Cursor.SE_RESIZE_CURSOR),
    N(false, false, true, false, Cursor.N_RESIZE_CURSOR),
    S(false, false, false, true, Cursor.S_RESIZE_CURSOR),
    W(true, false, false, false, Cursor.W_RESIZE_CURSOR),
    E(false, true, false, false, Cursor.E_RESIZE_CURSOR),
    MOVE(false, false, false, false, Cursor.MOVE_CURSOR);

    private final boolean west;
    private final boolean east;
    private final boolean north;
    private final boolean south;
    private final int cursorType;

    CropHandle(boolean west, boolean east, boolean north, boolean south, int cursorType) {
        this.west = west;
        this.east = east;
        this.north = north;
        this.south = south;
        this.cursorType = cursorType;
    }

    public boolean movesWest() {
        return west;
    }

    public boolean movesEast() {
        return east;
    }

    public boolean movesNorth() {
        return north;
    }

    public boolean movesSouth() {
        return south;
    }

    /** java.awt.Cursor constant shown while hovering this handle */
    public int cursorType() {
        return cursorType;
    }
}
