package xyz.jphil.imgpdf.tools.crop;

/**
 * Active drag: the grabbed handle, where the pointer went down, and the selection at that moment.
 * All drag updates are computed against this snapshot, not incrementally.
 */
public record DragSession(CropHandle handle, int startX, int startY, SelectionRect origin) {
}
