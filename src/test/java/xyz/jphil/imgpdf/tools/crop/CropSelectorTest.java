package xyz.jphil.imgpdf.tools.crop;

import org.junit.jupiter.api.Test;
import xyz.jphil.imgpdf.tools.InvalidGeometryException;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CropSelectorTest {

    @Test
    void previewScaleFitsLargeImagesAndNeverUpscales() {
        var large = new CropSelector(4000, 3000);
        assertEquals(0.2, large.scale(), 1e-9);
        assertEquals(800, large.displayWidth());
        assertEquals(600, large.displayHeight());

        var small = new CropSelector(300, 200);
        assertEquals(1.0, small.scale());
        assertEquals(300, small.displayWidth());
        assertEquals(200, small.displayHeight());

        var tall = new CropSelector(1000, 3000);
        assertEquals(0.2, tall.scale(), 1e-9);
        assertEquals(200, tall.displayWidth());
        assertEquals(600, tall.displayHeight());
    }

    @Test
    void initialSelectionCoversWholePreview() {
        var selector = new CropSelector(4000, 3000);
        assertEquals(new SelectionRect(0, 0, 800, 600), selector.selection());
        assertFalse(selector.dragging());
    }

    @Test
    void untouchedSelectionFinalizesToWholeSource() {
        int[][] sizes = {{4000, 3000}, {1234, 567}, {801, 601}, {333, 777}, {5, 5}, {12345, 17}};
        for (int[] size : sizes) {
            var selector = new CropSelector(size[0], size[1]);
            assertEquals(SelectionRect.full(size[0], size[1]), selector.finalizeSelection(),
                size[0] + "x" + size[1]);
        }
    }

    @Test
    void dragSouthEastCornerToPreviewCentreSelectsTopLeftQuarter() {
        var selector = new CropSelector(4000, 3000);
        var handle = selector.hitTest(800, 600);
        assertEquals(CropHandle.SE, handle);

        selector.beginDrag(handle, 800, 600);
        selector.updateDrag(400, 300);
        selector.endDrag();

        assertEquals(new SelectionRect(0, 0, 400, 300), selector.selection());
        assertEquals(new SelectionRect(0, 0, 2000, 1500), selector.finalizeSelection());
        assertArrayEquals(new int[]{2000, 1500}, selector.sourceSelectionSize());
    }

    @Test
    void cornersWinOverMidpointsAndEdges() {
        var selector = new CropSelector(4000, 3000);
        assertEquals(CropHandle.NW, selector.hitTest(0, 0));
        assertEquals(CropHandle.NW, selector.hitTest(10, 10));
        assertEquals(CropHandle.NE, selector.hitTest(795, 5));
        assertEquals(CropHandle.SW, selector.hitTest(3, 598));
        assertEquals(CropHandle.SE, selector.hitTest(800, 600));

        assertEquals(CropHandle.N, selector.hitTest(400, 0));
        assertEquals(CropHandle.S, selector.hitTest(405, 595));
        assertEquals(CropHandle.W, selector.hitTest(0, 300));
        assertEquals(CropHandle.E, selector.hitTest(800, 300));
    }

    @Test
    void edgesAreGrabbableAlongTheirWholeLength() {
        var selector = new CropSelector(4000, 3000);
        assertEquals(CropHandle.N, selector.hitTest(200, 8));
        assertEquals(CropHandle.S, selector.hitTest(600, 592));
        assertEquals(CropHandle.W, selector.hitTest(-8, 100));
        assertEquals(CropHandle.E, selector.hitTest(807, 500));
        // just outside the edge tolerance
        assertEquals(CropHandle.MOVE, selector.hitTest(200, 9));
    }

    @Test
    void interiorMovesAndOutsideMissesEntirely() {
        var selector = new CropSelector(4000, 3000);
        assertEquals(CropHandle.MOVE, selector.hitTest(400, 300));
        assertNull(selector.hitTest(900, 300));
        assertNull(selector.hitTest(-50, -50));
    }

    @Test
    void moveIsClampedInsidePreviewAndKeepsSize() {
        var selector = new CropSelector(4000, 3000);
        selector.beginDrag(CropHandle.SE, 800, 600);
        selector.updateDrag(400, 300);
        selector.endDrag();

        selector.beginDrag(selector.hitTest(200, 150), 200, 150);
        selector.updateDrag(5000, 5000);
        assertEquals(new SelectionRect(400, 300, 800, 600), selector.selection());
        selector.updateDrag(-5000, 150);
        assertEquals(new SelectionRect(0, 0, 400, 300), selector.selection());
        selector.endDrag();

        selector.beginDrag(CropHandle.MOVE, 100, 100);
        selector.updateDrag(5000, 5000);
        selector.endDrag();
        assertEquals(new SelectionRect(2000, 1500, 4000, 3000), selector.finalizeSelection());
    }

    @Test
    void dragIsRelativeToSnapshotNotToPreviousUpdate() {
        var selector = new CropSelector(4000, 3000);
        selector.beginDrag(CropHandle.W, 0, 300);
        selector.updateDrag(100, 300);
        selector.updateDrag(150, 300);
        selector.updateDrag(50, 300);
        assertEquals(new SelectionRect(50, 0, 800, 600), selector.selection());
    }

    @Test
    void resizeStopsAtMinimumSelection() {
        var selector = new CropSelector(4000, 3000);
        selector.beginDrag(CropHandle.SE, 800, 600);
        selector.updateDrag(-1000, -1000);
        assertEquals(new SelectionRect(0, 0, 20, 20), selector.selection());
        selector.endDrag();

        selector.beginDrag(CropHandle.NW, 0, 0);
        selector.updateDrag(500, 500);
        assertEquals(new SelectionRect(0, 0, 20, 20), selector.selection());
    }

    @Test
    void nullHandleAndStrayUpdatesAreIgnored() {
        var selector = new CropSelector(4000, 3000);
        var before = selector.selection();

        selector.beginDrag(selector.hitTest(2000, 2000), 2000, 2000);
        assertFalse(selector.dragging());
        selector.updateDrag(10, 10);
        assertEquals(before, selector.selection());

        selector.endDrag();
        selector.endDrag();
        assertFalse(selector.dragging());
    }

    @Test
    void resetRestoresFullSelectionAndIsIdempotent() {
        var selector = new CropSelector(4000, 3000);
        selector.beginDrag(CropHandle.NE, 800, 0);
        selector.updateDrag(500, 200);
        selector.endDrag();
        assertNotEquals(SelectionRect.full(800, 600), selector.selection());

        selector.reset();
        assertEquals(SelectionRect.full(800, 600), selector.selection());
        selector.reset();
        assertEquals(SelectionRect.full(800, 600), selector.selection());
    }

    @Test
    void imageSmallerThanMinimumSelectionStaysSelectable() {
        var selector = new CropSelector(10, 5);
        assertEquals(10, selector.minWidth());
        assertEquals(5, selector.minHeight());

        selector.beginDrag(CropHandle.SE, 10, 5);
        selector.updateDrag(0, 0);
        assertEquals(new SelectionRect(0, 0, 10, 5), selector.selection());
        assertEquals(new SelectionRect(0, 0, 10, 5), selector.finalizeSelection());
    }

    @Test
    void randomPointerSequencesKeepSelectionInsidePreview() {
        var random = new Random(42);
        var handles = CropHandle.values();
        var selector = new CropSelector(3000, 2000);
        int dw = selector.displayWidth();
        int dh = selector.displayHeight();

        for (int gesture = 0; gesture < 500; gesture++) {
            var handle = handles[random.nextInt(handles.length)];
            selector.beginDrag(handle, random.nextInt(dw), random.nextInt(dh));
            for (int step = 0; step < 5; step++) {
                selector.updateDrag(random.nextInt(3 * dw) - dw, random.nextInt(3 * dh) - dh);
                var r = selector.selection();
                assertTrue(0 <= r.x1() && r.x1() <= r.x2() && r.x2() <= dw, r.toString());
                assertTrue(0 <= r.y1() && r.y1() <= r.y2() && r.y2() <= dh, r.toString());
                assertTrue(r.width() >= selector.minWidth(), r.toString());
                assertTrue(r.height() >= selector.minHeight(), r.toString());

                var source = selector.finalizeSelection();
                assertTrue(source.x2() <= 3000 && source.y2() <= 2000, source.toString());
                assertTrue(source.width() > 0 && source.height() > 0, source.toString());
            }
            selector.endDrag();
        }
    }

    @Test
    void thinPreviewStillFinalizesToNonEmptySource() {
        // 1000x3 previews at 800x2, so the minimum height is the whole preview
        var selector = new CropSelector(1000, 3);
        assertEquals(2, selector.displayHeight());

        selector.beginDrag(CropHandle.N, 400, 0);
        selector.updateDrag(400, 50);
        selector.endDrag();
        selector.beginDrag(CropHandle.E, 800, 1);
        selector.updateDrag(-800, 1);
        selector.endDrag();

        var source = selector.finalizeSelection();
        assertEquals(new SelectionRect(0, 0, 25, 3), source);
        assertTrue(source.width() > 0 && source.height() > 0);
    }

    @Test
    void rejectsEmptySourceOrPreview() {
        assertThrows(InvalidGeometryException.class, () -> new CropSelector(0, 100));
        assertThrows(InvalidGeometryException.class, () -> new CropSelector(100, 100, 0, 600));
    }
}
