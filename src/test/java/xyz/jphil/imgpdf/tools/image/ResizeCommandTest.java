package xyz.jphil.imgpdf.tools.image;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResizeCommandTest {

    @Test
    void missingSideKeepsOriginalWithoutAspectLock() {
        assertArrayEquals(new int[]{300, 100}, ResizeCommand.targetSize(200, 100, 300, null, false));
        assertArrayEquals(new int[]{200, 40}, ResizeCommand.targetSize(200, 100, null, 40, false));
        assertArrayEquals(new int[]{30, 40}, ResizeCommand.targetSize(200, 100, 30, 40, false));
    }

    @Test
    void aspectLockDerivesHeightFromWidth() {
        assertArrayEquals(new int[]{150, 112}, ResizeCommand.targetSize(400, 300, 150, null, true));
        // width wins when both are given
        assertArrayEquals(new int[]{100, 50}, ResizeCommand.targetSize(200, 100, 100, 999, true));
        assertArrayEquals(new int[]{80, 40}, ResizeCommand.targetSize(200, 100, null, 40, true));
    }

    @Test
    void derivedSideNeverDropsToZero() {
        assertArrayEquals(new int[]{1, 1}, ResizeCommand.targetSize(1000, 10, 1, null, true));
    }
}
