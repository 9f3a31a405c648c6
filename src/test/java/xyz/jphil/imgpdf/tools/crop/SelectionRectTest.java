package xyz.jphil.imgpdf.tools.crop;

import org.junit.jupiter.api.Test;
import xyz.jphil.imgpdf.tools.InvalidGeometryException;

import static org.junit.jupiter.api.Assertions.*;

class SelectionRectTest {

    @Test
    void parsesRegionWithOrWithoutSpaces() {
        assertEquals(new SelectionRect(10, 20, 110, 220), SelectionRect.parse("10,20,110,220"));
        assertEquals(new SelectionRect(0, 0, 5, 5), SelectionRect.parse(" 0 , 0, 5 ,5 "));
    }

    @Test
    void rejectsMalformedOrInvertedRegions() {
        assertThrows(InvalidGeometryException.class, () -> SelectionRect.parse("1,2,3"));
        assertThrows(InvalidGeometryException.class, () -> SelectionRect.parse("a,2,3,4"));
        assertThrows(InvalidGeometryException.class, () -> SelectionRect.parse("50,0,10,10"));
        assertThrows(InvalidGeometryException.class, () -> new SelectionRect(-1, 0, 10, 10));
    }

    @Test
    void geometryHelpers() {
        var r = new SelectionRect(10, 20, 50, 100);
        assertEquals(40, r.width());
        assertEquals(80, r.height());
        assertEquals(30, r.midX());
        assertEquals(60, r.midY());
        assertTrue(r.containsStrictly(11, 21));
        assertFalse(r.containsStrictly(10, 50));
        assertEquals("(10,20)-(50,100)", r.toString());
    }
}
