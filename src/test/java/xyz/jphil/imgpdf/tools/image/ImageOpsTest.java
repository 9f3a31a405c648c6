package xyz.jphil.imgpdf.tools.image;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.jphil.imgpdf.tools.DecodeException;
import xyz.jphil.imgpdf.tools.EncodeException;
import xyz.jphil.imgpdf.tools.InvalidGeometryException;
import xyz.jphil.imgpdf.tools.TestFiles;
import xyz.jphil.imgpdf.tools.crop.SelectionRect;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ImageOpsTest {

    @TempDir
    Path dir;

    @Test
    void resizeHitsExactSizeUpAndDown() {
        var image = TestFiles.gradient(1000, 500);
        var down = ImageOps.resize(image, 123, 45);
        assertEquals(123, down.getWidth());
        assertEquals(45, down.getHeight());

        var up = ImageOps.resize(image, 1500, 900);
        assertEquals(1500, up.getWidth());
        assertEquals(900, up.getHeight());
        assertEquals(1000, image.getWidth());
    }

    @Test
    void resizeKeepsAlphaChannel() {
        var argb = new BufferedImage(100, 100, BufferedImage.TYPE_INT_ARGB);
        assertTrue(ImageOps.hasAlpha(ImageOps.resize(argb, 40, 40)));
    }

    @Test
    void resizeRejectsNonPositiveSize() {
        var image = TestFiles.gradient(10, 10);
        assertThrows(InvalidGeometryException.class, () -> ImageOps.resize(image, 0, 10));
        assertThrows(InvalidGeometryException.class, () -> ImageOps.resize(image, 10, -1));
    }

    @Test
    void toRgbFlattensOntoWhite() {
        var argb = new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB);
        argb.setRGB(1, 1, 0xFFFF0000);
        var rgb = ImageOps.toRgb(argb);

        assertEquals(BufferedImage.TYPE_INT_RGB, rgb.getType());
        assertEquals(0xFFFFFF, rgb.getRGB(0, 0) & 0xFFFFFF);
        assertEquals(0xFF0000, rgb.getRGB(1, 1) & 0xFFFFFF);

        var alreadyRgb = TestFiles.gradient(4, 4);
        assertSame(alreadyRgb, ImageOps.toRgb(alreadyRgb));
    }

    @Test
    void cropCopiesRegionPixels() {
        var image = TestFiles.gradient(300, 200);
        var cropped = ImageOps.crop(image, new SelectionRect(100, 50, 160, 90));

        assertEquals(60, cropped.getWidth());
        assertEquals(40, cropped.getHeight());
        assertEquals(image.getRGB(100, 50), cropped.getRGB(0, 0));
        assertEquals(image.getRGB(159, 89), cropped.getRGB(59, 39));
    }

    @Test
    void cropRejectsOutOfBoundsAndEmpty() {
        var image = TestFiles.gradient(100, 100);
        assertThrows(InvalidGeometryException.class, () -> ImageOps.crop(image, new SelectionRect(0, 0, 101, 50)));
        assertThrows(InvalidGeometryException.class, () -> ImageOps.crop(image, new SelectionRect(10, 10, 10, 50)));
    }

    @Test
    void writeUsesExtensionAndFlattensForJpeg() throws Exception {
        var argb = new BufferedImage(30, 20, BufferedImage.TYPE_INT_ARGB);
        var jpg = dir.resolve("out.JPG");
        ImageOps.write(argb, jpg);
        assertEquals(30, ImageIO.read(jpg.toFile()).getWidth());

        var png = dir.resolve("out.png");
        ImageOps.write(argb, png);
        assertTrue(ImageOps.read(png).getColorModel().hasAlpha());
    }

    @Test
    void unsupportedOutputFormatIsEncodeError() {
        assertThrows(EncodeException.class, () -> ImageOps.formatFor(Path.of("x.tiff")));
        assertThrows(EncodeException.class, () -> ImageOps.formatFor(Path.of("noext")));
        assertDoesNotThrow(() -> ImageOps.formatFor(Path.of("a.JpEg")));
    }

    @Test
    void readFailsOnMissingOrGarbageFile() throws Exception {
        assertThrows(DecodeException.class, () -> ImageOps.read(dir.resolve("missing.png")));

        var garbage = Files.writeString(dir.resolve("garbage.png"), "not an image");
        assertThrows(DecodeException.class, () -> ImageOps.read(garbage));
    }
}
