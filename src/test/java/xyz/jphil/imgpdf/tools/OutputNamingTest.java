package xyz.jphil.imgpdf.tools;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OutputNamingTest {

    private final Path input = Path.of("/data/photos/holiday.PNG");

    @Test
    void defaultNamesSitNextToInput() {
        var naming = new OutputNaming(input);
        assertEquals(Path.of("/data/photos/resized_holiday.PNG"), naming.prefixed("resized"));
        assertEquals(Path.of("/data/photos/compressed_holiday.jpg"), naming.prefixed("compressed", "jpg"));
        assertEquals(Path.of("/data/photos/holiday.pdf"), naming.withExtension("pdf"));
        assertEquals(Path.of("/data/photos/merged.pdf"), naming.sibling("merged.pdf"));
    }

    @Test
    void extensionIsLowerCasedAndOptional() {
        assertEquals("png", OutputNaming.extension(input));
        assertEquals("", OutputNaming.extension(Path.of("README")));
        assertEquals("", OutputNaming.extension(Path.of(".hidden")));
        assertEquals("gz", OutputNaming.extension(Path.of("a.tar.gz")));
    }

    @Test
    void baseNameStripsLastExtensionOnly() {
        assertEquals("a.tar", OutputNaming.baseName("a.tar.gz"));
        assertEquals(".hidden", OutputNaming.baseName(".hidden"));
        assertEquals("plain", OutputNaming.baseName("plain"));
    }
}
