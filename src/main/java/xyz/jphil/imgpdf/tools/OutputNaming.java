package xyz.jphil.imgpdf.tools;

import java.nio.file.Path;

/**
 * Default output names next to the input file, used when no -o is given:
 * resized_photo.png, compressed_photo.jpg, locked_report.pdf, merged.pdf
 */
public class OutputNaming {
    private final Path dir;
    private final String name;
    private final String base;

    public OutputNaming(Path input) {
        var parent = input.toAbsolutePath().getParent();
        this.dir = parent != null ? parent : Path.of(".");
        this.name = input.getFileName().toString();
        this.base = baseName(name);
    }

    /** prefix_name.ext */
    public Path prefixed(String prefix) {
        return dir.resolve(prefix + "_" + name);
    }

    /** prefix_base.newExt */
    public Path prefixed(String prefix, String newExt) {
        return dir.resolve(String.format("%s_%s.%s", prefix, base, newExt));
    }

    /** base.newExt */
    public Path withExtension(String newExt) {
        return dir.resolve(base + "." + newExt);
    }

    public Path sibling(String fileName) {
        return dir.resolve(fileName);
    }

    public static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Lower-case extension without the dot, "" when there is none
     */
    public static String extension(Path file) {
        var fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 && dot < fileName.length() - 1 ? fileName.substring(dot + 1).toLowerCase() : "";
    }
}
