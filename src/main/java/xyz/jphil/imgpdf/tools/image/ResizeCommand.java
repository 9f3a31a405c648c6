package xyz.jphil.imgpdf.tools.image;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import xyz.jphil.imgpdf.tools.LogFormatter;
import xyz.jphil.imgpdf.tools.OutputNaming;

import java.io.File;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Resize subcommand
 */
@Command(
    name = "resize",
    mixinStandardHelpOptions = true,
    description = "Resize an image with high-quality resampling"
)
public class ResizeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Input image file (JPG, PNG, BMP, GIF)")
    private File input;

    @Option(names = {"-W", "--width"}, description = "New width in pixels (default: original)")
    private Integer width;

    @Option(names = {"-H", "--height"}, description = "New height in pixels (default: original)")
    private Integer height;

    @Option(names = {"-k", "--keep-aspect"},
        description = "Derive the other side from the original aspect ratio (width wins when both are given)")
    private boolean keepAspect;

    @Option(names = {"-o", "--output"}, description = "Output image; format from extension (default: resized_<input>)")
    private File output;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    @Override
    public Integer call() {
        var log = LogFormatter.standard(verbose);
        try {
            if (width == null && height == null) {
                log.error("RESIZE", "Give at least one of --width / --height.");
                return 1;
            }
            if ((width != null && width <= 0) || (height != null && height <= 0)) {
                log.error("RESIZE", "Width and height must be positive numbers.");
                return 1;
            }
            Path target = output != null ? output.toPath() : new OutputNaming(input.toPath()).prefixed("resized");
            ImageOps.formatFor(target);

            var image = ImageOps.read(input.toPath());
            int originalWidth = image.getWidth();
            int originalHeight = image.getHeight();
            int[] size = targetSize(originalWidth, originalHeight, width, height, keepAspect);

            log.step("RESIZE", String.format("%s: %d x %d -> %d x %d", input.getName(),
                originalWidth, originalHeight, size[0], size[1]));
            var resized = ImageOps.resize(image, size[0], size[1]);
            ImageOps.write(resized, target);

            System.out.printf("Image resized successfully!%nOriginal: %d x %d%nNew: %d x %d%nSaved to:%n%s%n",
                originalWidth, originalHeight, size[0], size[1], target);
            return 0;
        } catch (Exception e) {
            log.error("RESIZE", "Failed to resize image. " + e.getMessage());
            log.trace(e);
            return 1;
        }
    }

    /**
     * Final {width, height}. With keepAspect the missing side is derived (truncated);
     * without it the missing side stays at the original.
     */
    static int[] targetSize(int originalWidth, int originalHeight, Integer width, Integer height, boolean keepAspect) {
        if (keepAspect) {
            if (width != null) {
                return new int[]{width, Math.max(1, (int) ((long) width * originalHeight / originalWidth))};
            }
            return new int[]{Math.max(1, (int) ((long) height * originalWidth / originalHeight)), height};
        }
        return new int[]{width != null ? width : originalWidth, height != null ? height : originalHeight};
    }
}
