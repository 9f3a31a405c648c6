package xyz.jphil.imgpdf.tools.crop;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import xyz.jphil.imgpdf.tools.LogFormatter;
import xyz.jphil.imgpdf.tools.OutputNaming;
import xyz.jphil.imgpdf.tools.image.ImageOps;

import java.awt.GraphicsEnvironment;
import java.io.File;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Crop subcommand: interactive selection in a preview window, or a fixed region with --region
 */
@Command(
    name = "crop",
    mixinStandardHelpOptions = true,
    description = "Crop an image by dragging a selection, or to a given --region"
)
public class CropCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Input image file (JPG, PNG, BMP, GIF)")
    private File input;

    @Option(names = {"-r", "--region"},
        description = "Crop region in source pixels as x1,y1,x2,y2 (skips the interactive window)")
    private String region;

    @Option(names = {"--preview-width"}, defaultValue = "" + CropSelector.MAX_PREVIEW_WIDTH,
        description = "Maximum preview width (default: ${DEFAULT-VALUE})")
    private int previewWidth;

    @Option(names = {"--preview-height"}, defaultValue = "" + CropSelector.MAX_PREVIEW_HEIGHT,
        description = "Maximum preview height (default: ${DEFAULT-VALUE})")
    private int previewHeight;

    @Option(names = {"-o", "--output"}, description = "Output image; format from extension (default: cropped_<input>)")
    private File output;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    @Override
    public Integer call() {
        var log = LogFormatter.standard(verbose);
        try {
            Path target = output != null ? output.toPath() : new OutputNaming(input.toPath()).prefixed("cropped");
            ImageOps.formatFor(target);
            var image = ImageOps.read(input.toPath());
            log.debug("CROP", String.format("%s: %d x %d px", input.getName(), image.getWidth(), image.getHeight()));

            SelectionRect selected;
            if (region != null) {
                selected = SelectionRect.parse(region);
            } else if (GraphicsEnvironment.isHeadless()) {
                log.error("CROP", "No display available; pass --region x1,y1,x2,y2");
                return 1;
            } else {
                var choice = CropDialog.showDialog(input.getName(), image, previewWidth, previewHeight);
                if (choice.isEmpty()) {
                    log.info("CROP", "Cancelled");
                    return 0;
                }
                selected = choice.get();
            }

            log.step("CROP", "Cropping to " + selected);
            var cropped = ImageOps.crop(image, selected);
            ImageOps.write(cropped, target);

            System.out.printf("Image cropped successfully!%nOriginal: %d x %d%nCropped: %d x %d%nSaved to:%n%s%n",
                image.getWidth(), image.getHeight(), cropped.getWidth(), cropped.getHeight(), target);
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("CROP", "Interrupted");
            return 1;
        } catch (Exception e) {
            log.error("CROP", "Failed to crop image. " + e.getMessage());
            log.trace(e);
            return 1;
        }
    }
}
