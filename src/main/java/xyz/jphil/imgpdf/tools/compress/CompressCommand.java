package xyz.jphil.imgpdf.tools.compress;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import xyz.jphil.imgpdf.tools.LogFormatter;
import xyz.jphil.imgpdf.tools.OutputNaming;
import xyz.jphil.imgpdf.tools.ProgressAwareLogFormatter;
import xyz.jphil.imgpdf.tools.ProgressTracker;
import xyz.jphil.imgpdf.tools.image.ImageOps;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Compress subcommand: proportional downscale until the JPEG fits the target size
 */
@Command(
    name = "compress",
    mixinStandardHelpOptions = true,
    description = "Compress an image to a target size by resizing it proportionally; output is JPEG"
)
public class CompressCommand implements Callable<Integer> {

    static final int MIN_DEFAULT_TARGET_KB = 10;

    @Parameters(index = "0", description = "Input image file (JPG, PNG, BMP)")
    private File input;

    @Option(names = {"-t", "--target-kb"}, description = "Target size in KB (default: half the input size, at least 10)")
    private Integer targetKb;

    @Option(names = {"-o", "--output"}, description = "Output JPEG, .jpg or .jpeg (default: compressed_<input base>.jpg)")
    private File output;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    @Override
    public Integer call() {
        var log = LogFormatter.standard(verbose);
        try {
            if (targetKb != null && targetKb <= 0) {
                log.error("COMPRESS", "Target size must be a positive number.");
                return 1;
            }
            if (output != null && !isJpegName(output.toPath())) {
                log.error("COMPRESS", "Output must be a .jpg or .jpeg file: " + output);
                return 1;
            }
            var image = ImageOps.read(input.toPath());
            long originalBytes = Files.size(input.toPath());
            int kb = targetKb != null ? targetKb : defaultTargetKb(originalBytes);
            long targetBytes = kb * 1024L;
            Path target = output != null ? output.toPath() : new OutputNaming(input.toPath()).prefixed("compressed", "jpg");

            log.step("COMPRESS", String.format("%s: %d x %d, %s -> target %d KB", input.getName(),
                image.getWidth(), image.getHeight(), LogFormatter.formatBytes(originalBytes), kb));

            CompressionResult result;
            try (var progress = new ProgressTracker("Compression trials", TargetSizeCompressor.MAX_TRIALS, verbose)) {
                var trialLog = ProgressAwareLogFormatter.create(verbose, progress);
                progress.start();
                result = new TargetSizeCompressor().compress(image, targetBytes, trial -> {
                    trialLog.debug("COMPRESS", trial.toString());
                    progress.inc(String.format("%dx%d %s", trial.width(), trial.height(),
                        LogFormatter.formatBytes(trial.bytes())));
                });
                progress.done();
            }

            if (!result.budgetMet()) {
                log.warning("COMPRESS", String.format("Could not reach %d KB even at the smallest size; kept %s",
                    kb, LogFormatter.formatBytes(result.size())));
            }
            Files.write(target, result.encoded());

            double reduction = originalBytes > 0 ? (originalBytes - result.size()) * 100.0 / originalBytes : 0;
            System.out.printf("Image compressed successfully!%n"
                    + "Original: %.2f KB (%d x %d)%n"
                    + "Compressed: %.2f KB (%d x %d)%n"
                    + "Reduction: %.1f%%%n"
                    + "Saved to:%n%s%n",
                originalBytes / 1024.0, image.getWidth(), image.getHeight(),
                result.size() / 1024.0, result.width(), result.height(),
                reduction, target);
            return 0;
        } catch (Exception e) {
            log.error("COMPRESS", "Failed to compress image. " + e.getMessage());
            log.trace(e);
            return 1;
        }
    }

    static boolean isJpegName(Path file) {
        var ext = OutputNaming.extension(file);
        return ext.equals("jpg") || ext.equals("jpeg");
    }

    static int defaultTargetKb(long originalBytes) {
        return Math.max(MIN_DEFAULT_TARGET_KB, (int) (originalBytes / 1024.0 * 0.5));
    }
}
