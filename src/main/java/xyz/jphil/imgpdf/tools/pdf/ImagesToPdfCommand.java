package xyz.jphil.imgpdf.tools.pdf;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import xyz.jphil.imgpdf.tools.LogFormatter;
import xyz.jphil.imgpdf.tools.OutputNaming;
import xyz.jphil.imgpdf.tools.ProgressTracker;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Image-to-PDF subcommand: one page per image
 */
@Command(
    name = "img2pdf",
    mixinStandardHelpOptions = true,
    description = "Convert JPG/PNG images into a PDF, one page per image"
)
public class ImagesToPdfCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Image files (JPG, PNG), in page order")
    private List<File> images;

    @Option(names = {"-o", "--output"}, description = "Output PDF (default: <first image name>.pdf)")
    private File output;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    @Override
    public Integer call() {
        var log = LogFormatter.standard(verbose);
        List<Path> paths = images.stream().map(File::toPath).toList();
        Path target = output != null ? output.toPath() : new OutputNaming(paths.get(0)).withExtension("pdf");

        try (var progress = new ProgressTracker("Image to PDF", paths.size(), verbose)) {
            progress.start();
            try {
                PdfOperations.imagesToPdf(paths, target, progress::update);
                progress.done();
            } catch (Exception e) {
                progress.err(e.getMessage());
                throw e;
            }
            log.success("IMG2PDF", "Wrote " + target);
            System.out.printf("Created PDF from %d image(s):%n%s%n", paths.size(), target);
            return 0;
        } catch (Exception e) {
            log.error("IMG2PDF", "Failed to create PDF. " + e.getMessage());
            log.trace(e);
            return 1;
        }
    }
}
