package xyz.jphil.imgpdf.tools.pdf;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import xyz.jphil.imgpdf.tools.LogFormatter;
import xyz.jphil.imgpdf.tools.OutputNaming;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Merge subcommand: concatenates PDFs in argument order
 */
@Command(
    name = "merge",
    mixinStandardHelpOptions = true,
    description = "Merge several PDF files into one, in the order given"
)
public class MergeCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "PDF files to merge")
    private List<File> inputs;

    @Option(names = {"-o", "--output"}, description = "Output PDF (default: merged.pdf next to the first input)")
    private File output;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    @Override
    public Integer call() {
        var log = LogFormatter.standard(verbose);
        try {
            List<Path> paths = inputs.stream().map(File::toPath).toList();
            Path target = output != null ? output.toPath() : new OutputNaming(paths.get(0)).sibling("merged.pdf");

            log.step("MERGE", String.format("Merging %d PDFs", paths.size()));
            for (var path : paths) {
                var info = PdfInfoUtil.getPdfInfo(path.toFile());
                log.debug("MERGE", String.format("%s: %d pages, %s", path.getFileName(),
                    info.pageCount(), LogFormatter.formatBytes(info.fileSize())));
            }

            PdfOperations.merge(paths, target);

            log.success("MERGE", "Wrote " + target);
            System.out.printf("Merged %d PDFs into:%n%s%n", paths.size(), target);
            return 0;
        } catch (Exception e) {
            log.error("MERGE", "Failed to merge PDFs. " + e.getMessage());
            log.trace(e);
            return 1;
        }
    }
}
