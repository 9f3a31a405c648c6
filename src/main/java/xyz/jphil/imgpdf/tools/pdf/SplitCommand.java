package xyz.jphil.imgpdf.tools.pdf;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import xyz.jphil.imgpdf.tools.LogFormatter;
import xyz.jphil.imgpdf.tools.OutputNaming;

import java.io.File;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Split subcommand: extracts page ranges, in the order listed, into a single new PDF
 */
@Command(
    name = "split",
    mixinStandardHelpOptions = true,
    description = "Copy the pages of one or more page ranges into a new PDF"
)
public class SplitCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Input PDF file")
    private File input;

    @Option(names = {"-r", "--ranges"}, required = true,
        description = "Inclusive 1-based page ranges in output order, e.g. \"1-3, 7, 10-12\"")
    private String ranges;

    @Option(names = {"-o", "--output"}, description = "Output PDF (default: split_<input>)")
    private File output;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    @Override
    public Integer call() {
        var log = LogFormatter.standard(verbose);
        try {
            var pageRanges = PageRange.parseList(ranges);
            Path target = output != null ? output.toPath() : new OutputNaming(input.toPath()).prefixed("split");

            var info = PdfInfoUtil.getPdfInfo(input);
            log.step("SPLIT", String.format("%s: %d pages, ranges %s", input.getName(), info.pageCount(),
                PageRange.summary(pageRanges)));

            int written = PdfOperations.split(input.toPath(), pageRanges, target);

            log.success("SPLIT", "Wrote " + target);
            System.out.printf("PDF split successfully!%nRanges: %s%nTotal pages in output: %d%nSaved to:%n%s%n",
                PageRange.summary(pageRanges), written, target);
            return 0;
        } catch (Exception e) {
            log.error("SPLIT", "Failed to split PDF. " + e.getMessage());
            log.trace(e);
            return 1;
        }
    }
}
