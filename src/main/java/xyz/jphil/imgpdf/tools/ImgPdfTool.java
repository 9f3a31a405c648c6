package xyz.jphil.imgpdf.tools;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;
import xyz.jphil.imgpdf.tools.compress.CompressCommand;
import xyz.jphil.imgpdf.tools.crop.CropCommand;
import xyz.jphil.imgpdf.tools.image.ResizeCommand;
import xyz.jphil.imgpdf.tools.pdf.ImagesToPdfCommand;
import xyz.jphil.imgpdf.tools.pdf.LockCommand;
import xyz.jphil.imgpdf.tools.pdf.MergeCommand;
import xyz.jphil.imgpdf.tools.pdf.SplitCommand;
import xyz.jphil.imgpdf.tools.pdf.UnlockCommand;

import java.util.concurrent.Callable;

/**
 * Image &amp; PDF utility: each operation is a subcommand that reads its inputs,
 * writes a single output file and exits.
 * Built with PicoCLI for argument parsing and help generation
 */
@Command(
    name = "imgpdf",
    mixinStandardHelpOptions = true,
    version = "1.0",
    description = "Image & PDF utility tool - merge, split, convert, lock and unlock PDFs; resize, crop and compress images",
    subcommands = {
        MergeCommand.class,
        SplitCommand.class,
        ImagesToPdfCommand.class,
        LockCommand.class,
        UnlockCommand.class,
        ResizeCommand.class,
        CropCommand.class,
        CompressCommand.class
    }
)
public class ImgPdfTool implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine commandLine() {
        return new CommandLine(new ImgPdfTool());
    }

    /**
     * No subcommand: list the operations
     */
    @Override
    public Integer call() {
        spec.commandLine().usage(System.err);
        return 1;
    }
}
