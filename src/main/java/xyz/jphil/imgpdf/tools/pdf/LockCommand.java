package xyz.jphil.imgpdf.tools.pdf;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import xyz.jphil.imgpdf.tools.LogFormatter;
import xyz.jphil.imgpdf.tools.OutputNaming;

import java.io.File;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.Callable;

/**
 * Lock subcommand: password-protects a PDF
 */
@Command(
    name = "lock",
    mixinStandardHelpOptions = true,
    description = "Encrypt a PDF with a password (AES, 128-bit key)"
)
public class LockCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Input PDF file")
    private File input;

    @Option(names = {"-p", "--password"}, required = true, interactive = true, arity = "0..1",
        description = "Password (prompted when given without a value)")
    private char[] password;

    @Option(names = {"--confirm"}, interactive = true, arity = "0..1",
        description = "Repeat the password; must match when given")
    private char[] confirm;

    @Option(names = {"-o", "--output"}, description = "Output PDF (default: locked_<input>)")
    private File output;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    @Override
    public Integer call() {
        var log = LogFormatter.standard(verbose);
        try {
            if (password == null || password.length == 0) {
                log.error("LOCK", "Password cannot be empty.");
                return 1;
            }
            if (confirm != null && !Arrays.equals(password, confirm)) {
                log.error("LOCK", "Passwords do not match.");
                return 1;
            }
            Path target = output != null ? output.toPath() : new OutputNaming(input.toPath()).prefixed("locked");

            log.step("LOCK", "Encrypting " + input.getName());
            PdfOperations.lock(input.toPath(), new String(password), target);

            log.success("LOCK", "Wrote " + target);
            System.out.printf("PDF locked successfully with password!%nSaved to:%n%s%n", target);
            return 0;
        } catch (Exception e) {
            log.error("LOCK", "Failed to lock PDF. " + e.getMessage());
            log.trace(e);
            return 1;
        } finally {
            if (password != null) Arrays.fill(password, '\0');
            if (confirm != null) Arrays.fill(confirm, '\0');
        }
    }
}
