package xyz.jphil.imgpdf.tools.pdf;

import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
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
 * Unlock subcommand: removes password protection
 */
@Command(
    name = "unlock",
    mixinStandardHelpOptions = true,
    description = "Decrypt a password-protected PDF"
)
public class UnlockCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Password-protected PDF file")
    private File input;

    @Option(names = {"-p", "--password"}, required = true, interactive = true, arity = "0..1",
        description = "Password (prompted when given without a value)")
    private char[] password;

    @Option(names = {"-o", "--output"}, description = "Output PDF (default: unlocked_<input>)")
    private File output;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    @Override
    public Integer call() {
        var log = LogFormatter.standard(verbose);
        try {
            if (password == null || password.length == 0) {
                log.error("UNLOCK", "Password cannot be empty.");
                return 1;
            }
            Path target = output != null ? output.toPath() : new OutputNaming(input.toPath()).prefixed("unlocked");

            log.step("UNLOCK", "Decrypting " + input.getName());
            var outcome = PdfOperations.unlock(input.toPath(), new String(password), target);

            if (outcome == PdfOperations.UnlockOutcome.NOT_ENCRYPTED) {
                System.out.println("This PDF is not password-protected. No unlocking needed.");
                return 0;
            }
            log.success("UNLOCK", "Wrote " + target);
            System.out.printf("PDF unlocked successfully!%nSaved to:%n%s%n", target);
            return 0;
        } catch (InvalidPasswordException e) {
            log.error("UNLOCK", "Incorrect password. Please try again.");
            return 1;
        } catch (Exception e) {
            log.error("UNLOCK", "Failed to unlock PDF. " + e.getMessage());
            log.trace(e);
            return 1;
        } finally {
            if (password != null) Arrays.fill(password, '\0');
        }
    }
}
