package xyz.jphil.imgpdf.tools.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.io.IOUtils;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import xyz.jphil.imgpdf.tools.DecodeException;
import xyz.jphil.imgpdf.tools.OutputNaming;
import xyz.jphil.imgpdf.tools.image.ImageOps;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * PDF file operations on top of PDFBox. Each call opens its inputs, writes one output and
 * closes everything it opened, on success and on failure.
 */
public final class PdfOperations {

    public static final int ENCRYPTION_KEY_LENGTH = 128;

    public enum UnlockOutcome { UNLOCKED, NOT_ENCRYPTED }

    private PdfOperations() {}

    /**
     * Appends all pages of the inputs, in the given order, into {@code output}.
     */
    public static void merge(List<Path> inputs, Path output) throws IOException {
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("Select at least one PDF to merge");
        }
        var merger = new PDFMergerUtility();
        for (var input : inputs) {
            requireFile(input);
            merger.addSource(input.toFile());
        }
        merger.setDestinationFileName(output.toString());
        merger.mergeDocuments(IOUtils.createMemoryOnlyStreamCache());
    }

    /**
     * Copies the pages named by {@code ranges}, in list order, into {@code output}.
     *
     * @return number of pages written
     */
    public static int split(Path input, List<PageRange> ranges, Path output) throws IOException {
        requireFile(input);
        try (PDDocument source = Loader.loadPDF(input.toFile());
             PDDocument target = new PDDocument()) {
            PageRange.validateAll(ranges, source.getNumberOfPages());
            for (var range : ranges) {
                for (int page = range.start(); page <= range.end(); page++) {
                    target.importPage(source.getPage(page - 1));
                }
            }
            target.save(output.toFile());
            return target.getNumberOfPages();
        }
    }

    /**
     * One page per image, page size equal to the image size in points (72 dpi).
     * JPEG files are embedded as-is; other formats are flattened to RGB and stored losslessly.
     *
     * @param onImage called with the 1-based index of each image once it is added
     */
    public static void imagesToPdf(List<Path> images, Path output, IntConsumer onImage) throws IOException {
        if (images.isEmpty()) {
            throw new IllegalArgumentException("Select at least one image to convert");
        }
        try (PDDocument document = new PDDocument()) {
            for (int i = 0; i < images.size(); i++) {
                var file = images.get(i);
                var image = ImageOps.read(file);
                PDImageXObject xObject;
                if (isJpeg(file)) {
                    try (InputStream in = Files.newInputStream(file)) {
                        xObject = JPEGFactory.createFromStream(document, in);
                    }
                } else {
                    xObject = LosslessFactory.createFromImage(document, ImageOps.toRgb(image));
                }
                var page = new PDPage(new PDRectangle(image.getWidth(), image.getHeight()));
                document.addPage(page);
                try (var content = new PDPageContentStream(document, page)) {
                    content.drawImage(xObject, 0, 0, image.getWidth(), image.getHeight());
                }
                onImage.accept(i + 1);
            }
            document.save(output.toFile());
        }
    }

    /**
     * Encrypts with {@code password} as both user and owner password (AES, 128-bit key).
     * Document information is kept.
     */
    public static void lock(Path input, String password, Path output) throws IOException {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be empty.");
        }
        requireFile(input);
        try (PDDocument document = Loader.loadPDF(input.toFile())) {
            var policy = new StandardProtectionPolicy(password, password, new AccessPermission());
            policy.setEncryptionKeyLength(ENCRYPTION_KEY_LENGTH);
            policy.setPreferAES(true);
            document.protect(policy);
            document.save(output.toFile());
        }
    }

    /**
     * Writes a decrypted copy. Nothing is written for a file that is not encrypted.
     *
     * @throws org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException on a wrong password
     */
    public static UnlockOutcome unlock(Path input, String password, Path output) throws IOException {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be empty.");
        }
        requireFile(input);
        try (PDDocument document = Loader.loadPDF(input.toFile(), password)) {
            if (!document.isEncrypted()) {
                return UnlockOutcome.NOT_ENCRYPTED;
            }
            document.setAllSecurityToBeRemoved(true);
            document.save(output.toFile());
            return UnlockOutcome.UNLOCKED;
        }
    }

    private static boolean isJpeg(Path file) {
        var ext = OutputNaming.extension(file);
        return ext.equals("jpg") || ext.equals("jpeg");
    }

    private static void requireFile(Path file) throws DecodeException {
        if (!Files.isRegularFile(file)) {
            throw new DecodeException("Input file does not exist: " + file);
        }
    }
}
