package xyz.jphil.imgpdf.tools.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import xyz.jphil.imgpdf.tools.DecodeException;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

/**
 * Utility for extracting basic PDF information
 */
public class PdfInfoUtil {
    
    /**
     * Page count, file size and encryption flag.
     * pageCount is -1 when the file is encrypted with a user password and cannot be opened without it.
     */
    public record PdfInfo(int pageCount, long fileSize, boolean encrypted) {}
    
    public static PdfInfo getPdfInfo(File pdfFile) throws DecodeException {
        if (!pdfFile.isFile()) {
            throw new DecodeException("PDF file does not exist: " + pdfFile);
        }
        try {
            long fileSize = Files.size(pdfFile.toPath());
            try (PDDocument document = Loader.loadPDF(pdfFile)) {
                return new PdfInfo(document.getNumberOfPages(), fileSize, document.isEncrypted());
            } catch (InvalidPasswordException e) {
                return new PdfInfo(-1, fileSize, true);
            }
        } catch (IOException e) {
            throw DecodeException.unreadable(pdfFile.toPath(), e);
        }
    }
}
