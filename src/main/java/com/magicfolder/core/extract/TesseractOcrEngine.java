package com.magicfolder.core.extract;

import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import net.sourceforge.tess4j.util.LoadLibs;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Tess4J-backed OCR. PDFs are rendered page by page with PDFBox, stopping after
 * {@code magicfolder.ocr.max-pages}; images go straight to Tesseract.
 * <p>
 * Availability is probed once: OCR is off when disabled in config, when the
 * native Tesseract library cannot be loaded, or when the tessdata directory
 * is missing.
 */
@Component
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final OcrProperties properties;
    private volatile Boolean available;

    public TesseractOcrEngine(OcrProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean available() {
        Boolean probed = available;
        if (probed == null) {
            probed = probe();
            available = probed;
        }
        return probed;
    }

    private boolean probe() {
        if (!properties.isEnabled()) {
            log.info("OCR disabled by configuration");
            return false;
        }
        if (!Files.isDirectory(Path.of(properties.getDatapath()))) {
            log.warn("OCR unavailable: tessdata directory not found at {}", properties.getDatapath());
            return false;
        }
        try {
            LoadLibs.getTessAPIInstance();
            return true;
        } catch (UnsatisfiedLinkError | NoClassDefFoundError e) {
            log.warn("OCR unavailable: native Tesseract library could not be loaded ({})", e.getMessage());
            return false;
        }
    }

    @Override
    public String extract(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            if (name.endsWith(".pdf")) {
                return extractPdf(file);
            }
            BufferedImage image = ImageIO.read(file.toFile());
            if (image == null) {
                log.debug("No image reader for {}", file.getFileName());
                return "";
            }
            return newTesseract().doOCR(image);
        } catch (TesseractException e) {
            throw new IOException("OCR failed for " + file.getFileName() + ": " + e.getMessage(), e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            // JNA reports native crashes inside Tesseract as Error
            throw new IOException("OCR engine failed for " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private String extractPdf(Path file) throws IOException, TesseractException {
        var text = new StringBuilder();
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            var renderer = new PDFRenderer(document);
            int pages = Math.min(document.getNumberOfPages(), properties.getMaxPages());
            Tesseract tesseract = newTesseract();
            for (int page = 0; page < pages; page++) {
                BufferedImage image = renderer.renderImageWithDPI(page, properties.getRenderDpi(), ImageType.GRAY);
                text.append(tesseract.doOCR(image)).append('\n');
            }
            if (document.getNumberOfPages() > pages) {
                log.debug("OCR capped {} at {} of {} pages",
                        file.getFileName(), pages, document.getNumberOfPages());
            }
        }
        return text.toString();
    }

    private Tesseract newTesseract() {
        var tesseract = new Tesseract();
        tesseract.setDatapath(properties.getDatapath());
        tesseract.setLanguage(properties.getLanguage());
        return tesseract;
    }
}
