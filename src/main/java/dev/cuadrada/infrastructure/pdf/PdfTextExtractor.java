package dev.cuadrada.infrastructure.pdf;

import dev.cuadrada.config.AiProperties;
import dev.cuadrada.domain.valueobject.PaperDocument;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Extracts reviewable text from an uploaded PDF via PDFBox.
 * Papers with fewer than {@value #MIN_TEXT_CHARS} characters of text are refused.
 */
@Component
public class PdfTextExtractor {
    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);
    static final int MIN_TEXT_CHARS = 100;

    private final int maxInputChars;

    public PdfTextExtractor(AiProperties aiProperties) {
        this.maxInputChars = aiProperties.maxInputChars();
    }

    public PaperDocument extract(Path pdf, String title) {
        String text;
        try (PDDocument doc = Loader.loadPDF(pdf.toFile())) {
            text = new PDFTextStripper().getText(doc);
        } catch (IOException e) {
            throw new DocumentExtractionException("PDF extraction error: " + e.getMessage(), e);
        }
        if (text == null || text.trim().length() < MIN_TEXT_CHARS) {
            int length = text == null ? 0 : text.length();
            throw new DocumentExtractionException(
                    "PDF appears empty or has insufficient text (%d chars)".formatted(length));
        }
        PaperDocument document = PaperDocument.of(title, text, maxInputChars);
        if (document.truncated()) {
            log.warn("Paper {} truncated from {} to {} chars", pdf.getFileName(), text.length(), maxInputChars);
        }
        return document;
    }

    /**
     * Title from the PDF document information dictionary, if the file has one.
     */
    public Optional<String> readTitle(Path pdf) {
        try (PDDocument doc = Loader.loadPDF(pdf.toFile())) {
            PDDocumentInformation info = doc.getDocumentInformation();
            String title = info != null ? info.getTitle() : null;
            return title == null || title.isBlank() ? Optional.empty() : Optional.of(title.trim());
        } catch (IOException e) {
            log.debug("No readable metadata in {}: {}", pdf.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }
}
