package dev.cuadrada.infrastructure.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the acceptance certificate and per-reviewer report PDFs with PDFBox.
 * Uses the standard Helvetica font so no font files are needed on the host.
 */
@Component
public class ReportPdfWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportPdfWriter.class);

    private static final int TITLE_LIMIT = 80;
    private static final float MARGIN = 56f;
    private static final float BODY_SIZE = 11f;
    private static final float LEADING = 15f;
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);

    private final PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    private final PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);

    public void writeCertificate(String paperTitle, String submissionId, Path output) {
        try (PDDocument doc = new PDDocument()) {
            doc.getDocumentInformation().setTitle("Certificate of Acceptance");
            PDPage page = new PDPage(new PDRectangle(PDRectangle.A4.getHeight(), PDRectangle.A4.getWidth()));
            doc.addPage(page);
            float width = page.getMediaBox().getWidth();
            float y = page.getMediaBox().getHeight() - 120;
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                centered(cs, bold, 28, "Certificate of Acceptance", width, y);
                y -= 60;
                centered(cs, bold, 16, shortTitle(paperTitle), width, y);
                y -= 40;
                centered(cs, regular, 13,
                        "has successfully passed Cuadrada's AI-powered peer review process", width, y);
                y -= 60;
                centered(cs, regular, 11, "Date: " + LocalDate.now(ZoneOffset.UTC).format(DATE), width, y);
                y -= 18;
                centered(cs, regular, 11, "Certificate ID: " + submissionId, width, y);
            }
            doc.save(output.toFile());
            log.debug("Certificate written to {}", output);
        } catch (IOException e) {
            throw new UncheckedIOException("Certificate rendering failed", e);
        }
    }

    public void writeReviewReport(String paperTitle, String reviewerName, String decision,
                                  String reviewText, Path output) {
        try (PDDocument doc = new PDDocument()) {
            doc.getDocumentInformation().setTitle(reviewerName + " review");
            List<String> lines = new ArrayList<>();
            float textWidth = PDRectangle.A4.getWidth() - 2 * MARGIN;
            for (String paragraph : sanitize(reviewText == null ? "" : reviewText).split("\n", -1)) {
                lines.addAll(wrap(paragraph, textWidth));
            }

            PDPage page = newPage(doc);
            PDPageContentStream cs = new PDPageContentStream(doc, page);
            try {
                float y = page.getMediaBox().getHeight() - MARGIN;
                y = line(cs, bold, 16, "Review: " + shortTitle(paperTitle), y);
                y = line(cs, regular, 12, "Reviewer: " + sanitize(reviewerName), y - 4);
                y = line(cs, bold, 12, "Decision: " + sanitize(decision), y);
                y -= LEADING;
                for (String text : lines) {
                    if (y < MARGIN) {
                        cs.close();
                        page = newPage(doc);
                        cs = new PDPageContentStream(doc, page);
                        y = page.getMediaBox().getHeight() - MARGIN;
                    }
                    y = line(cs, regular, BODY_SIZE, text, y);
                }
            } finally {
                cs.close();
            }
            doc.save(output.toFile());
            log.debug("Review report for {} written to {}", reviewerName, output);
        } catch (IOException e) {
            throw new UncheckedIOException("Review report rendering failed", e);
        }
    }

    private static PDPage newPage(PDDocument doc) {
        PDPage page = new PDPage(PDRectangle.A4);
        doc.addPage(page);
        return page;
    }

    private float line(PDPageContentStream cs, PDType1Font font, float size, String text, float y)
            throws IOException {
        cs.beginText();
        cs.setFont(font, size);
        cs.newLineAtOffset(MARGIN, y);
        cs.showText(sanitize(text).replace('\n', ' '));
        cs.endText();
        return y - Math.max(LEADING, size + 4);
    }

    private void centered(PDPageContentStream cs, PDType1Font font, float size, String text,
                          float pageWidth, float y) throws IOException {
        String safe = sanitize(text).replace('\n', ' ');
        float textWidth = font.getStringWidth(safe) / 1000 * size;
        cs.beginText();
        cs.setFont(font, size);
        cs.newLineAtOffset(Math.max(MARGIN, (pageWidth - textWidth) / 2), y);
        cs.showText(safe);
        cs.endText();
    }

    private List<String> wrap(String paragraph, float maxWidth) throws IOException {
        List<String> lines = new ArrayList<>();
        if (paragraph.isBlank()) {
            lines.add("");
            return lines;
        }
        StringBuilder current = new StringBuilder();
        for (String word : paragraph.trim().split("\\s+")) {
            String candidate = current.length() == 0 ? word : current + " " + word;
            if (regular.getStringWidth(candidate) / 1000 * BODY_SIZE <= maxWidth) {
                current.setLength(0);
                current.append(candidate);
                continue;
            }
            if (current.length() > 0) lines.add(current.toString());
            current.setLength(0);
            current.append(word);
        }
        if (current.length() > 0) lines.add(current.toString());
        return lines;
    }

    static String shortTitle(String title) {
        if (title == null || title.isBlank()) return "Research Paper";
        return title.length() > TITLE_LIMIT ? title.substring(0, TITLE_LIMIT) + "..." : title;
    }

    /**
     * Maps text onto what the standard Type 1 fonts can encode.
     */
    static String sanitize(String text) {
        if (text == null) return "";
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '‘', '’' -> sb.append('\'');
                case '“', '”' -> sb.append('"');
                case '–', '—' -> sb.append('-');
                case '…' -> sb.append("...");
                case '\t' -> sb.append("    ");
                case '\n' -> sb.append('\n');
                case '\r' -> { }
                default -> sb.append(c >= 0x20 && c <= 0x7E ? c : '?');
            }
        }
        return sb.toString();
    }
}
