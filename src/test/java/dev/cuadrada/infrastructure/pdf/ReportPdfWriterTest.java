package dev.cuadrada.infrastructure.pdf;

import dev.cuadrada.config.AiProperties;
import dev.cuadrada.domain.valueobject.PaperDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Renders real PDFs with PDFBox and reads them back through the extractor.
 */
class ReportPdfWriterTest {

    @TempDir
    Path dir;

    private final ReportPdfWriter writer = new ReportPdfWriter();
    private final PdfTextExtractor extractor = new PdfTextExtractor(new AiProperties(null, 0, 0.2, 0));

    @Test
    @DisplayName("review report spans pages and carries reviewer, decision and text")
    void reviewReport() {
        Path out = dir.resolve("r.pdf");
        String body = ("The methodology is sound \u2014 the \u201cablation\u201d is thorough.\n\n").repeat(120);

        writer.writeReviewReport("Graph Coloring at Scale", "Reviewer 1", "ACCEPTED", body, out);

        PaperDocument read = extractor.extract(out, "x");
        assertThat(read.text()).contains("Reviewer: Reviewer 1", "Decision: ACCEPTED",
                "The methodology is sound - the \"ablation\" is thorough.");
    }

    @Test
    @DisplayName("certificate is a single landscape page with the submission id")
    void certificate() throws Exception {
        Path out = dir.resolve("c.pdf");

        writer.writeCertificate("Graph Coloring at Scale", "20240611_abcd1234", out);

        assertThat(Files.size(out)).isPositive();
        try (var doc = org.apache.pdfbox.Loader.loadPDF(out.toFile())) {
            assertThat(doc.getNumberOfPages()).isEqualTo(1);
            assertThat(doc.getPage(0).getMediaBox().getWidth())
                    .isGreaterThan(doc.getPage(0).getMediaBox().getHeight());
            assertThat(new org.apache.pdfbox.text.PDFTextStripper().getText(doc))
                    .contains("Certificate of Acceptance", "Certificate ID: 20240611_abcd1234");
        }
    }

    @Test
    @DisplayName("an almost empty PDF is refused by the extractor")
    void tooShort() {
        Path out = dir.resolve("short.pdf");
        writer.writeReviewReport("T", "R", "X", "", out);

        assertThatThrownBy(() -> extractor.extract(out, "T"))
                .isInstanceOf(DocumentExtractionException.class)
                .hasMessageContaining("insufficient text");
    }

    @Test
    @DisplayName("a file that is not a PDF is an extraction error")
    void notAPdf() throws Exception {
        Path out = dir.resolve("fake.pdf");
        Files.writeString(out, "hello");

        assertThatThrownBy(() -> extractor.extract(out, "T"))
                .isInstanceOf(DocumentExtractionException.class)
                .hasMessageStartingWith("PDF extraction error");
        assertThat(extractor.readTitle(out)).isEmpty();
    }

    @Test
    @DisplayName("long titles are shortened and text is reduced to the font's charset")
    void helpers() {
        assertThat(ReportPdfWriter.shortTitle("x".repeat(100))).hasSize(83).endsWith("...");
        assertThat(ReportPdfWriter.shortTitle(null)).isEqualTo("Research Paper");
        assertThat(ReportPdfWriter.sanitize("caf\u00e9 \u2026")).isEqualTo("caf? ...");
    }
}
