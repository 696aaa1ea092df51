package dev.cuadrada.integration;

import dev.cuadrada.infrastructure.ai.AiModelRouter;
import dev.cuadrada.infrastructure.ai.ReviewBackendException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.when;

/**
 * Upload → fan-out → finalize → status → retry, end to end over HTTP and PostgreSQL.
 */
class SubmissionFlowIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private TestRestTemplate rest;

    @MockitoBean
    private AiModelRouter modelRouter;

    @Test
    @DisplayName("three accepting reviewers produce an accepted submission with a certificate")
    void acceptedFlow() throws Exception {
        when(modelRouter.review(anyString(), anyString())).thenReturn(
                new AiModelRouter.AiResponse("Clear and rigorous.\n\nFINAL DECISION: **ACCEPTED**",
                        "claude-test", Duration.ofMillis(10)));

        String id = upload("Scheduling Theory");
        Map<String, Object> status = awaitComplete(id);

        assertThat(status.get("outcome")).isEqualTo("ACCEPTED");
        assertThat(status.get("all_accepted")).isEqualTo(true);
        assertThat((List<?>) status.get("results")).hasSize(3);
        assertThat(status.get("certificate_filename")).isEqualTo(id + "_certificate.pdf");

        ResponseEntity<byte[]> certificate = rest.getForEntity("/download_certificate/" + id, byte[].class);
        assertThat(certificate.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(certificate.getHeaders().getContentDisposition().getFilename())
                .isEqualTo("Scheduling_Theory_Certificate.pdf");
    }

    @Test
    @DisplayName("a failed reviewer can be retried alone and the outcome is recomputed")
    void retryFlow() throws Exception {
        when(modelRouter.review(contains("Reviewer 2"), anyString()))
                .thenThrow(new ReviewBackendException("AI service error after trying 4 models: 529", null))
                .thenReturn(new AiModelRouter.AiResponse("FINAL DECISION: **ACCEPTED**", "claude-test",
                        Duration.ofMillis(10)));
        when(modelRouter.review(contains("Reviewer 1"), anyString())).thenReturn(
                new AiModelRouter.AiResponse("FINAL DECISION: **ACCEPTED**", "claude-test", Duration.ofMillis(10)));
        when(modelRouter.review(contains("Reviewer 3"), anyString())).thenReturn(
                new AiModelRouter.AiResponse("FINAL DECISION: **ACCEPTED**", "claude-test", Duration.ofMillis(10)));

        String id = upload("Retry Paper");
        assertThat(awaitComplete(id).get("outcome")).isEqualTo("ERROR");

        ResponseEntity<Map> retry = rest.postForEntity("/retry_review/" + id + "/Reviewer 2", null, Map.class);
        assertThat(retry.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);

        Map<String, Object> status = awaitComplete(id);
        assertThat(status.get("outcome")).isEqualTo("ACCEPTED");
        assertThat((List<?>) status.get("results")).hasSize(3);
    }

    @Test
    @DisplayName("unknown submission status is 404 not_found")
    void unknownStatus() {
        ResponseEntity<Map> response = rest.getForEntity("/api/status/nope", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).containsEntry("status", "not_found");
    }

    private String upload(String title) throws IOException {
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("paper", new ByteArrayResource(samplePdf()) {
            @Override
            public String getFilename() {
                return "paper.pdf";
            }
        });
        form.add("paper_title", title);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        ResponseEntity<Map> response = rest.postForEntity("/upload", new HttpEntity<>(form, headers), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        return (String) response.getBody().get("submissionId");
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> awaitComplete(String id) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 15_000;
        while (System.currentTimeMillis() < deadline) {
            Map<String, Object> status = rest.getForObject("/api/status/" + id, Map.class);
            if ("complete".equals(status.get("status"))) return status;
            Thread.sleep(200);
        }
        throw new AssertionError("Submission " + id + " did not complete");
    }

    private static byte[] samplePdf() throws IOException {
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            doc.addPage(page);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.beginText();
                cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 11);
                cs.newLineAtOffset(50, 700);
                cs.setLeading(14);
                for (int i = 0; i < 10; i++) {
                    cs.showText("We study list scheduling on identical machines and prove a tight bound.");
                    cs.newLine();
                }
                cs.endText();
            }
            doc.save(out);
            return out.toByteArray();
        }
    }
}
