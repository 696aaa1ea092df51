package dev.cuadrada.controller;

import dev.cuadrada.domain.entity.ReviewResult;
import dev.cuadrada.domain.entity.Submission;
import dev.cuadrada.infrastructure.storage.FileStorage;
import dev.cuadrada.service.SubmissionQueryService;
import dev.cuadrada.service.SubmissionStore;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Serves generated artifacts from the results folder. Names that could escape
 * the folder resolve to 404 like any missing file.
 */
@RestController
public class DownloadController {
    private final FileStorage fileStorage;
    private final SubmissionStore store;
    private final SubmissionQueryService queryService;

    public DownloadController(FileStorage fileStorage, SubmissionStore store, SubmissionQueryService queryService) {
        this.fileStorage = fileStorage;
        this.store = store;
        this.queryService = queryService;
    }

    @GetMapping("/download/{filename}")
    public ResponseEntity<byte[]> download(@PathVariable String filename) {
        return fileStorage.findResult(filename)
                .map(path -> attachment(fileStorage.read(path), filename, mediaTypeOf(filename)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/download_certificate/{submissionId}")
    public ResponseEntity<byte[]> certificate(@PathVariable String submissionId) {
        Submission submission = store.get(submissionId);
        Optional<Path> certificate = Optional.ofNullable(submission.getCertificateFilename())
                .flatMap(fileStorage::findResult);
        if (certificate.isEmpty()) return ResponseEntity.notFound().build();
        String name = titleForFilename(submission.getPaperTitle()) + "_Certificate.pdf";
        return attachment(fileStorage.read(certificate.get()), name, MediaType.APPLICATION_PDF);
    }

    @GetMapping("/download_all/{submissionId}")
    public ResponseEntity<byte[]> all(@PathVariable String submissionId) {
        Submission submission = store.get(submissionId);
        List<String> artifacts = new ArrayList<>();
        if (submission.getCertificateFilename() != null) artifacts.add(submission.getCertificateFilename());
        for (ReviewResult result : queryService.findDecisions(submissionId)) {
            if (result.getFileUrl() != null) artifacts.add(result.getFileUrl());
        }
        String name = titleForFilename(submission.getPaperTitle()) + "_All_Reviews.zip";
        return attachment(fileStorage.zipResults(artifacts), name, MediaType.parseMediaType("application/zip"));
    }

    /** "Deep Nets: A Survey" → "Deep_Nets_A_Survey". */
    static String titleForFilename(String title) {
        if (title == null || title.isBlank()) return "Research_Paper";
        String cleaned = title.trim().replaceAll("[^A-Za-z0-9 _-]", "").trim().replaceAll("\\s+", "_");
        return cleaned.isEmpty() ? "Research_Paper" : cleaned;
    }

    private static MediaType mediaTypeOf(String filename) {
        return MediaTypeFactory.getMediaType(filename).orElse(MediaType.APPLICATION_OCTET_STREAM);
    }

    private static ResponseEntity<byte[]> attachment(byte[] body, String filename, MediaType type) {
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(filename, StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(type)
                .body(body);
    }
}
