package dev.cuadrada.controller;

import dev.cuadrada.dto.response.RetryResponse;
import dev.cuadrada.dto.response.SubmissionStatusResponse;
import dev.cuadrada.dto.response.UploadResponse;
import dev.cuadrada.exception.InvalidUploadException;
import dev.cuadrada.exception.StorageException;
import dev.cuadrada.service.SubmissionQueryService;
import dev.cuadrada.service.SubmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Upload, status and retry endpoints. Uploads return 202 as soon as the
 * submission is stored and dispatched; reviews run in the background.
 */
@RestController
public class SubmissionController {
    private static final Logger log = LoggerFactory.getLogger(SubmissionController.class);
    private final SubmissionService submissionService;
    private final SubmissionQueryService queryService;

    public SubmissionController(SubmissionService submissionService, SubmissionQueryService queryService) {
        this.submissionService = submissionService;
        this.queryService = queryService;
    }

    @PostMapping(path = "/upload", consumes = "multipart/form-data")
    public ResponseEntity<UploadResponse> upload(
            @RequestPart("paper") MultipartFile paper,
            @RequestParam(value = "paper_title", required = false) String paperTitle) {
        if (paper.isEmpty()) throw new InvalidUploadException("No file uploaded");
        byte[] content;
        try {
            content = paper.getBytes();
        } catch (IOException e) {
            throw new StorageException("Could not read upload", e);
        }
        String submissionId = submissionService.submit(paper.getOriginalFilename(), content, paperTitle);
        log.info("Upload accepted: submission={}, file={}", submissionId, paper.getOriginalFilename());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(UploadResponse.queued(submissionId));
    }

    @GetMapping("/api/status/{submissionId}")
    public ResponseEntity<?> status(@PathVariable String submissionId) {
        Optional<SubmissionStatusResponse> status = queryService.findStatus(submissionId);
        if (status.isPresent()) return ResponseEntity.ok(status.get());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("status", "not_found", "message", "Review not found."));
    }

    @PostMapping("/retry_review/{submissionId}/{reviewerName}")
    public ResponseEntity<RetryResponse> retryReviewer(@PathVariable String submissionId,
                                                       @PathVariable String reviewerName) {
        List<String> retried = submissionService.retry(submissionId, Optional.of(reviewerName));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new RetryResponse(true, submissionId, retried));
    }

    @PostMapping("/retry_review/{submissionId}")
    public ResponseEntity<RetryResponse> retryFailed(@PathVariable String submissionId) {
        List<String> retried = submissionService.retry(submissionId, Optional.empty());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new RetryResponse(true, submissionId, retried));
    }
}
