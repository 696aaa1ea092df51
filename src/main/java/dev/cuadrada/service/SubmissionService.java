package dev.cuadrada.service;

import dev.cuadrada.agent.orchestrator.ReviewCoordinator;
import dev.cuadrada.config.ReviewProperties;
import dev.cuadrada.domain.entity.ReviewResult;
import dev.cuadrada.domain.entity.Submission;
import dev.cuadrada.domain.valueobject.ReviewerConfig;
import dev.cuadrada.exception.AlreadyDispatchedException;
import dev.cuadrada.exception.InvalidUploadException;
import dev.cuadrada.infrastructure.pdf.PdfTextExtractor;
import dev.cuadrada.infrastructure.storage.FileStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Command-side service: accepts uploads and retries and hands them to the coordinator.
 *
 * <p>An upload is all-or-nothing. If anything fails after the file is stored,
 * the submission row and the file are removed before the error propagates.
 */
@Service
public class SubmissionService {
    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);
    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final SubmissionStore store;
    private final ReviewCoordinator coordinator;
    private final FileStorage fileStorage;
    private final PdfTextExtractor textExtractor;
    private final ReviewProperties reviewProperties;

    public SubmissionService(SubmissionStore store, ReviewCoordinator coordinator, FileStorage fileStorage,
                             PdfTextExtractor textExtractor, ReviewProperties reviewProperties) {
        this.store = store;
        this.coordinator = coordinator;
        this.fileStorage = fileStorage;
        this.textExtractor = textExtractor;
        this.reviewProperties = reviewProperties;
    }

    /**
     * Stores the paper, creates its submission and dispatches it to the configured reviewers.
     *
     * @return the new submission id
     */
    public String submit(String originalFilename, byte[] content, String userTitle) {
        if (content == null || content.length == 0)
            throw new InvalidUploadException("No file uploaded");
        if (originalFilename == null || originalFilename.isBlank())
            throw new InvalidUploadException("No file selected");
        if (!originalFilename.toLowerCase(Locale.ROOT).endsWith(".pdf"))
            throw new InvalidUploadException("Invalid file type. Only PDF files are allowed.");

        String submissionId = generateSubmissionId();
        Path stored = fileStorage.storeUpload(submissionId, originalFilename, content);
        boolean created = false;
        try {
            String title = resolveTitle(userTitle, stored, originalFilename);
            store.create(submissionId, title, originalFilename, stored.toString());
            created = true;
            coordinator.dispatch(submissionId, reviewProperties.reviewers());
            log.info("Submission {} queued: '{}' ({} bytes)", submissionId, title, content.length);
            return submissionId;
        } catch (RuntimeException e) {
            log.error("Submission {} rolled back", submissionId, e);
            rollback(submissionId, stored, created);
            throw e;
        }
    }

    /**
     * Re-runs ERROR slots of a completed submission: one named reviewer, or every
     * ERROR slot when no name is given. Other decisions are kept.
     *
     * @return names of the reviewers dispatched again
     */
    public List<String> retry(String submissionId, Optional<String> reviewerName) {
        Submission submission = store.get(submissionId);
        if (coordinator.inFlight(submissionId) || !submission.isProcessingComplete())
            throw new AlreadyDispatchedException(submissionId);

        List<ReviewResult> decisions = store.decisionsFor(submissionId);
        List<String> targets;
        if (reviewerName.isPresent()) {
            String name = reviewerName.get().trim();
            ReviewResult slot = decisions.stream()
                    .filter(d -> d.getReviewerName().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException(
                            "No review by %s for submission %s".formatted(name, submissionId)));
            if (!slot.isError())
                throw new IllegalStateException("Review by %s is not in error state".formatted(name));
            targets = List.of(name);
        } else {
            targets = decisions.stream().filter(ReviewResult::isError).map(ReviewResult::getReviewerName).toList();
            if (targets.isEmpty())
                throw new IllegalStateException("Submission has no failed reviews: " + submissionId);
        }

        Map<String, ReviewerConfig> configured = reviewProperties.reviewers().stream()
                .collect(Collectors.toMap(ReviewerConfig::name, Function.identity()));
        List<ReviewerConfig> reviewers = targets.stream()
                .map(name -> configured.getOrDefault(name, ReviewerConfig.named(name)))
                .toList();

        store.reopenForRetry(submissionId, targets);
        coordinator.dispatch(submissionId, reviewers);
        log.info("Submission {} retrying {}", submissionId, targets);
        return targets;
    }

    /** e.g. {@code 20240611_3f2a9c1b}: UTC date plus a random suffix. */
    public static String generateSubmissionId() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return LocalDate.now(ZoneOffset.UTC).format(ID_DATE) + "_" + suffix;
    }

    private String resolveTitle(String userTitle, Path stored, String originalFilename) {
        if (userTitle != null && !userTitle.isBlank()) return userTitle.trim();
        return textExtractor.readTitle(stored).orElseGet(() -> stripExtension(originalFilename));
    }

    static String stripExtension(String filename) {
        String base = filename.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        return base.toLowerCase(Locale.ROOT).endsWith(".pdf") ? base.substring(0, base.length() - 4) : base;
    }

    private void rollback(String submissionId, Path stored, boolean created) {
        if (created) {
            try {
                store.delete(submissionId);
            } catch (RuntimeException e) {
                log.error("Could not delete submission {} during rollback", submissionId, e);
            }
        }
        fileStorage.deleteUpload(stored);
    }
}
