package dev.cuadrada.domain.entity;

import dev.cuadrada.domain.enums.Decision;
import dev.cuadrada.domain.enums.ErrorReason;
import jakarta.persistence.*;
import java.time.Instant;

/**
 * One reviewer's decision for one submission. Written once by its reviewer task
 * (or by the coordinator on timeout); the (submission_id, reviewer_name) pair is unique.
 */
@Entity
@Table(name = "review_results",
        uniqueConstraints = @UniqueConstraint(name = "uq_review_results_submission_reviewer",
                columnNames = {"submission_id", "reviewer_name"}),
        indexes = @Index(name = "idx_review_results_submission_id", columnList = "submission_id"))
public class ReviewResult {

    private static final int SUMMARY_LIMIT = 300;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "submission_id", nullable = false, updatable = false)
    private String submissionId;

    @Column(name = "reviewer_name", nullable = false, updatable = false)
    private String reviewerName;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision", nullable = false, length = 20, updatable = false)
    private Decision decision;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_reason", length = 20, updatable = false)
    private ErrorReason errorReason;

    @Column(name = "summary", updatable = false)
    private String summary;

    @Column(name = "full_review", updatable = false)
    private String fullReview;

    @Column(name = "model_used", updatable = false)
    private String modelUsed;

    @Column(name = "file_url", updatable = false)
    private String fileUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ReviewResult() {
    }

    public static ReviewResult decided(String submissionId, String reviewerName, Decision decision,
                                       String summary, String fullReview, String modelUsed, String fileUrl) {
        if (decision == null || decision == Decision.ERROR)
            throw new IllegalArgumentException("Use ReviewResult.error for failed reviewers");
        ReviewResult r = base(submissionId, reviewerName);
        r.decision = decision;
        r.summary = summary;
        r.fullReview = fullReview;
        r.modelUsed = modelUsed;
        r.fileUrl = fileUrl;
        return r;
    }

    public static ReviewResult error(String submissionId, String reviewerName,
                                     ErrorReason reason, String message) {
        if (reason == null) throw new IllegalArgumentException("reason required");
        ReviewResult r = base(submissionId, reviewerName);
        r.decision = Decision.ERROR;
        r.errorReason = reason;
        r.summary = truncate(message);
        r.fullReview = message;
        return r;
    }

    private static ReviewResult base(String submissionId, String reviewerName) {
        if (submissionId == null || submissionId.isBlank())
            throw new IllegalArgumentException("submissionId required");
        if (reviewerName == null || reviewerName.isBlank())
            throw new IllegalArgumentException("reviewerName required");
        ReviewResult r = new ReviewResult();
        r.submissionId = submissionId;
        r.reviewerName = reviewerName;
        r.createdAt = Instant.now();
        return r;
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= SUMMARY_LIMIT) return text;
        return text.substring(0, SUMMARY_LIMIT) + "...";
    }

    public boolean isError() {
        return decision == Decision.ERROR;
    }

    public Long getId() {
        return id;
    }

    public String getSubmissionId() {
        return submissionId;
    }

    public String getReviewerName() {
        return reviewerName;
    }

    public Decision getDecision() {
        return decision;
    }

    public ErrorReason getErrorReason() {
        return errorReason;
    }

    public String getSummary() {
        return summary;
    }

    public String getFullReview() {
        return fullReview;
    }

    public String getModelUsed() {
        return modelUsed;
    }

    public String getFileUrl() {
        return fileUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
