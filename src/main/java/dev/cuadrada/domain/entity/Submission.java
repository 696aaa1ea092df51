package dev.cuadrada.domain.entity;

import dev.cuadrada.domain.enums.Outcome;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;

/**
 * Lifecycle record of one uploaded paper.
 *
 * <p>The external submissionId is independent of the surrogate key. The
 * store persists completion with a compare-and-set UPDATE; {@link #markCompleted}
 * and {@link #reopen} apply the same transitions to a loaded instance.
 */
@Entity
@Table(name = "submissions", indexes = {
        @Index(name = "idx_submissions_created", columnList = "created_at")
})
public class Submission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "submission_id", unique = true, nullable = false, updatable = false)
    private String submissionId;

    @Column(name = "paper_title")
    private String paperTitle;

    @Column(name = "filename")
    private String filename;

    @Column(name = "file_path", nullable = false)
    private String filePath;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processing_complete", nullable = false)
    private boolean processingComplete;

    @Column(name = "all_accepted", nullable = false)
    private boolean allAccepted;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", length = 20)
    private Outcome outcome;

    @Column(name = "error")
    private String error;

    @Column(name = "certificate_filename")
    private String certificateFilename;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected Submission() {
    }

    public static Submission create(String submissionId, String paperTitle,
                                    String filename, String filePath) {
        if (submissionId == null || submissionId.isBlank())
            throw new IllegalArgumentException("submissionId required");
        if (filePath == null || filePath.isBlank())
            throw new IllegalArgumentException("filePath required");
        Submission s = new Submission();
        s.submissionId = submissionId;
        s.paperTitle = paperTitle;
        s.filename = filename;
        s.filePath = filePath;
        s.createdAt = Instant.now();
        s.processingComplete = false;
        s.allAccepted = false;
        return s;
    }

    public void markCompleted(Outcome outcome, String certificateFilename, String error) {
        if (processingComplete)
            throw new IllegalStateException("Submission " + submissionId + " is already complete");
        this.processingComplete = true;
        this.outcome = outcome;
        this.allAccepted = outcome.isAccepted();
        this.certificateFilename = certificateFilename;
        this.error = error;
        this.completedAt = Instant.now();
    }

    public void reopen() {
        if (!processingComplete)
            throw new IllegalStateException("Submission " + submissionId + " is still processing");
        this.processingComplete = false;
        this.outcome = null;
        this.allAccepted = false;
        this.certificateFilename = null;
        this.error = null;
        this.completedAt = null;
    }

    /**
     * True when this (completed) submission already holds exactly the given terminal state.
     */
    public boolean hasTerminalState(Outcome outcome, String certificateFilename, String error) {
        return processingComplete
                && this.outcome == outcome
                && this.allAccepted == outcome.isAccepted()
                && Objects.equals(this.certificateFilename, certificateFilename)
                && Objects.equals(this.error, error);
    }

    public Long getId() {
        return id;
    }

    public String getSubmissionId() {
        return submissionId;
    }

    public String getPaperTitle() {
        return paperTitle;
    }

    public String getFilename() {
        return filename;
    }

    public String getFilePath() {
        return filePath;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isProcessingComplete() {
        return processingComplete;
    }

    public boolean isAllAccepted() {
        return allAccepted;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getError() {
        return error;
    }

    public String getCertificateFilename() {
        return certificateFilename;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
