package dev.cuadrada.exception;

/** A decision for this (submission, reviewer) pair was already written. */
public class DuplicateDecisionException extends IllegalStateException {
    private final String submissionId;
    private final String reviewerName;

    public DuplicateDecisionException(String submissionId, String reviewerName) {
        super("Decision already recorded for %s / %s".formatted(submissionId, reviewerName));
        this.submissionId = submissionId;
        this.reviewerName = reviewerName;
    }

    public String getSubmissionId() {
        return submissionId;
    }

    public String getReviewerName() {
        return reviewerName;
    }
}
