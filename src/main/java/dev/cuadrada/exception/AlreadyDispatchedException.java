package dev.cuadrada.exception;

/** Reviewers for this submission are still running. */
public class AlreadyDispatchedException extends IllegalStateException {
    public AlreadyDispatchedException(String submissionId) {
        super("Submission is still being processed: " + submissionId);
    }
}
