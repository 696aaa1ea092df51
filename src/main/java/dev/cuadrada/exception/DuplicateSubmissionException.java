package dev.cuadrada.exception;

/** A submission with the same external identifier already exists. */
public class DuplicateSubmissionException extends IllegalStateException {
    public DuplicateSubmissionException(String submissionId) {
        super("Submission already exists: " + submissionId);
    }
}
