package dev.cuadrada.exception;

/** The submission is already complete with a different terminal state, or cannot be re-dispatched. */
public class AlreadyFinalizedException extends IllegalStateException {
    public AlreadyFinalizedException(String submissionId) {
        super("Submission already finalized: " + submissionId);
    }
}
