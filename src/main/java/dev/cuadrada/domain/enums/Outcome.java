package dev.cuadrada.domain.enums;

/**
 * Aggregate classification over all decisions of a submission.
 *
 * Precedence: ERROR > REJECTED > REVISION > ACCEPTED. PENDING = no decisions yet.
 */
public enum Outcome {
    PENDING, ACCEPTED, REVISION, REJECTED, ERROR;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
