package dev.cuadrada.domain.enums;

/**
 * Why a reviewer slot ended as {@link Decision#ERROR}.
 */
public enum ErrorReason {
    /** Backend call failed on every model of the fallback chain. */
    BACKEND,
    /** Backend answered but the answer carried no classifiable verdict. */
    PARSE,
    /** Submission-level timeout elapsed before the reviewer finished. */
    TIMEOUT,
    /** The paper could not be read, so the reviewer never ran. */
    EXTRACTION
}
