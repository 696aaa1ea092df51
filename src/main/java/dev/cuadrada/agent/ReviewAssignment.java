package dev.cuadrada.agent;

import dev.cuadrada.domain.valueobject.PaperDocument;
import dev.cuadrada.domain.valueobject.ReviewerConfig;

/**
 * Everything one reviewer task needs. Detached from JPA state so it can cross threads.
 */
public record ReviewAssignment(String submissionId, ReviewerConfig reviewer, PaperDocument paper) {
    public ReviewAssignment {
        if (submissionId == null) throw new IllegalArgumentException("submissionId required");
        if (reviewer == null) throw new IllegalArgumentException("reviewer required");
        if (paper == null) throw new IllegalArgumentException("paper required");
    }
}
