package dev.cuadrada.domain.valueobject;

import dev.cuadrada.domain.enums.Decision;

/**
 * A backend answer classified into one verdict plus its display summary.
 */
public record ParsedReview(Decision decision, String summary, String fullReview) {
    public ParsedReview {
        if (decision == null || decision == Decision.ERROR)
            throw new IllegalArgumentException("parsed review needs a verdict, got " + decision);
    }
}
