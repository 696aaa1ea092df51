package dev.cuadrada.domain.valueobject;

import java.util.Locale;

/**
 * One configured reviewer: a display name (unique per submission) and an optional
 * focus appended to the shared review prompt.
 */
public record ReviewerConfig(String name, String focus) {
    public ReviewerConfig {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("reviewer name required");
        name = name.trim();
        if (focus != null && focus.isBlank()) focus = null;
    }

    public static ReviewerConfig named(String name) {
        return new ReviewerConfig(name, null);
    }

    /** Filesystem-safe form of the name, e.g. "Reviewer 1" → "reviewer_1". */
    public String slug() {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_|_$", "");
    }
}
