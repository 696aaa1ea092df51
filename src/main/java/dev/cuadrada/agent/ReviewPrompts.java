package dev.cuadrada.agent;

import dev.cuadrada.domain.valueobject.ReviewerConfig;

/**
 * Shared prompt construction for reviewer tasks.
 */
public final class ReviewPrompts {

    static final String REVIEW_PROMPT = """
            You are an academic reviewer evaluating a research paper. Write the review in third person,
            starting with "The reviewer has evaluated this paper based on the given criteria and arrived
            at the following conclusions:"

            Score each criterion from 0-100%:
            1. Methodology (20% of total): research methodology, experimental design and validation
            2. Novelty (20% of total): innovation and original contribution to the field
            3. Technical Depth (15% of total): technical accuracy, depth of analysis and rigor
            4. Clarity (15% of total): writing quality, organization and presentation
            5. Literature Review (15% of total): coverage and understanding of related work
            6. Impact (15% of total): potential influence on the field and practical applications

            For each criterion, begin with strengths before issues, give constructive suggestions
            and assign a percentage score. Compute the weighted final score from the criteria weights.

            Recommendation thresholds:
            - Accept (>60%): good paper that contributes to the field
            - Accept with Minor Revision (50-60%): promising work needing minor improvements
            - Accept with Major Revision (40-50%): valuable contribution requiring significant changes
            - Reject (<40%): does not meet basic publication standards

            Conclude with the final weighted score, a summary of major strengths and then minor
            weaknesses, constructive suggestions, and end with exactly one of these lines:
            FINAL DECISION: **ACCEPTED**
            FINAL DECISION: **ACCEPTED WITH MINOR REVISION REQUIRED**
            FINAL DECISION: **ACCEPTED WITH MAJOR REVISION REQUIRED**
            FINAL DECISION: **REJECTED**

            Keep the third-person perspective throughout the review.""";

    private ReviewPrompts() {}

    /**
     * Builds the system prompt for one reviewer: base instructions + optional reviewer focus.
     */
    public static String forReviewer(ReviewerConfig reviewer) {
        return withFocus(REVIEW_PROMPT, reviewer.name(), reviewer.focus());
    }

    static String withFocus(String basePrompt, String reviewerName, String focus) {
        var sb = new StringBuilder(basePrompt);
        if (focus != null && !focus.isBlank()) {
            sb.append("\n\n--- REVIEWER FOCUS (").append(reviewerName).append(") ---\n")
              .append(focus.trim())
              .append("\n--- END REVIEWER FOCUS ---");
        }
        return sb.toString();
    }
}
