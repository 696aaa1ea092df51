package dev.cuadrada.domain.entity;

import dev.cuadrada.domain.enums.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionTest {

    private static Submission fresh() {
        return Submission.create("20240611_12345678", "Graph Coloring", "paper.pdf", "/u/paper.pdf");
    }

    @Test
    @DisplayName("markCompleted stores the terminal state once")
    void markCompleted() {
        Submission submission = fresh();

        submission.markCompleted(Outcome.ACCEPTED, "20240611_12345678_certificate.pdf", null);

        assertThat(submission.isProcessingComplete()).isTrue();
        assertThat(submission.isAllAccepted()).isTrue();
        assertThat(submission.getCompletedAt()).isNotNull();
        assertThat(submission.hasTerminalState(Outcome.ACCEPTED, "20240611_12345678_certificate.pdf", null)).isTrue();
        assertThat(submission.hasTerminalState(Outcome.ERROR, null, null)).isFalse();
        assertThatThrownBy(() -> submission.markCompleted(Outcome.ERROR, null, "late"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("reopen clears the terminal state of a completed submission only")
    void reopen() {
        Submission submission = fresh();
        assertThatThrownBy(submission::reopen).isInstanceOf(IllegalStateException.class);

        submission.markCompleted(Outcome.ERROR, null, "Reviewer 2 timed out");
        submission.reopen();

        assertThat(submission.isProcessingComplete()).isFalse();
        assertThat(submission.getOutcome()).isNull();
        assertThat(submission.getError()).isNull();
        assertThat(submission.getCompletedAt()).isNull();
    }
}
