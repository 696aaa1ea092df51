package dev.cuadrada.agent.orchestrator;

import dev.cuadrada.config.ReviewProperties;
import dev.cuadrada.domain.entity.Submission;
import dev.cuadrada.domain.enums.Outcome;
import dev.cuadrada.service.SubmissionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StaleSubmissionSweeperTest {

    private static final Instant NOW = Instant.parse("2024-06-11T12:00:00Z");

    private SubmissionStore store;
    private ReviewCoordinator coordinator;
    private StaleSubmissionSweeper sweeper;

    @BeforeEach
    void setUp() {
        store = mock(SubmissionStore.class);
        coordinator = mock(ReviewCoordinator.class);
        ReviewProperties properties = new ReviewProperties(null, Duration.ofMinutes(10), null,
                Duration.ofMinutes(2), 0, 0);
        sweeper = new StaleSubmissionSweeper(store, coordinator, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("looks back timeout + grace and finalizes idle submissions")
    void finalizesIdle() {
        when(store.findIncompleteBefore(NOW.minus(Duration.ofMinutes(12))))
                .thenReturn(List.of(submission("a"), submission("b")));
        when(coordinator.inFlight("b")).thenReturn(true);
        when(coordinator.finalizeAbandoned("a")).thenReturn(Optional.of(Outcome.ERROR));

        sweeper.sweep();

        verify(coordinator).finalizeAbandoned("a");
        verify(coordinator, never()).finalizeAbandoned("b");
    }

    @Test
    @DisplayName("one failing submission does not stop the sweep")
    void continuesAfterFailure() {
        when(store.findIncompleteBefore(any())).thenReturn(List.of(submission("a"), submission("b")));
        when(coordinator.finalizeAbandoned("a")).thenThrow(new DataAccessResourceFailureException("down"));

        sweeper.sweep();

        verify(coordinator).finalizeAbandoned("b");
    }

    @Test
    @DisplayName("an unavailable store skips the round")
    void storeDown() {
        when(store.findIncompleteBefore(any())).thenThrow(new DataAccessResourceFailureException("down"));

        sweeper.sweep();

        verify(coordinator, never()).finalizeAbandoned(any());
    }

    private static Submission submission(String id) {
        return Submission.create(id, "T", "p.pdf", "/p");
    }
}
