package dev.cuadrada.agent.orchestrator;

import dev.cuadrada.config.ReviewProperties;
import dev.cuadrada.domain.entity.Submission;
import dev.cuadrada.service.SubmissionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Finalizes submissions that stayed incomplete past timeout + grace without an
 * in-flight run. Covers runs lost to a restart, where no coordinator is left to finish them.
 */
@Component
public class StaleSubmissionSweeper {
    private static final Logger log = LoggerFactory.getLogger(StaleSubmissionSweeper.class);

    private final SubmissionStore store;
    private final ReviewCoordinator coordinator;
    private final ReviewProperties reviewProperties;
    private final Clock clock;

    @Autowired
    public StaleSubmissionSweeper(SubmissionStore store, ReviewCoordinator coordinator,
                                  ReviewProperties reviewProperties) {
        this(store, coordinator, reviewProperties, Clock.systemUTC());
    }

    StaleSubmissionSweeper(SubmissionStore store, ReviewCoordinator coordinator,
                           ReviewProperties reviewProperties, Clock clock) {
        this.store = store;
        this.coordinator = coordinator;
        this.reviewProperties = reviewProperties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${cuadrada.review.sweep-interval:PT1M}",
            initialDelayString = "${cuadrada.review.sweep-interval:PT1M}")
    public void sweep() {
        Instant cutoff = clock.instant()
                .minus(reviewProperties.timeout())
                .minus(reviewProperties.sweepGrace());
        List<Submission> stale;
        try {
            stale = store.findIncompleteBefore(cutoff);
        } catch (RuntimeException e) {
            log.error("Stale submission sweep could not query the store", e);
            return;
        }
        int finalized = 0;
        for (Submission submission : stale) {
            String submissionId = submission.getSubmissionId();
            if (coordinator.inFlight(submissionId)) continue;
            try {
                if (coordinator.finalizeAbandoned(submissionId).isPresent()) finalized++;
            } catch (RuntimeException e) {
                log.error("Could not finalize stale submission {}", submissionId, e);
            }
        }
        if (finalized > 0) log.info("Stale sweep finalized {} of {} candidates", finalized, stale.size());
    }
}
