package dev.cuadrada.config;

import dev.cuadrada.domain.valueobject.ReviewerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Review pipeline config. timeout is measured from dispatch for the whole submission;
 * the sweep finalizes submissions older than timeout + sweepGrace that have no running reviewers.
 */
@ConfigurationProperties(prefix = "cuadrada.review")
public record ReviewProperties(List<ReviewerConfig> reviewers, Duration timeout,
                               Duration sweepInterval, Duration sweepGrace,
                               int reviewerThreads, int coordinatorThreads) {
    public ReviewProperties {
        if (reviewers == null || reviewers.isEmpty()) {
            reviewers = List.of(ReviewerConfig.named("Reviewer 1"),
                    ReviewerConfig.named("Reviewer 2"),
                    ReviewerConfig.named("Reviewer 3"));
        }
        Set<String> names = new HashSet<>();
        for (ReviewerConfig reviewer : reviewers) {
            if (!names.add(reviewer.name()))
                throw new IllegalArgumentException("Duplicate reviewer name: " + reviewer.name());
        }
        reviewers = List.copyOf(reviewers);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = Duration.ofMinutes(10);
        if (sweepInterval == null) sweepInterval = Duration.ofMinutes(1);
        if (sweepGrace == null) sweepGrace = Duration.ofMinutes(2);
        if (reviewerThreads <= 0) reviewerThreads = 8;
        if (coordinatorThreads <= 0) coordinatorThreads = 2;
    }

    public static ReviewProperties defaults() {
        return new ReviewProperties(null, null, null, null, 0, 0);
    }
}
