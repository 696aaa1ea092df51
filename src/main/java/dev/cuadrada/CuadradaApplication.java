package dev.cuadrada;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cuadrada: AI peer-review submission service.
 *
 * <p>Architecture overview:
 * <pre>
 * Upload → SubmissionController → SubmissionService (store file + row)
 *   → ReviewCoordinator → [Reviewer 1, Reviewer 2, ...] (parallel)
 *   → OutcomeAggregator → certificate → SubmissionStore.markComplete
 * Client polls /api/status/{id} until processing_complete.
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Async-first: uploads return 202 immediately, reviews run on bounded executors</li>
 *   <li>Independent reviewers: each one writes its own decision row, failures stay local</li>
 *   <li>Single finalize: completion is a compare-and-set on processing_complete</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class CuadradaApplication {

    public static void main(String[] args) {
        SpringApplication.run(CuadradaApplication.class, args);
    }
}
