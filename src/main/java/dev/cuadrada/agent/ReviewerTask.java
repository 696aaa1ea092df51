package dev.cuadrada.agent;

import dev.cuadrada.domain.entity.ReviewResult;
import dev.cuadrada.domain.enums.ErrorReason;
import dev.cuadrada.domain.valueobject.ParsedReview;
import dev.cuadrada.domain.valueobject.ReviewerConfig;
import dev.cuadrada.exception.DuplicateDecisionException;
import dev.cuadrada.infrastructure.ai.AiModelRouter;
import dev.cuadrada.infrastructure.ai.ReviewBackendException;
import dev.cuadrada.infrastructure.pdf.ReportPdfWriter;
import dev.cuadrada.infrastructure.storage.FileStorage;
import dev.cuadrada.service.SubmissionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Runs one reviewer against one submission and persists exactly one decision.
 *
 * <p>Flow: prompt → {@link AiModelRouter} → {@link DecisionParser} → report PDF → store.
 *
 * <p>Failure containment: backend and parse failures become an ERROR decision
 * with reason BACKEND or PARSE. Nothing is thrown to the caller, so one
 * reviewer can never abort its siblings or the coordinator. If the slot was
 * already filled (the coordinator recorded a timeout first) the stored row is
 * kept and returned. An empty result means the decision could not be persisted.
 */
@Component
public class ReviewerTask {

    private static final Logger log = LoggerFactory.getLogger(ReviewerTask.class);

    private final AiModelRouter modelRouter;
    private final DecisionParser decisionParser;
    private final SubmissionStore store;
    private final ReportPdfWriter reportWriter;
    private final FileStorage fileStorage;
    private final MeterRegistry meterRegistry;
    private final Timer reviewerTimer;

    public ReviewerTask(AiModelRouter modelRouter,
                        DecisionParser decisionParser,
                        SubmissionStore store,
                        ReportPdfWriter reportWriter,
                        FileStorage fileStorage,
                        MeterRegistry meterRegistry) {
        this.modelRouter = modelRouter;
        this.decisionParser = decisionParser;
        this.store = store;
        this.reportWriter = reportWriter;
        this.fileStorage = fileStorage;
        this.meterRegistry = meterRegistry;
        this.reviewerTimer = Timer.builder("cuadrada.reviewer.duration")
                .description("Time for one reviewer to produce a decision")
                .register(meterRegistry);
    }

    public Optional<ReviewResult> run(ReviewAssignment assignment) {
        String submissionId = assignment.submissionId();
        ReviewerConfig reviewer = assignment.reviewer();
        MDC.put("reviewer", reviewer.name());
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ReviewResult result = evaluate(assignment);
            Optional<ReviewResult> stored = persist(result);
            stored.ifPresent(r -> Counter.builder("cuadrada.reviewer.decisions")
                    .tag("decision", r.getDecision().name())
                    .register(meterRegistry)
                    .increment());
            return stored;
        } finally {
            sample.stop(reviewerTimer);
            MDC.remove("reviewer");
            log.debug("{} finished for submission {}", reviewer.name(), submissionId);
        }
    }

    private ReviewResult evaluate(ReviewAssignment assignment) {
        String submissionId = assignment.submissionId();
        ReviewerConfig reviewer = assignment.reviewer();
        log.info("{} reviewing submission {} ({} chars)", reviewer.name(), submissionId,
                assignment.paper().length());
        String modelUsed = null;
        try {
            AiModelRouter.AiResponse response = modelRouter.review(
                    ReviewPrompts.forReviewer(reviewer), assignment.paper().text());
            modelUsed = response.modelUsed();
            ParsedReview parsed = decisionParser.parse(response.content());
            String fileUrl = writeReport(assignment, parsed);
            log.info("{} decided {} for submission {} using {}", reviewer.name(),
                    parsed.decision(), submissionId, modelUsed);
            return ReviewResult.decided(submissionId, reviewer.name(), parsed.decision(),
                    parsed.summary(), parsed.fullReview(), modelUsed, fileUrl);
        } catch (ReviewBackendException e) {
            log.warn("{} backend failure for submission {}: {}", reviewer.name(), submissionId, e.getMessage());
            return ReviewResult.error(submissionId, reviewer.name(), ErrorReason.BACKEND, e.getMessage());
        } catch (ReviewParseException e) {
            log.warn("{} answer from {} not classifiable for submission {}: {}", reviewer.name(),
                    modelUsed, submissionId, e.getMessage());
            return ReviewResult.error(submissionId, reviewer.name(), ErrorReason.PARSE, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("{} failed unexpectedly for submission {}", reviewer.name(), submissionId, e);
            return ReviewResult.error(submissionId, reviewer.name(), ErrorReason.BACKEND,
                    "Reviewer failed: " + e.getMessage());
        }
    }

    /**
     * Renders the per-reviewer report. A rendering failure only loses the artifact.
     */
    private String writeReport(ReviewAssignment assignment, ParsedReview parsed) {
        String filename = "%s_%s_review.pdf".formatted(assignment.submissionId(), assignment.reviewer().slug());
        try {
            reportWriter.writeReviewReport(assignment.paper().title(), assignment.reviewer().name(),
                    parsed.decision().name(), parsed.fullReview(), fileStorage.resultPath(filename));
            return filename;
        } catch (RuntimeException e) {
            log.warn("Report for {} on submission {} not written: {}", assignment.reviewer().name(),
                    assignment.submissionId(), e.getMessage());
            return null;
        }
    }

    private Optional<ReviewResult> persist(ReviewResult result) {
        try {
            try {
                return Optional.of(store.recordDecision(result));
            } catch (DuplicateDecisionException e) {
                log.info("{} slot for submission {} already filled, keeping stored decision",
                        result.getReviewerName(), result.getSubmissionId());
                return store.findDecision(result.getSubmissionId(), result.getReviewerName());
            }
        } catch (RuntimeException e) {
            log.error("Could not persist decision of {} for submission {}",
                    result.getReviewerName(), result.getSubmissionId(), e);
            return Optional.empty();
        }
    }
}
