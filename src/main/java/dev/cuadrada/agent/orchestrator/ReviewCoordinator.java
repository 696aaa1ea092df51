package dev.cuadrada.agent.orchestrator;

import dev.cuadrada.agent.ReviewAssignment;
import dev.cuadrada.agent.ReviewerTask;
import dev.cuadrada.config.ReviewProperties;
import dev.cuadrada.domain.entity.ReviewResult;
import dev.cuadrada.domain.entity.Submission;
import dev.cuadrada.domain.enums.ErrorReason;
import dev.cuadrada.domain.enums.Outcome;
import dev.cuadrada.domain.valueobject.PaperDocument;
import dev.cuadrada.domain.valueobject.ReviewerConfig;
import dev.cuadrada.exception.AlreadyDispatchedException;
import dev.cuadrada.exception.AlreadyFinalizedException;
import dev.cuadrada.exception.DuplicateDecisionException;
import dev.cuadrada.infrastructure.pdf.DocumentExtractionException;
import dev.cuadrada.infrastructure.pdf.PdfTextExtractor;
import dev.cuadrada.infrastructure.pdf.ReportPdfWriter;
import dev.cuadrada.infrastructure.storage.FileStorage;
import dev.cuadrada.service.SubmissionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Fans one submission out to its reviewers and finalizes it exactly once.
 *
 * <pre>
 *  1. dispatch: validate, register the run, return immediately
 *  2. extract the paper text once (reviewer pool)
 *  3. launch one {@link ReviewerTask} per reviewer (reviewer pool)
 *  4. wait for all of them or the submission timeout, whichever comes first
 *  5. finalize (coordinator pool): fill silent slots with ERROR, cancel
 *     leftovers, aggregate, render the certificate, markComplete
 * </pre>
 *
 * <p>Design decisions:
 * <ul>
 *   <li><b>Non-blocking wait</b>: the timeout is an {@code orTimeout} on the
 *       combined future, so no thread sits waiting on slow reviewers.</li>
 *   <li><b>Store is the source of truth</b>: finalize aggregates over the
 *       persisted decisions, not over in-memory results. A reviewer that lands
 *       its write just before the timeout bookkeeping keeps its decision.</li>
 *   <li><b>Arena of runs</b>: at most one in-flight run per submission. The
 *       entry is removed before the run's future completes, so a caller that
 *       awaited completion can immediately retry.</li>
 *   <li><b>Stragglers</b>: reviewers still running at finalize are interrupted.
 *       Until they have actually exited the submission counts as in flight, so a
 *       retry cannot reopen a slot that an old run would then fill.</li>
 * </ul>
 */
@Component
public class ReviewCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ReviewCoordinator.class);

    private final SubmissionStore store;
    private final ReviewerTask reviewerTask;
    private final PdfTextExtractor textExtractor;
    private final ReportPdfWriter reportWriter;
    private final FileStorage fileStorage;
    private final ReviewProperties reviewProperties;
    private final ExecutorService reviewerExecutor;
    private final ExecutorService coordinatorExecutor;
    private final MeterRegistry meterRegistry;
    private final Timer reviewTimer;

    private final Map<String, ReviewRun> arena = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> stragglers = new ConcurrentHashMap<>();

    public ReviewCoordinator(SubmissionStore store,
                             ReviewerTask reviewerTask,
                             PdfTextExtractor textExtractor,
                             ReportPdfWriter reportWriter,
                             FileStorage fileStorage,
                             ReviewProperties reviewProperties,
                             @Qualifier("reviewerExecutorService") ExecutorService reviewerExecutor,
                             @Qualifier("coordinatorExecutorService") ExecutorService coordinatorExecutor,
                             MeterRegistry meterRegistry) {
        this.store = store;
        this.reviewerTask = reviewerTask;
        this.textExtractor = textExtractor;
        this.reportWriter = reportWriter;
        this.fileStorage = fileStorage;
        this.reviewProperties = reviewProperties;
        this.reviewerExecutor = reviewerExecutor;
        this.coordinatorExecutor = coordinatorExecutor;
        this.meterRegistry = meterRegistry;
        this.reviewTimer = Timer.builder("cuadrada.review.duration")
                .description("Dispatch to finalize time of one submission")
                .register(meterRegistry);
    }

    /**
     * Starts reviewing a submission with the given reviewers.
     *
     * @return a future completed with the stored outcome once the submission is finalized
     * @throws IllegalArgumentException   for an empty or duplicate-named reviewer set
     * @throws AlreadyDispatchedException if a run for this submission is in flight
     * @throws AlreadyFinalizedException  if the submission is already complete
     */
    public CompletableFuture<Outcome> dispatch(String submissionId, List<ReviewerConfig> reviewers) {
        if (reviewers == null || reviewers.isEmpty())
            throw new IllegalArgumentException("At least one reviewer required");
        Set<String> names = new HashSet<>();
        for (ReviewerConfig reviewer : reviewers) {
            if (!names.add(reviewer.name()))
                throw new IllegalArgumentException("Duplicate reviewer name: " + reviewer.name());
        }

        Submission submission = store.get(submissionId);
        ReviewRun run = new ReviewRun(submissionId, List.copyOf(reviewers));
        if (arena.putIfAbsent(submissionId, run) != null)
            throw new AlreadyDispatchedException(submissionId);
        if (stragglers.containsKey(submissionId)) {
            arena.remove(submissionId, run);
            throw new AlreadyDispatchedException(submissionId);
        }
        if (submission.isProcessingComplete()) {
            arena.remove(submissionId, run);
            throw new AlreadyFinalizedException(submissionId);
        }

        String previous = MDC.get("submissionId");
        MDC.put("submissionId", submissionId);
        try {
            log.info("Dispatching submission {} to {} reviewers: {}", submissionId, reviewers.size(), names);
            Path paper = Path.of(submission.getFilePath());
            String title = submission.getPaperTitle();
            Timer.Sample sample = Timer.start(meterRegistry);

            CompletableFuture<Void> reviews = CompletableFuture
                    .supplyAsync(() -> textExtractor.extract(paper, title), reviewerExecutor)
                    .thenCompose(document -> fanOut(run, document));

            reviews.orTimeout(reviewProperties.timeout().toMillis(), TimeUnit.MILLISECONDS)
                    .handleAsync((ignored, failure) -> finalizeRun(run, title, failure, sample),
                            coordinatorExecutor)
                    .whenComplete((outcome, failure) -> {
                        if (failure != null) run.completion.completeExceptionally(unwrap(failure));
                        else run.completion.complete(outcome);
                    });
            return run.completion;
        } catch (RuntimeException e) {
            arena.remove(submissionId, run);
            log.error("Dispatch of submission {} failed", submissionId, e);
            throw e;
        } finally {
            if (previous != null) MDC.put("submissionId", previous);
            else MDC.remove("submissionId");
        }
    }

    /**
     * True while a run is active or reviewers of a finalized run have not exited yet.
     */
    public boolean inFlight(String submissionId) {
        return arena.containsKey(submissionId) || stragglers.containsKey(submissionId);
    }

    public Optional<CompletableFuture<Outcome>> awaitCompletion(String submissionId) {
        return Optional.ofNullable(arena.get(submissionId)).map(run -> run.completion);
    }

    /**
     * Finalizes an incomplete submission that has no in-flight run, for example one
     * left behind by a restart. Configured reviewers without a decision get ERROR/TIMEOUT.
     *
     * @return the stored outcome, or empty if a run for it is active
     */
    public Optional<Outcome> finalizeAbandoned(String submissionId) {
        ReviewRun guard = new ReviewRun(submissionId, reviewProperties.reviewers());
        if (arena.putIfAbsent(submissionId, guard) != null) return Optional.empty();
        MDC.put("submissionId", submissionId);
        try {
            if (stragglers.containsKey(submissionId)) return Optional.empty();
            Submission submission = store.get(submissionId);
            if (submission.isProcessingComplete()) return Optional.ofNullable(submission.getOutcome());
            log.warn("Finalizing abandoned submission {} created at {}", submissionId, submission.getCreatedAt());
            return Optional.of(finalizeSubmission(submissionId, submission.getPaperTitle(),
                    guard.reviewers, ErrorReason.TIMEOUT,
                    "Reviewer did not complete; review was abandoned", null));
        } finally {
            arena.remove(submissionId, guard);
            MDC.remove("submissionId");
        }
    }

    /** Completes once every reviewer left running by the last finalize has exited. */
    CompletableFuture<Void> stragglers(String submissionId) {
        return stragglers.getOrDefault(submissionId, CompletableFuture.completedFuture(null));
    }

    // ── Internal ───────────────────────────────────────────────────

    /**
     * One in-flight run: the reviewers it covers, their handles and its completion future.
     */
    static final class ReviewRun {
        final String submissionId;
        final List<ReviewerConfig> reviewers;
        final Map<String, ReviewerHandle> handles = new LinkedHashMap<>();
        final CompletableFuture<Outcome> completion = new CompletableFuture<>();
        /** Guarded by this run; once set no further reviewer is launched. */
        boolean closed;

        ReviewRun(String submissionId, List<ReviewerConfig> reviewers) {
            this.submissionId = submissionId;
            this.reviewers = reviewers;
        }
    }

    /**
     * One reviewer of a run. {@code result} is what the run waits for; {@code exited}
     * completes only when the worker body has returned or will never start.
     */
    static final class ReviewerHandle {
        private static final int PENDING = 0;
        private static final int RUNNING = 1;
        private static final int SKIPPED = 2;

        final CompletableFuture<Optional<ReviewResult>> result = new CompletableFuture<>();
        final CompletableFuture<Void> exited = new CompletableFuture<>();
        private final AtomicInteger state = new AtomicInteger(PENDING);
        private volatile Future<?> worker;

        void start(ExecutorService executor, Supplier<Optional<ReviewResult>> body) {
            worker = executor.submit(() -> {
                if (!state.compareAndSet(PENDING, RUNNING)) return;
                try {
                    result.complete(body.get());
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                } finally {
                    exited.complete(null);
                }
            });
        }

        /**
         * Stops waiting for this reviewer. A worker that has not started is skipped,
         * a running one is interrupted.
         *
         * @return true if the worker is still running
         */
        boolean abandon() {
            result.cancel(false);
            if (state.compareAndSet(PENDING, SKIPPED)) {
                exited.complete(null);
                return false;
            }
            Future<?> running = worker;
            if (running != null) running.cancel(true);
            return !exited.isDone();
        }
    }

    private CompletableFuture<Void> fanOut(ReviewRun run, PaperDocument document) {
        synchronized (run) {
            if (run.closed) return CompletableFuture.completedFuture(null);
            for (ReviewerConfig reviewer : run.reviewers) {
                ReviewAssignment assignment = new ReviewAssignment(run.submissionId, reviewer, document);
                ReviewerHandle handle = new ReviewerHandle();
                run.handles.put(reviewer.name(), handle);
                handle.start(reviewerExecutor, () -> reviewerTask.run(assignment));
            }
            return CompletableFuture.allOf(run.handles.values().stream()
                    .map(h -> h.result)
                    .toArray(CompletableFuture[]::new));
        }
    }

    /** Interrupts reviewers still running and tracks them until they exit. */
    private void closeRun(ReviewRun run) {
        List<CompletableFuture<Void>> running = new ArrayList<>();
        synchronized (run) {
            run.closed = true;
            run.handles.forEach((name, handle) -> {
                if (handle.result.isDone()) return;
                if (handle.abandon()) {
                    running.add(handle.exited);
                    log.debug("Interrupted outstanding reviewer {} of submission {}", name, run.submissionId);
                }
            });
        }
        if (running.isEmpty()) return;
        log.warn("Submission {} has {} reviewers still running after finalize", run.submissionId, running.size());
        CompletableFuture<Void> exited = CompletableFuture.allOf(running.toArray(CompletableFuture[]::new));
        stragglers.put(run.submissionId, exited);
        exited.whenComplete((ignored, failure) -> stragglers.remove(run.submissionId, exited));
    }

    private Outcome finalizeRun(ReviewRun run, String title, Throwable failure, Timer.Sample sample) {
        String submissionId = run.submissionId;
        MDC.put("submissionId", submissionId);
        try {
            Throwable cause = unwrap(failure);
            ErrorReason reason = ErrorReason.TIMEOUT;
            String message = "Reviewer did not finish within " + format(reviewProperties.timeout());
            String error = null;
            if (cause instanceof DocumentExtractionException) {
                reason = ErrorReason.EXTRACTION;
                message = cause.getMessage();
                error = cause.getMessage();
                log.warn("Submission {} could not be read: {}", submissionId, message);
            } else if (cause instanceof TimeoutException) {
                log.warn("Submission {} timed out after {}", submissionId, reviewProperties.timeout());
            } else if (cause != null) {
                reason = ErrorReason.BACKEND;
                message = "Review run failed: " + cause.getMessage();
                log.error("Review run of submission {} failed", submissionId, cause);
            }

            closeRun(run);
            return finalizeSubmission(submissionId, title, run.reviewers, reason, message, error);
        } catch (RuntimeException e) {
            log.error("Finalize of submission {} failed", submissionId, e);
            return markFailed(submissionId, e);
        } finally {
            arena.remove(submissionId, run);
            sample.stop(reviewTimer);
            MDC.remove("submissionId");
        }
    }

    private Outcome finalizeSubmission(String submissionId, String title, Collection<ReviewerConfig> reviewers,
                                       ErrorReason missingReason, String missingMessage, String error) {
        for (ReviewerConfig reviewer : reviewers) {
            if (store.findDecision(submissionId, reviewer.name()).isPresent()) continue;
            try {
                store.recordDecision(ReviewResult.error(submissionId, reviewer.name(), missingReason, missingMessage));
                log.info("{} recorded as {} for submission {}", reviewer.name(), missingReason, submissionId);
            } catch (DuplicateDecisionException e) {
                log.debug("{} landed its decision for submission {} first", reviewer.name(), submissionId);
            }
        }

        List<ReviewResult> decisions = store.decisionsFor(submissionId);
        Outcome outcome = OutcomeAggregator.aggregate(decisions.stream().map(ReviewResult::getDecision).toList());
        if (outcome == Outcome.PENDING) outcome = Outcome.ERROR;

        String certificate = OutcomeAggregator.allAccepted(outcome) ? writeCertificate(submissionId, title) : null;
        try {
            store.markComplete(submissionId, outcome, certificate, error);
        } catch (AlreadyFinalizedException e) {
            Outcome stored = store.get(submissionId).getOutcome();
            log.warn("Submission {} was finalized elsewhere as {}, computed {}", submissionId, stored, outcome);
            return stored;
        }
        Counter.builder("cuadrada.review.outcomes")
                .tag("outcome", outcome.name())
                .register(meterRegistry)
                .increment();
        log.info("Submission {} complete: outcome={}, decisions={}", submissionId, outcome, decisions.size());
        return outcome;
    }

    private String writeCertificate(String submissionId, String title) {
        String filename = submissionId + "_certificate.pdf";
        try {
            reportWriter.writeCertificate(title, submissionId, fileStorage.resultPath(filename));
            return filename;
        } catch (RuntimeException e) {
            log.warn("Certificate for submission {} not written: {}", submissionId, e.getMessage());
            return null;
        }
    }

    private Outcome markFailed(String submissionId, RuntimeException cause) {
        try {
            store.markComplete(submissionId, Outcome.ERROR, null, "Review failed: " + cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not mark submission {} as failed", submissionId, e);
        }
        return Outcome.ERROR;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String format(Duration duration) {
        return duration.toSeconds() >= 60 ? duration.toMinutes() + " minutes" : duration.toMillis() + " ms";
    }
}
