package dev.cuadrada.service;

import dev.cuadrada.domain.entity.ReviewResult;
import dev.cuadrada.domain.entity.Submission;
import dev.cuadrada.domain.enums.Decision;
import dev.cuadrada.domain.enums.Outcome;
import dev.cuadrada.exception.AlreadyDispatchedException;
import dev.cuadrada.exception.AlreadyFinalizedException;
import dev.cuadrada.exception.DuplicateDecisionException;
import dev.cuadrada.exception.DuplicateSubmissionException;
import dev.cuadrada.exception.SubmissionNotFoundException;
import dev.cuadrada.repository.ReviewResultRepository;
import dev.cuadrada.repository.SubmissionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for submissions and their decisions.
 *
 * <p>Integrity rules enforced here, never silently merged:
 * <ul>
 *   <li>one submission per external id ({@link DuplicateSubmissionException})</li>
 *   <li>one decision per (submission, reviewer) ({@link DuplicateDecisionException})</li>
 *   <li>one terminal state per submission ({@link AlreadyFinalizedException})</li>
 * </ul>
 * Completion is a single compare-and-set UPDATE on processing_complete, so two
 * concurrent finalize attempts cannot both succeed.
 */
@Service
public class SubmissionStore {
    private static final Logger log = LoggerFactory.getLogger(SubmissionStore.class);

    private final SubmissionRepository submissions;
    private final ReviewResultRepository reviewResults;

    public SubmissionStore(SubmissionRepository submissions, ReviewResultRepository reviewResults) {
        this.submissions = submissions;
        this.reviewResults = reviewResults;
    }

    @Transactional
    public Submission create(String submissionId, String paperTitle, String filename, String filePath) {
        if (submissions.existsBySubmissionId(submissionId))
            throw new DuplicateSubmissionException(submissionId);
        try {
            Submission saved = submissions.saveAndFlush(
                    Submission.create(submissionId, paperTitle, filename, filePath));
            log.debug("Created submission {}", submissionId);
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateSubmissionException(submissionId);
        }
    }

    @Transactional(readOnly = true)
    public Optional<Submission> find(String submissionId) {
        return submissions.findBySubmissionId(submissionId);
    }

    @Transactional(readOnly = true)
    public Submission get(String submissionId) {
        return find(submissionId).orElseThrow(() -> new SubmissionNotFoundException(submissionId));
    }

    /**
     * Flips processing_complete false → true with the given terminal state.
     *
     * @return true if this call finalized the submission, false if it already
     *         held exactly this terminal state
     * @throws AlreadyFinalizedException if it was finalized with a different state
     */
    @Transactional
    public boolean markComplete(String submissionId, Outcome outcome, String certificateFilename, String error) {
        if (outcome == null || outcome == Outcome.PENDING)
            throw new IllegalArgumentException("Terminal outcome required, got " + outcome);
        int updated = submissions.finalizeIfIncomplete(submissionId, outcome, outcome.isAccepted(),
                certificateFilename, error, Instant.now());
        if (updated == 1) {
            log.info("Submission {} finalized: outcome={}, certificate={}", submissionId, outcome,
                    certificateFilename);
            return true;
        }
        Submission current = get(submissionId);
        if (current.hasTerminalState(outcome, certificateFilename, error)) {
            log.debug("Submission {} already finalized with the same state", submissionId);
            return false;
        }
        throw new AlreadyFinalizedException(submissionId);
    }

    @Transactional
    public ReviewResult recordDecision(ReviewResult result) {
        String submissionId = result.getSubmissionId();
        String reviewerName = result.getReviewerName();
        if (!submissions.existsBySubmissionId(submissionId))
            throw new SubmissionNotFoundException(submissionId);
        if (reviewResults.findBySubmissionIdAndReviewerName(submissionId, reviewerName).isPresent())
            throw new DuplicateDecisionException(submissionId, reviewerName);
        try {
            return reviewResults.saveAndFlush(result);
        } catch (DataIntegrityViolationException e) {
            // lost the race on uq_review_results_submission_reviewer
            throw new DuplicateDecisionException(submissionId, reviewerName);
        }
    }

    @Transactional(readOnly = true)
    public Optional<ReviewResult> findDecision(String submissionId, String reviewerName) {
        return reviewResults.findBySubmissionIdAndReviewerName(submissionId, reviewerName);
    }

    @Transactional(readOnly = true)
    public List<ReviewResult> decisionsFor(String submissionId) {
        return reviewResults.findBySubmissionIdOrderByReviewerNameAsc(submissionId);
    }

    /**
     * Re-opens a completed submission and drops the ERROR decisions of the given
     * reviewers so they can run again. Other decisions are untouched.
     */
    @Transactional
    public void reopenForRetry(String submissionId, Collection<String> reviewerNames) {
        if (submissions.reopenIfComplete(submissionId) == 0) {
            get(submissionId);
            log.warn("Submission {} cannot be reopened while it is processing", submissionId);
            throw new AlreadyDispatchedException(submissionId);
        }
        int removed = reviewResults.deleteBySubmissionIdAndReviewerNameInAndDecision(
                submissionId, reviewerNames, Decision.ERROR);
        log.info("Submission {} reopened for retry of {} ({} error decisions removed)",
                submissionId, reviewerNames, removed);
    }

    /**
     * Removes a submission; its decisions go with it (ON DELETE CASCADE).
     */
    @Transactional
    public void delete(String submissionId) {
        int removed = submissions.deleteBySubmissionId(submissionId);
        log.info("Deleted submission {} ({} rows)", submissionId, removed);
    }

    @Transactional(readOnly = true)
    public List<Submission> findIncompleteBefore(Instant cutoff) {
        return submissions.findByProcessingCompleteFalseAndCreatedAtBefore(cutoff);
    }
}
