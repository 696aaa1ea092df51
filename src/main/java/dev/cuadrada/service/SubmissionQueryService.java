package dev.cuadrada.service;

import dev.cuadrada.agent.orchestrator.OutcomeAggregator;
import dev.cuadrada.config.ReviewProperties;
import dev.cuadrada.domain.entity.ReviewResult;
import dev.cuadrada.domain.entity.Submission;
import dev.cuadrada.domain.enums.Outcome;
import dev.cuadrada.dto.response.SubmissionStatusResponse;
import dev.cuadrada.repository.ReviewResultRepository;
import dev.cuadrada.repository.SubmissionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/** Read-side service with read-only transactions. Never waits on running reviewers. */
@Service
@Transactional(readOnly = true)
public class SubmissionQueryService {
    private final SubmissionRepository submissions;
    private final ReviewResultRepository reviewResults;
    private final ReviewProperties reviewProperties;

    public SubmissionQueryService(SubmissionRepository submissions, ReviewResultRepository reviewResults,
                                  ReviewProperties reviewProperties) {
        this.submissions = submissions;
        this.reviewResults = reviewResults;
        this.reviewProperties = reviewProperties;
    }

    public Optional<SubmissionStatusResponse> findStatus(String submissionId) {
        return submissions.findBySubmissionId(submissionId).map(this::toResponse);
    }

    public List<ReviewResult> findDecisions(String submissionId) {
        return reviewResults.findBySubmissionIdOrderByReviewerNameAsc(submissionId);
    }

    private SubmissionStatusResponse toResponse(Submission s) {
        List<ReviewResult> decisions = findDecisions(s.getSubmissionId());
        boolean complete = s.isProcessingComplete();
        Outcome outcome = complete && s.getOutcome() != null
                ? s.getOutcome()
                : OutcomeAggregator.aggregate(decisions.stream().map(ReviewResult::getDecision).toList());
        int expected = Math.max(reviewProperties.reviewers().size(), decisions.size());
        return new SubmissionStatusResponse(s.getSubmissionId(), s.getPaperTitle(), s.getFilename(),
                s.getCreatedAt(),
                complete ? "complete" : "processing",
                complete ? "Review complete." : "Review is still being processed.",
                complete, s.isAllAccepted(), outcome, s.getError(), s.getCertificateFilename(),
                s.getCompletedAt(), decisions.size(), expected,
                decisions.stream().map(this::toView).toList());
    }

    private SubmissionStatusResponse.ReviewerResultView toView(ReviewResult r) {
        return new SubmissionStatusResponse.ReviewerResultView(r.getReviewerName(), r.getDecision(),
                r.getErrorReason(), r.getSummary(), r.getFullReview(), r.getModelUsed(), r.getFileUrl(),
                r.getCreatedAt());
    }
}
