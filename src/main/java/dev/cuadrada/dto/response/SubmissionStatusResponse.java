package dev.cuadrada.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.cuadrada.domain.enums.Decision;
import dev.cuadrada.domain.enums.ErrorReason;
import dev.cuadrada.domain.enums.Outcome;

import java.time.Instant;
import java.util.List;

public record SubmissionStatusResponse(
        @JsonProperty("submission_id") String submissionId,
        @JsonProperty("paper_title") String paperTitle,
        String filename,
        @JsonProperty("created_at") Instant createdAt,
        String status,
        String message,
        @JsonProperty("processing_complete") boolean processingComplete,
        @JsonProperty("all_accepted") boolean allAccepted,
        Outcome outcome,
        String error,
        @JsonProperty("certificate_filename") String certificateFilename,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("reviews_completed") int reviewsCompleted,
        @JsonProperty("reviews_expected") int reviewsExpected,
        List<ReviewerResultView> results
) {
    public record ReviewerResultView(
            @JsonProperty("reviewer_name") String reviewerName,
            Decision decision,
            @JsonProperty("error_reason") ErrorReason errorReason,
            String summary,
            @JsonProperty("full_review") String fullReview,
            @JsonProperty("model_used") String modelUsed,
            @JsonProperty("file_url") String fileUrl,
            @JsonProperty("created_at") Instant createdAt) {}
}
