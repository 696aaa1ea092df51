package dev.cuadrada.repository;

import dev.cuadrada.domain.entity.ReviewResult;
import dev.cuadrada.domain.enums.Decision;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReviewResultRepository extends JpaRepository<ReviewResult, Long> {
    List<ReviewResult> findBySubmissionIdOrderByReviewerNameAsc(String submissionId);

    Optional<ReviewResult> findBySubmissionIdAndReviewerName(String submissionId, String reviewerName);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            delete from ReviewResult r
             where r.submissionId = :submissionId
               and r.reviewerName in :reviewerNames
               and r.decision = :decision""")
    int deleteBySubmissionIdAndReviewerNameInAndDecision(@Param("submissionId") String submissionId,
                                                         @Param("reviewerNames") Collection<String> reviewerNames,
                                                         @Param("decision") Decision decision);
}
