package dev.cuadrada.repository;

import dev.cuadrada.domain.entity.Submission;
import dev.cuadrada.domain.enums.Outcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface SubmissionRepository extends JpaRepository<Submission, Long> {
    Optional<Submission> findBySubmissionId(String submissionId);

    boolean existsBySubmissionId(String submissionId);

    List<Submission> findByProcessingCompleteFalseAndCreatedAtBefore(Instant cutoff);

    /** Compare-and-set processing_complete false → true. Returns the number of rows changed (0 or 1). */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Submission s
               set s.processingComplete = true,
                   s.allAccepted = :allAccepted,
                   s.outcome = :outcome,
                   s.certificateFilename = :certificateFilename,
                   s.error = :error,
                   s.completedAt = :completedAt
             where s.submissionId = :submissionId
               and s.processingComplete = false""")
    int finalizeIfIncomplete(@Param("submissionId") String submissionId,
                             @Param("outcome") Outcome outcome,
                             @Param("allAccepted") boolean allAccepted,
                             @Param("certificateFilename") String certificateFilename,
                             @Param("error") String error,
                             @Param("completedAt") Instant completedAt);

    /** Compare-and-set processing_complete true → false, clearing the terminal state. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Submission s
               set s.processingComplete = false,
                   s.allAccepted = false,
                   s.outcome = null,
                   s.certificateFilename = null,
                   s.error = null,
                   s.completedAt = null
             where s.submissionId = :submissionId
               and s.processingComplete = true""")
    int reopenIfComplete(@Param("submissionId") String submissionId);

    @Modifying
    @Query("delete from Submission s where s.submissionId = :submissionId")
    int deleteBySubmissionId(@Param("submissionId") String submissionId);
}
