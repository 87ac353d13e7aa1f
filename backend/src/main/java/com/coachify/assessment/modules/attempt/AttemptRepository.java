package com.coachify.assessment.modules.attempt;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AttemptRepository extends JpaRepository<Attempt, UUID> {

    long countByAssessmentIdAndUserIdAndStatus(UUID assessmentId, UUID userId, Attempt.AttemptStatus status);

    Optional<Attempt> findFirstByAssessmentIdAndUserIdAndStatus(UUID assessmentId, UUID userId,
            Attempt.AttemptStatus status);

    /**
     * Creates the IN_PROGRESS row unless one already exists. The conflict target
     * is the partial unique index, so a concurrent loser inserts nothing and
     * re-reads the winner's row.
     *
     * @return 1 when this call created the attempt, 0 otherwise
     */
    @Modifying
    @Query(value = """
            INSERT INTO attempts (id, assessment_id, user_id, status, started_at, version)
            VALUES (:id, :assessmentId, :userId, 'IN_PROGRESS', :startedAt, 0)
            ON CONFLICT (assessment_id, user_id) WHERE status = 'IN_PROGRESS' DO NOTHING
            """, nativeQuery = true)
    int insertIfNoOpenAttempt(@Param("id") UUID id,
            @Param("assessmentId") UUID assessmentId,
            @Param("userId") UUID userId,
            @Param("startedAt") Instant startedAt);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Attempt a WHERE a.id = :id")
    Optional<Attempt> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Shared row lock: answer saves on one attempt run side by side, while a
     * submit's FOR UPDATE waits for them and they wait for it.
     */
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("SELECT a FROM Attempt a WHERE a.id = :id")
    Optional<Attempt> findByIdForShare(@Param("id") UUID id);

    /**
     * Finalises an attempt only if it is still IN_PROGRESS.
     *
     * @return rows touched; 0 means another submit got there first
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Attempt a SET a.status = :submitted,
                a.submittedAt = :submittedAt, a.totalScore = :totalScore, a.maxScore = :maxScore,
                a.percentage = :percentage, a.correctCount = :correctCount, a.wrongCount = :wrongCount,
                a.skippedCount = :skippedCount, a.version = a.version + 1
            WHERE a.id = :id AND a.status = :inProgress
            """)
    int finalise(@Param("id") UUID id,
            @Param("submitted") Attempt.AttemptStatus submitted,
            @Param("inProgress") Attempt.AttemptStatus inProgress,
            @Param("submittedAt") Instant submittedAt,
            @Param("totalScore") double totalScore,
            @Param("maxScore") double maxScore,
            @Param("percentage") double percentage,
            @Param("correctCount") int correctCount,
            @Param("wrongCount") int wrongCount,
            @Param("skippedCount") int skippedCount);

    default int markSubmitted(UUID id, Instant submittedAt, double totalScore, double maxScore,
            double percentage, int correctCount, int wrongCount, int skippedCount) {
        return finalise(id, Attempt.AttemptStatus.SUBMITTED, Attempt.AttemptStatus.IN_PROGRESS, submittedAt,
                totalScore, maxScore, percentage, correctCount, wrongCount, skippedCount);
    }

    /** Leaderboard order: best percentage first, earlier finisher wins ties. */
    @Query("""
            SELECT a FROM Attempt a
            WHERE a.assessmentId = :assessmentId AND a.status = :status
            ORDER BY a.percentage DESC, a.submittedAt ASC, a.id ASC
            """)
    List<Attempt> findRanked(@Param("assessmentId") UUID assessmentId, @Param("status") Attempt.AttemptStatus status);

    default List<Attempt> findSubmittedRanked(UUID assessmentId) {
        return findRanked(assessmentId, Attempt.AttemptStatus.SUBMITTED);
    }

    List<Attempt> findByAssessmentIdInAndUserIdOrderByStartedAtDesc(Collection<UUID> assessmentIds, UUID userId);

    @Modifying
    @Query("DELETE FROM Attempt a WHERE a.assessmentId = :assessmentId")
    int deleteByAssessmentId(@Param("assessmentId") UUID assessmentId);
}
