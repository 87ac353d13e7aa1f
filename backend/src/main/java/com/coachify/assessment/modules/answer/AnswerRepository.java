package com.coachify.assessment.modules.answer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface AnswerRepository extends JpaRepository<Answer, UUID> {

    List<Answer> findByAttemptId(UUID attemptId);

    /**
     * Single-statement autosave. The latest arrival for an (attempt, question)
     * pair wins; grading columns are left untouched.
     *
     * @param rawAnswer the payload already serialised to JSON
     */
    @Modifying
    @Query(value = """
            INSERT INTO answers (id, attempt_id, question_id, raw_answer, answered_at)
            VALUES (:id, :attemptId, :questionId, CAST(:rawAnswer AS jsonb), :answeredAt)
            ON CONFLICT (attempt_id, question_id)
            DO UPDATE SET raw_answer = EXCLUDED.raw_answer, answered_at = EXCLUDED.answered_at
            """, nativeQuery = true)
    int upsert(@Param("id") UUID id,
            @Param("attemptId") UUID attemptId,
            @Param("questionId") UUID questionId,
            @Param("rawAnswer") String rawAnswer,
            @Param("answeredAt") Instant answeredAt);

    /** Writes one grading outcome to every listed answer of the attempt. */
    @Modifying(flushAutomatically = true)
    @Query("""
            UPDATE Answer a SET a.isCorrect = :isCorrect, a.marksAwarded = :marksAwarded
            WHERE a.attemptId = :attemptId AND a.questionId IN :questionIds
            """)
    int applyOutcome(@Param("attemptId") UUID attemptId,
            @Param("questionIds") Collection<UUID> questionIds,
            @Param("isCorrect") boolean isCorrect,
            @Param("marksAwarded") double marksAwarded);

    @Modifying
    @Query("DELETE FROM Answer a WHERE a.questionId = :questionId")
    int deleteByQuestionId(@Param("questionId") UUID questionId);

    @Modifying
    @Query("DELETE FROM Answer a WHERE a.attemptId IN (SELECT t.id FROM Attempt t WHERE t.assessmentId = :assessmentId)")
    int deleteByAssessmentId(@Param("assessmentId") UUID assessmentId);
}
