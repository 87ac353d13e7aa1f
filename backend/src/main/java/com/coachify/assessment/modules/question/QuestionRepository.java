package com.coachify.assessment.modules.question;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface QuestionRepository extends JpaRepository<Question, UUID> {

    List<Question> findByAssessmentIdOrderByOrderIndexAsc(UUID assessmentId);

    @Query("SELECT q FROM Question q WHERE q.id = :id AND q.assessment.id = :assessmentId")
    Optional<Question> findByIdAndAssessmentId(@Param("id") UUID id, @Param("assessmentId") UUID assessmentId);

    @Query("SELECT MAX(q.orderIndex) FROM Question q WHERE q.assessment.id = :assessmentId")
    Optional<Integer> findMaxOrderIndex(@Param("assessmentId") UUID assessmentId);

    /** Aggregate used to keep Assessment.totalMarks equal to the live question total. */
    @Query("SELECT COALESCE(SUM(q.marks), 0) FROM Question q WHERE q.assessment.id = :assessmentId")
    long sumMarks(@Param("assessmentId") UUID assessmentId);

    @Query("SELECT q.assessment.id, COUNT(q) FROM Question q WHERE q.assessment.id IN :assessmentIds GROUP BY q.assessment.id")
    List<Object[]> countByAssessmentIds(@Param("assessmentIds") List<UUID> assessmentIds);

    long countByAssessmentId(UUID assessmentId);

    @Modifying
    @Query("DELETE FROM Question q WHERE q.assessment.id = :assessmentId")
    int deleteByAssessmentId(@Param("assessmentId") UUID assessmentId);
}
