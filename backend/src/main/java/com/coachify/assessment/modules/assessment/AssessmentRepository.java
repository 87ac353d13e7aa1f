package com.coachify.assessment.modules.assessment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AssessmentRepository extends JpaRepository<Assessment, UUID> {

    List<Assessment> findByBatchIdOrderByCreatedAtDesc(UUID batchId);

    /**
     * Row lock held for the rest of the transaction; serialises concurrent
     * question edits so the totalMarks recomputation never loses an update.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Assessment a WHERE a.id = :id")
    Optional<Assessment> findByIdForUpdate(@Param("id") UUID id);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Assessment a SET a.totalMarks = :totalMarks WHERE a.id = :id")
    int updateTotalMarks(@Param("id") UUID id, @Param("totalMarks") int totalMarks);

    /** Writes status alone so a concurrent totalMarks recomputation is never overwritten. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Assessment a SET a.status = :status, a.updatedAt = :updatedAt WHERE a.id = :id")
    int changeStatus(@Param("id") UUID id, @Param("status") Assessment.AssessmentStatus status,
            @Param("updatedAt") Instant updatedAt);
}
