package com.coachify.assessment.modules.assessment;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "assessments")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Assessment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "coaching_id", nullable = false)
    private UUID coachingId;

    @Column(name = "batch_id", nullable = false)
    private UUID batchId;

    @Column(name = "created_by_id", nullable = false)
    private UUID createdById;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private AssessmentType type = AssessmentType.QUIZ;

    /** Per-attempt time limit, counted from Attempt.startedAt. */
    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    /** Always the sum of the current questions' marks. */
    @Column(name = "total_marks", nullable = false)
    @Builder.Default
    private Integer totalMarks = 0;

    @Column(name = "passing_marks")
    private Integer passingMarks;

    @Column(name = "shuffle_questions", nullable = false)
    @Builder.Default
    private Boolean shuffleQuestions = false;

    @Column(name = "shuffle_options", nullable = false)
    @Builder.Default
    private Boolean shuffleOptions = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "show_result_after", nullable = false, length = 10)
    @Builder.Default
    private ResultRelease showResultAfter = ResultRelease.SUBMIT;

    @Column(name = "max_attempts", nullable = false)
    @Builder.Default
    private Integer maxAttempts = 1;

    /** Fraction of a question's marks deducted for a wrong answer. */
    @Column(name = "negative_marking", nullable = false)
    @Builder.Default
    private Double negativeMarking = 0.0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AssessmentStatus status = AssessmentStatus.DRAFT;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public enum AssessmentStatus {
        DRAFT, PUBLISHED, CLOSED
    }

    public enum AssessmentType {
        QUIZ, TEST
    }

    /** When a student may see the answer key of a submitted attempt. */
    public enum ResultRelease {
        SUBMIT, MANUAL
    }
}
