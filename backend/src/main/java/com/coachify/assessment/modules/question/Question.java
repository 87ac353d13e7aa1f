package com.coachify.assessment.modules.question;

import com.coachify.assessment.modules.assessment.Assessment;
import com.coachify.assessment.modules.question.payload.AnswerPayload;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "questions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assessment_id", nullable = false)
    private Assessment assessment;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private QuestionType type;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String prompt;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    /** Choices for MCQ/MSQ; null for NAT. */
    @JdbcTypeCode(SqlTypes.JSON)
    private List<QuestionOption> options;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "correct_answer", nullable = false)
    private AnswerPayload correctAnswer;

    @Column(nullable = false)
    @Builder.Default
    private Integer marks = 1;

    @Column(name = "order_index", nullable = false)
    private Integer orderIndex;

    @Column(columnDefinition = "TEXT")
    private String explanation;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public enum QuestionType {
        MCQ, MSQ, NAT
    }
}
