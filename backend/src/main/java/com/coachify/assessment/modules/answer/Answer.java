package com.coachify.assessment.modules.answer;

import com.coachify.assessment.modules.question.payload.AnswerPayload;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "answers", uniqueConstraints = @UniqueConstraint(name = "uk_answers_attempt_question", columnNames = {
        "attempt_id", "question_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Answer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "attempt_id", nullable = false)
    private UUID attemptId;

    @Column(name = "question_id", nullable = false)
    private UUID questionId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_answer")
    private AnswerPayload rawAnswer;

    // Both stay null until the attempt is graded
    @Column(name = "is_correct")
    private Boolean isCorrect;

    @Column(name = "marks_awarded")
    private Double marksAwarded;

    @Column(name = "answered_at", nullable = false)
    private Instant answeredAt;
}
