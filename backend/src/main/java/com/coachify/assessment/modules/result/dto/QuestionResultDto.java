package com.coachify.assessment.modules.result.dto;

import com.coachify.assessment.modules.question.Question;
import com.coachify.assessment.modules.question.QuestionOption;
import com.coachify.assessment.modules.question.payload.AnswerPayload;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class QuestionResultDto {
    private UUID questionId;
    private Question.QuestionType type;
    private String question;
    private String imageUrl;
    private List<QuestionOption> options;
    private Integer marks;
    private Integer orderIndex;
    private AnswerPayload yourAnswer; // null when skipped
    private Instant answeredAt;
    private Boolean isCorrect; // null until graded or when skipped
    private Double marksAwarded;
    private AnswerPayload correctAnswer;
    private String explanation;
}
