package com.coachify.assessment.modules.question.dto;

import com.coachify.assessment.modules.question.Question;
import com.coachify.assessment.modules.question.QuestionOption;
import com.coachify.assessment.modules.question.payload.AnswerPayload;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@Builder
public class QuestionDto {
    private UUID id;
    private Question.QuestionType type;
    private String question;
    private String imageUrl;
    private List<QuestionOption> options;
    private AnswerPayload correctAnswer; // null unless the caller may see the key
    private Integer marks;
    private Integer orderIndex;
    private String explanation; // hidden together with correctAnswer

    public static QuestionDto from(Question q, boolean revealKey) {
        return QuestionDto.builder()
                .id(q.getId())
                .type(q.getType())
                .question(q.getPrompt())
                .imageUrl(q.getImageUrl())
                .options(q.getOptions())
                .correctAnswer(revealKey ? q.getCorrectAnswer() : null)
                .marks(q.getMarks())
                .orderIndex(q.getOrderIndex())
                .explanation(revealKey ? q.getExplanation() : null)
                .build();
    }
}
