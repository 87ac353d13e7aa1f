package com.coachify.assessment.modules.question.dto;

import com.coachify.assessment.modules.question.Question;
import com.coachify.assessment.modules.question.QuestionOption;
import com.coachify.assessment.modules.question.payload.AnswerPayload;
import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateQuestionRequest {

    @NotNull(message = "Question type is required")
    private Question.QuestionType type;

    @NotBlank(message = "Question text is required")
    private String question;

    @Size(max = 500)
    private String imageUrl;

    // MCQ/MSQ only
    private List<QuestionOption> options;

    @NotNull(message = "Correct answer is required")
    private AnswerPayload correctAnswer;

    @Min(1)
    @Max(100)
    private Integer marks;

    @Min(0)
    private Integer orderIndex;

    private String explanation;
}
