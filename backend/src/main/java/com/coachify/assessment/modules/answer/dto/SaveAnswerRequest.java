package com.coachify.assessment.modules.answer.dto;

import com.coachify.assessment.modules.question.payload.AnswerPayload;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SaveAnswerRequest {

    @NotNull(message = "Question ID is required")
    private UUID questionId;

    @NotNull(message = "Answer is required")
    private AnswerPayload answer;
}
