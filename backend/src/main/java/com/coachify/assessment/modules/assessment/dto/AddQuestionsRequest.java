package com.coachify.assessment.modules.assessment.dto;

import com.coachify.assessment.modules.question.dto.CreateQuestionRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddQuestionsRequest {

    @NotEmpty(message = "At least one question is required")
    @Valid
    private List<CreateQuestionRequest> questions;
}
