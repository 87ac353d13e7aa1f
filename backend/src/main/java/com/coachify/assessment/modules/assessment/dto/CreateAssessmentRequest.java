package com.coachify.assessment.modules.assessment.dto;

import com.coachify.assessment.modules.assessment.Assessment;
import com.coachify.assessment.modules.question.dto.CreateQuestionRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAssessmentRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200)
    private String title;

    private String description;

    private Assessment.AssessmentType type;

    @Min(1)
    @Max(600)
    private Integer durationMinutes;

    private Instant startTime;

    private Instant endTime;

    @Min(0)
    private Integer passingMarks;

    private Boolean shuffleQuestions;

    private Boolean shuffleOptions;

    private Assessment.ResultRelease showResultAfter;

    @Min(1)
    private Integer maxAttempts;

    @DecimalMin("0")
    @DecimalMax("1")
    private Double negativeMarking;

    @Valid
    private List<CreateQuestionRequest> questions;
}
