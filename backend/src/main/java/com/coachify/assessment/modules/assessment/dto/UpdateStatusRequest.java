package com.coachify.assessment.modules.assessment.dto;

import com.coachify.assessment.modules.assessment.Assessment;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateStatusRequest {

    @NotNull(message = "Status is required")
    private Assessment.AssessmentStatus status;
}
