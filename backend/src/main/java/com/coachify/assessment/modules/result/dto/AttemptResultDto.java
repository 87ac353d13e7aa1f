package com.coachify.assessment.modules.result.dto;

import com.coachify.assessment.modules.attempt.dto.AttemptSummaryDto;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@Builder
public class AttemptResultDto {
    private AttemptSummaryDto attempt;
    private UUID assessmentId;
    private String assessmentTitle;
    private Double negativeMarking;
    private Integer passingMarks;
    /** Null while the attempt is open or when the assessment has no pass mark. */
    private Boolean passed;
    /** False when correct answers and explanations were withheld. */
    private boolean answerKeyVisible;
    private List<QuestionResultDto> questions;
}
