package com.coachify.assessment.modules.assessment.dto;

import com.coachify.assessment.modules.assessment.Assessment;
import com.coachify.assessment.modules.attempt.dto.AttemptSummaryDto;
import com.coachify.assessment.modules.question.dto.QuestionDto;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AssessmentDto {
    private UUID id;
    private UUID coachingId;
    private UUID batchId;
    private UUID createdById;
    private String title;
    private String description;
    private Assessment.AssessmentType type;
    private Integer durationMinutes;
    private Instant startTime;
    private Instant endTime;
    private Integer totalMarks;
    private Integer passingMarks;
    private Boolean shuffleQuestions;
    private Boolean shuffleOptions;
    private Assessment.ResultRelease showResultAfter;
    private Integer maxAttempts;
    private Double negativeMarking;
    private Assessment.AssessmentStatus status;
    private Instant createdAt;
    private Long questionCount;
    /** Detail views only. */
    private List<QuestionDto> questions;
    /** Student list views only: the caller's own attempts, newest first. */
    private List<AttemptSummaryDto> myAttempts;

    public static AssessmentDto from(Assessment a) {
        return AssessmentDto.builder()
                .id(a.getId())
                .coachingId(a.getCoachingId())
                .batchId(a.getBatchId())
                .createdById(a.getCreatedById())
                .title(a.getTitle())
                .description(a.getDescription())
                .type(a.getType())
                .durationMinutes(a.getDurationMinutes())
                .startTime(a.getStartTime())
                .endTime(a.getEndTime())
                .totalMarks(a.getTotalMarks())
                .passingMarks(a.getPassingMarks())
                .shuffleQuestions(a.getShuffleQuestions())
                .shuffleOptions(a.getShuffleOptions())
                .showResultAfter(a.getShowResultAfter())
                .maxAttempts(a.getMaxAttempts())
                .negativeMarking(a.getNegativeMarking())
                .status(a.getStatus())
                .createdAt(a.getCreatedAt())
                .build();
    }
}
