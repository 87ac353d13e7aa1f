package com.coachify.assessment.modules.attempt.dto;

import com.coachify.assessment.modules.attempt.Attempt;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttemptSummaryDto {
    private UUID id;
    private UUID assessmentId;
    private UUID userId;
    private Attempt.AttemptStatus status;
    private Instant startedAt;
    private Instant submittedAt;
    private Double totalScore;
    private Double maxScore;
    private Double percentage;
    private Integer correctCount;
    private Integer wrongCount;
    private Integer skippedCount;
    /** 1-based leaderboard position; only set on ranked listings. */
    private Integer rank;

    public static AttemptSummaryDto from(Attempt a) {
        return AttemptSummaryDto.builder()
                .id(a.getId())
                .assessmentId(a.getAssessmentId())
                .userId(a.getUserId())
                .status(a.getStatus())
                .startedAt(a.getStartedAt())
                .submittedAt(a.getSubmittedAt())
                .totalScore(a.getTotalScore())
                .maxScore(a.getMaxScore())
                .percentage(a.getPercentage())
                .correctCount(a.getCorrectCount())
                .wrongCount(a.getWrongCount())
                .skippedCount(a.getSkippedCount())
                .build();
    }
}
