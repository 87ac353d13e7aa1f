package com.coachify.assessment.modules.answer.dto;

import com.coachify.assessment.modules.answer.Answer;
import com.coachify.assessment.modules.question.payload.AnswerPayload;

import java.time.Instant;
import java.util.UUID;

public record SavedAnswerDto(UUID questionId, AnswerPayload answer, Instant answeredAt) {

    public static SavedAnswerDto from(Answer a) {
        return new SavedAnswerDto(a.getQuestionId(), a.getRawAnswer(), a.getAnsweredAt());
    }
}
