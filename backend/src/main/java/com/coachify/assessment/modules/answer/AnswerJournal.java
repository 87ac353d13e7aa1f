package com.coachify.assessment.modules.answer;

import com.coachify.assessment.exception.AlreadySubmittedException;
import com.coachify.assessment.exception.OutOfWindowException;
import com.coachify.assessment.exception.ResourceNotFoundException;
import com.coachify.assessment.exception.UnauthorizedAccessException;
import com.coachify.assessment.modules.answer.dto.SavedAnswerDto;
import com.coachify.assessment.modules.assessment.Assessment;
import com.coachify.assessment.modules.assessment.AssessmentRepository;
import com.coachify.assessment.modules.attempt.Attempt;
import com.coachify.assessment.modules.attempt.AttemptRepository;
import com.coachify.assessment.modules.question.AnswerPayloadValidator;
import com.coachify.assessment.modules.question.Question;
import com.coachify.assessment.modules.question.QuestionRepository;
import com.coachify.assessment.modules.question.payload.AnswerPayload;
import com.coachify.assessment.security.SecurityUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Autosave store for in-progress answers. Writes are recorded as-is and never
 * evaluated here; correctness is only decided when the attempt is submitted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerJournal {

    private final AnswerRepository answerRepository;
    private final AttemptRepository attemptRepository;
    private final AssessmentRepository assessmentRepository;
    private final QuestionRepository questionRepository;
    private final AnswerPayloadValidator payloadValidator;
    private final SecurityUtils securityUtils;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Records the latest answer for one question. The attempt row is share-locked
     * until commit, so a submit either sees this write or this write sees SUBMITTED.
     */
    @Transactional
    public SavedAnswerDto saveAnswer(UUID attemptId, UUID questionId, AnswerPayload rawAnswer) {
        Attempt attempt = attemptRepository.findByIdForShare(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));

        if (!attempt.getUserId().equals(securityUtils.getCurrentUserId())) {
            throw new UnauthorizedAccessException("Not your attempt");
        }
        if (attempt.getStatus() != Attempt.AttemptStatus.IN_PROGRESS) {
            throw new AlreadySubmittedException(attemptId);
        }

        Question question = questionRepository.findByIdAndAssessmentId(questionId, attempt.getAssessmentId())
                .orElseThrow(() -> new ResourceNotFoundException("Question", questionId.toString()));
        payloadValidator.validateSubmitted(question, rawAnswer);

        Instant now = clock.instant();
        Assessment assessment = assessmentRepository.findById(attempt.getAssessmentId())
                .orElseThrow(() -> new ResourceNotFoundException("Assessment", attempt.getAssessmentId().toString()));
        assertWritable(assessment, attempt, now);

        answerRepository.upsert(UUID.randomUUID(), attemptId, questionId, toJson(rawAnswer), now);
        log.debug("Answer saved: attempt={} question={}", attemptId, questionId);
        return new SavedAnswerDto(questionId, rawAnswer, now);
    }

    @Transactional(readOnly = true)
    public List<SavedAnswerDto> getSavedAnswers(UUID attemptId) {
        Attempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));
        if (!securityUtils.isStaff() && !attempt.getUserId().equals(securityUtils.getCurrentUserId())) {
            throw new UnauthorizedAccessException("Not your attempt");
        }
        return answerRepository.findByAttemptId(attemptId).stream()
                .map(SavedAnswerDto::from)
                .toList();
    }

    // Deadlines are checked on write; nothing closes an attempt in the background.
    private void assertWritable(Assessment assessment, Attempt attempt, Instant now) {
        if (assessment.getEndTime() != null && now.isAfter(assessment.getEndTime())) {
            throw new OutOfWindowException("Assessment has ended");
        }
        Integer duration = assessment.getDurationMinutes();
        if (duration != null && now.isAfter(attempt.getStartedAt().plus(Duration.ofMinutes(duration)))) {
            throw new OutOfWindowException("Time limit of " + duration + " minutes has elapsed");
        }
    }

    private String toJson(AnswerPayload payload) {
        try {
            return objectMapper.writerFor(AnswerPayload.class).writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise answer payload", e);
        }
    }
}
