package com.coachify.assessment.modules.result;

import com.coachify.assessment.exception.AlreadySubmittedException;
import com.coachify.assessment.exception.ResourceNotFoundException;
import com.coachify.assessment.modules.answer.AnswerRepository;
import com.coachify.assessment.modules.attempt.Attempt;
import com.coachify.assessment.modules.attempt.AttemptRepository;
import com.coachify.assessment.modules.grading.GradingResult;
import com.coachify.assessment.modules.grading.QuestionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persists a grading result in one transaction. Answers sharing the same
 * (isCorrect, marksAwarded) pair are written by a single bulk update, so a
 * submission costs a handful of statements rather than one per question.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultBatchWriter {

    private final AttemptRepository attemptRepository;
    private final AnswerRepository answerRepository;

    @Transactional
    public void write(UUID attemptId, GradingResult result, Instant submittedAt) {
        Attempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));
        if (attempt.getStatus() != Attempt.AttemptStatus.IN_PROGRESS) {
            throw new AlreadySubmittedException(attemptId);
        }

        Map<OutcomeKey, List<UUID>> groups = groupByOutcome(result.outcomes());
        groups.forEach((key, questionIds) -> {
            int updated = answerRepository.applyOutcome(attemptId, questionIds, key.correct(), key.marksAwarded());
            log.debug("Attempt {}: {} answers set to correct={} marks={}", attemptId, updated, key.correct(),
                    key.marksAwarded());
        });

        int finalised = attemptRepository.markSubmitted(attemptId, submittedAt, result.totalScore(),
                result.maxScore(), result.percentage(), result.correctCount(), result.wrongCount(),
                result.skippedCount());
        if (finalised == 0) {
            // Lost to a concurrent submit; throwing rolls back the answer updates above
            throw new AlreadySubmittedException(attemptId);
        }
    }

    static Map<OutcomeKey, List<UUID>> groupByOutcome(List<QuestionOutcome> outcomes) {
        Map<OutcomeKey, List<UUID>> groups = new LinkedHashMap<>();
        // Skipped questions join the (false, 0) group; they only have a row if one was stored empty
        for (QuestionOutcome outcome : outcomes) {
            groups.computeIfAbsent(new OutcomeKey(outcome.correct(), outcome.marksAwarded()),
                    k -> new ArrayList<>()).add(outcome.questionId());
        }
        return groups;
    }

    record OutcomeKey(boolean correct, double marksAwarded) {
    }
}
