package com.coachify.assessment.modules.attempt;

import com.coachify.assessment.exception.AlreadySubmittedException;
import com.coachify.assessment.exception.AssessmentNotAvailableException;
import com.coachify.assessment.exception.AttemptsExhaustedException;
import com.coachify.assessment.exception.OutOfWindowException;
import com.coachify.assessment.exception.ResourceNotFoundException;
import com.coachify.assessment.exception.UnauthorizedAccessException;
import com.coachify.assessment.modules.answer.Answer;
import com.coachify.assessment.modules.answer.AnswerRepository;
import com.coachify.assessment.modules.assessment.Assessment;
import com.coachify.assessment.modules.assessment.AssessmentRepository;
import com.coachify.assessment.modules.attempt.dto.StartAttemptResponse;
import com.coachify.assessment.modules.grading.GradingEngine;
import com.coachify.assessment.modules.grading.GradingResult;
import com.coachify.assessment.modules.question.Question;
import com.coachify.assessment.modules.question.QuestionRepository;
import com.coachify.assessment.modules.question.payload.AnswerPayload;
import com.coachify.assessment.modules.result.ResultBatchWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the IN_PROGRESS to SUBMITTED transition of an attempt.
 *
 * <p>
 * Start is race-safe through a conditional insert against the partial unique
 * index on open attempts. Submit locks the attempt row, grades, and hands the
 * result to {@link ResultBatchWriter}, whose conditional finalise makes a
 * second submit fail instead of overwriting the first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttemptLifecycleManager {

    private final AssessmentRepository assessmentRepository;
    private final AttemptRepository attemptRepository;
    private final QuestionRepository questionRepository;
    private final AnswerRepository answerRepository;
    private final GradingEngine gradingEngine;
    private final ResultBatchWriter resultBatchWriter;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public StartAttemptResponse startOrResume(UUID assessmentId, UUID userId) {
        Assessment assessment = assessmentRepository.findById(assessmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assessment", assessmentId.toString()));

        if (assessment.getStatus() != Assessment.AssessmentStatus.PUBLISHED) {
            throw new AssessmentNotAvailableException(assessmentId);
        }

        Instant now = clock.instant();
        if (assessment.getStartTime() != null && now.isBefore(assessment.getStartTime())) {
            throw new OutOfWindowException("Assessment has not started yet");
        }
        if (assessment.getEndTime() != null && now.isAfter(assessment.getEndTime())) {
            throw new OutOfWindowException("Assessment has ended");
        }

        assertWithinAttemptLimit(assessment, userId);

        Optional<Attempt> open = attemptRepository.findFirstByAssessmentIdAndUserIdAndStatus(assessmentId, userId,
                Attempt.AttemptStatus.IN_PROGRESS);
        if (open.isPresent()) {
            log.info("Attempt resumed: attempt={} assessment={} user={}", open.get().getId(), assessmentId, userId);
            return new StartAttemptResponse(open.get().getId(), true);
        }

        int inserted = attemptRepository.insertIfNoOpenAttempt(UUID.randomUUID(), assessmentId, userId, now);
        Attempt attempt = attemptRepository.findFirstByAssessmentIdAndUserIdAndStatus(assessmentId, userId,
                Attempt.AttemptStatus.IN_PROGRESS)
                .orElseThrow(() -> new IllegalStateException(
                        "Open attempt vanished for assessment " + assessmentId + " user " + userId));

        boolean resumed = inserted == 0;
        log.info("Attempt {}: attempt={} assessment={} user={}", resumed ? "resumed after race" : "started",
                attempt.getId(), assessmentId, userId);
        return new StartAttemptResponse(attempt.getId(), resumed);
    }

    /**
     * Grades and finalises an attempt.
     *
     * @return the attempt as stored after finalisation
     * @throws AlreadySubmittedException if the attempt is not IN_PROGRESS,
     *                                   checked before any grading work
     */
    @Transactional
    public Attempt submitAttempt(UUID attemptId, UUID userId) {
        Attempt attempt = attemptRepository.findByIdForUpdate(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));

        if (!attempt.getUserId().equals(userId)) {
            throw new UnauthorizedAccessException("Not your attempt");
        }
        if (attempt.getStatus() != Attempt.AttemptStatus.IN_PROGRESS) {
            throw new AlreadySubmittedException(attemptId);
        }

        Assessment assessment = assessmentRepository.findById(attempt.getAssessmentId())
                .orElseThrow(() -> new ResourceNotFoundException("Assessment", attempt.getAssessmentId().toString()));
        assertWithinAttemptLimit(assessment, userId);

        List<Question> questions = questionRepository.findByAssessmentIdOrderByOrderIndexAsc(assessment.getId());
        Map<UUID, AnswerPayload> answers = new HashMap<>();
        for (Answer answer : answerRepository.findByAttemptId(attemptId)) {
            if (answer.getRawAnswer() != null) {
                answers.put(answer.getQuestionId(), answer.getRawAnswer());
            }
        }

        double ratio = assessment.getNegativeMarking() != null ? assessment.getNegativeMarking() : 0.0;
        GradingResult result = gradingEngine.grade(questions, answers, ratio);
        resultBatchWriter.write(attemptId, result, clock.instant());

        log.info("Attempt submitted: attempt={} assessment={} score={}/{} ({}%)", attemptId, assessment.getId(),
                result.totalScore(), result.maxScore(), result.percentage());
        eventPublisher.publishEvent(new AttemptSubmittedEvent(attemptId, assessment.getId(), userId,
                result.totalScore(), result.maxScore(), result.percentage()));

        return attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));
    }

    private void assertWithinAttemptLimit(Assessment assessment, UUID userId) {
        long submitted = attemptRepository.countByAssessmentIdAndUserIdAndStatus(assessment.getId(), userId,
                Attempt.AttemptStatus.SUBMITTED);
        if (submitted >= assessment.getMaxAttempts()) {
            throw new AttemptsExhaustedException(assessment.getMaxAttempts());
        }
    }
}
