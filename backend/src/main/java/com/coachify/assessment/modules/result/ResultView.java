package com.coachify.assessment.modules.result;

import com.coachify.assessment.exception.ResourceNotFoundException;
import com.coachify.assessment.modules.answer.Answer;
import com.coachify.assessment.modules.answer.AnswerRepository;
import com.coachify.assessment.modules.assessment.Assessment;
import com.coachify.assessment.modules.assessment.AssessmentRepository;
import com.coachify.assessment.modules.attempt.Attempt;
import com.coachify.assessment.modules.attempt.AttemptRepository;
import com.coachify.assessment.modules.attempt.dto.AttemptSummaryDto;
import com.coachify.assessment.modules.question.Question;
import com.coachify.assessment.modules.question.QuestionRepository;
import com.coachify.assessment.modules.result.dto.AttemptResultDto;
import com.coachify.assessment.modules.result.dto.QuestionResultDto;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side of grading. Access control and answer-key visibility are decided
 * by the caller.
 */
@Service
@RequiredArgsConstructor
public class ResultView {

    private final AttemptRepository attemptRepository;
    private final AssessmentRepository assessmentRepository;
    private final QuestionRepository questionRepository;
    private final AnswerRepository answerRepository;

    @Transactional(readOnly = true)
    public AttemptResultDto getAttemptResult(UUID attemptId, boolean revealKey) {
        Attempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));
        Assessment assessment = assessmentRepository.findById(attempt.getAssessmentId())
                .orElseThrow(() -> new ResourceNotFoundException("Assessment", attempt.getAssessmentId().toString()));

        Map<UUID, Answer> answersByQuestion = answerRepository.findByAttemptId(attemptId).stream()
                .collect(Collectors.toMap(Answer::getQuestionId, Function.identity()));

        List<QuestionResultDto> questions = new ArrayList<>();
        for (Question q : questionRepository.findByAssessmentIdOrderByOrderIndexAsc(assessment.getId())) {
            Answer answer = answersByQuestion.get(q.getId());
            questions.add(QuestionResultDto.builder()
                    .questionId(q.getId())
                    .type(q.getType())
                    .question(q.getPrompt())
                    .imageUrl(q.getImageUrl())
                    .options(q.getOptions())
                    .marks(q.getMarks())
                    .orderIndex(q.getOrderIndex())
                    .yourAnswer(answer != null ? answer.getRawAnswer() : null)
                    .answeredAt(answer != null ? answer.getAnsweredAt() : null)
                    .isCorrect(answer != null ? answer.getIsCorrect() : null)
                    .marksAwarded(answer != null ? answer.getMarksAwarded() : null)
                    .correctAnswer(revealKey ? q.getCorrectAnswer() : null)
                    .explanation(revealKey ? q.getExplanation() : null)
                    .build());
        }

        return AttemptResultDto.builder()
                .attempt(AttemptSummaryDto.from(attempt))
                .assessmentId(assessment.getId())
                .assessmentTitle(assessment.getTitle())
                .negativeMarking(assessment.getNegativeMarking())
                .passingMarks(assessment.getPassingMarks())
                .passed(passed(attempt, assessment))
                .answerKeyVisible(revealKey)
                .questions(questions)
                .build();
    }

    /** SUBMITTED attempts, best percentage first; ties go to the earlier submission. */
    @Transactional(readOnly = true)
    public List<AttemptSummaryDto> getAttemptsByAssessment(UUID assessmentId) {
        if (!assessmentRepository.existsById(assessmentId)) {
            throw new ResourceNotFoundException("Assessment", assessmentId.toString());
        }
        List<Attempt> ranked = attemptRepository.findSubmittedRanked(assessmentId);
        List<AttemptSummaryDto> result = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            AttemptSummaryDto dto = AttemptSummaryDto.from(ranked.get(i));
            dto.setRank(i + 1);
            result.add(dto);
        }
        return result;
    }

    private Boolean passed(Attempt attempt, Assessment assessment) {
        if (attempt.getStatus() != Attempt.AttemptStatus.SUBMITTED || assessment.getPassingMarks() == null
                || attempt.getTotalScore() == null) {
            return null;
        }
        return attempt.getTotalScore() >= assessment.getPassingMarks();
    }
}
