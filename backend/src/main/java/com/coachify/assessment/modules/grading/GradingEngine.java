package com.coachify.assessment.modules.grading;

import com.coachify.assessment.modules.question.Question;
import com.coachify.assessment.modules.question.payload.AnswerPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Scores a submission. A pure function of its arguments: no repositories, no
 * clock, no side effects.
 */
@Slf4j
@Component
public class GradingEngine {

    private final Map<Question.QuestionType, AnswerMatcher> matchers = new EnumMap<>(Question.QuestionType.class);

    public GradingEngine(List<AnswerMatcher> matcherList) {
        for (AnswerMatcher matcher : matcherList) {
            AnswerMatcher previous = matchers.put(matcher.supportedType(), matcher);
            if (previous != null) {
                throw new IllegalStateException("Duplicate answer matcher for " + matcher.supportedType());
            }
        }
    }

    /**
     * @param questions            every question of the assessment, in order
     * @param answers              submitted answers keyed by question id; a
     *                             missing key means the question was skipped
     * @param negativeMarkingRatio fraction of a question's marks deducted for a
     *                             wrong answer
     */
    public GradingResult grade(List<Question> questions, Map<UUID, AnswerPayload> answers,
            double negativeMarkingRatio) {
        double total = 0;
        double maxScore = 0;
        int correct = 0;
        int wrong = 0;
        int skipped = 0;
        List<QuestionOutcome> outcomes = new ArrayList<>(questions.size());

        for (Question question : questions) {
            int marks = question.getMarks() != null ? question.getMarks() : 1;
            maxScore += marks;

            AnswerPayload answer = answers.get(question.getId());
            if (answer == null) {
                skipped++;
                outcomes.add(QuestionOutcome.skipped(question.getId()));
                continue;
            }

            if (isCorrect(question, answer)) {
                correct++;
                total += marks;
                outcomes.add(new QuestionOutcome(question.getId(), true, true, marks));
            } else {
                wrong++;
                double penalty = negativeMarkingRatio * marks;
                total -= penalty;
                // 0.0 - 0.0 is -0.0; keep zero penalties on one outcome key
                outcomes.add(new QuestionOutcome(question.getId(), true, false, penalty == 0 ? 0.0 : -penalty));
            }
        }

        double totalScore = Math.max(0, total);
        double percentage = maxScore > 0 ? Math.round(totalScore / maxScore * 10000) / 100.0 : 0;
        log.debug("Graded {} questions: correct={} wrong={} skipped={} raw={} total={}/{}",
                questions.size(), correct, wrong, skipped, total, totalScore, maxScore);
        return new GradingResult(totalScore, maxScore, percentage, correct, wrong, skipped, outcomes);
    }

    private boolean isCorrect(Question question, AnswerPayload answer) {
        if (question.getType() == null || question.getCorrectAnswer() == null) {
            return false;
        }
        AnswerMatcher matcher = matchers.get(question.getType());
        return matcher != null && matcher.matches(question.getCorrectAnswer(), answer);
    }
}
