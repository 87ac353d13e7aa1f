package com.coachify.assessment.modules.grading;

import com.coachify.assessment.modules.question.Question;
import com.coachify.assessment.modules.question.payload.AnswerPayload;
import com.coachify.assessment.modules.question.payload.NatAnswer;
import org.springframework.stereotype.Component;

/** Inclusive tolerance: |correct - submitted| <= tolerance. */
@Component
public class NatAnswerMatcher implements AnswerMatcher {

    @Override
    public Question.QuestionType supportedType() {
        return Question.QuestionType.NAT;
    }

    @Override
    public boolean matches(AnswerPayload key, AnswerPayload answer) {
        if (!(key instanceof NatAnswer correct) || !(answer instanceof NatAnswer submitted)) {
            return false;
        }
        if (correct.value() == null || submitted.value() == null) {
            return false;
        }
        return Math.abs(correct.value() - submitted.value()) <= correct.toleranceOrZero();
    }
}
