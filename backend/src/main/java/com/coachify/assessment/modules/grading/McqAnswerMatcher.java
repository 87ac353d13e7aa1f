package com.coachify.assessment.modules.grading;

import com.coachify.assessment.modules.question.Question;
import com.coachify.assessment.modules.question.payload.AnswerPayload;
import com.coachify.assessment.modules.question.payload.McqAnswer;
import org.springframework.stereotype.Component;

import java.util.Objects;

@Component
public class McqAnswerMatcher implements AnswerMatcher {

    @Override
    public Question.QuestionType supportedType() {
        return Question.QuestionType.MCQ;
    }

    @Override
    public boolean matches(AnswerPayload key, AnswerPayload answer) {
        if (!(key instanceof McqAnswer correct) || !(answer instanceof McqAnswer submitted)) {
            return false;
        }
        return correct.optionId() != null && Objects.equals(correct.optionId(), submitted.optionId());
    }
}
