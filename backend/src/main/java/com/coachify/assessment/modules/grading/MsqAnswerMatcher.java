package com.coachify.assessment.modules.grading;

import com.coachify.assessment.modules.question.Question;
import com.coachify.assessment.modules.question.payload.AnswerPayload;
import com.coachify.assessment.modules.question.payload.MsqAnswer;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Exact set equality: no partial credit, order and duplicates ignored. */
@Component
public class MsqAnswerMatcher implements AnswerMatcher {

    @Override
    public Question.QuestionType supportedType() {
        return Question.QuestionType.MSQ;
    }

    @Override
    public boolean matches(AnswerPayload key, AnswerPayload answer) {
        if (!(key instanceof MsqAnswer correct) || !(answer instanceof MsqAnswer submitted)) {
            return false;
        }
        return toSet(correct.optionIds()).equals(toSet(submitted.optionIds()));
    }

    private Set<String> toSet(List<String> ids) {
        Set<String> set = new HashSet<>();
        if (ids != null) {
            ids.forEach(id -> set.add(String.valueOf(id)));
        }
        return set;
    }
}
