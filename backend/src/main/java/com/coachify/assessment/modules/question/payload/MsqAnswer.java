package com.coachify.assessment.modules.question.payload;

import com.coachify.assessment.modules.question.Question;

import java.util.List;

/** Selected option ids. Order and duplicates carry no meaning. */
public record MsqAnswer(List<String> optionIds) implements AnswerPayload {

    @Override
    public Question.QuestionType kind() {
        return Question.QuestionType.MSQ;
    }
}
