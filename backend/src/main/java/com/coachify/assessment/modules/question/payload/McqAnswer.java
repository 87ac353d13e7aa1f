package com.coachify.assessment.modules.question.payload;

import com.coachify.assessment.modules.question.Question;

public record McqAnswer(String optionId) implements AnswerPayload {

    @Override
    public Question.QuestionType kind() {
        return Question.QuestionType.MCQ;
    }
}
