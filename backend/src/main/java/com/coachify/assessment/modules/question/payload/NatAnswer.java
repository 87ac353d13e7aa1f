package com.coachify.assessment.modules.question.payload;

import com.coachify.assessment.modules.question.Question;

/**
 * Numeric answer. {@code tolerance} is only meaningful on an answer key and is
 * treated as 0 when absent.
 */
public record NatAnswer(Double value, Double tolerance) implements AnswerPayload {

    public NatAnswer(Double value) {
        this(value, null);
    }

    @Override
    public Question.QuestionType kind() {
        return Question.QuestionType.NAT;
    }

    public double toleranceOrZero() {
        return tolerance != null ? tolerance : 0.0;
    }
}
