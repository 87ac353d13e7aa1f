package com.coachify.assessment.modules.grading;

import com.coachify.assessment.modules.question.Question;
import com.coachify.assessment.modules.question.payload.AnswerPayload;

/**
 * Comparison rule for one question type. Implementations must be pure: same
 * key and answer, same verdict.
 */
public interface AnswerMatcher {

    Question.QuestionType supportedType();

    /**
     * @param key    the question's answer key, never null
     * @param answer the submitted answer, never null
     * @return true when the answer earns full marks; a payload of the wrong
     *         kind is never a match
     */
    boolean matches(AnswerPayload key, AnswerPayload answer);
}
