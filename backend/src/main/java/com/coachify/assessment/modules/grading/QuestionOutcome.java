package com.coachify.assessment.modules.grading;

import java.util.UUID;

/** Verdict for one question. Skipped questions are recorded as incorrect with zero marks. */
public record QuestionOutcome(UUID questionId, boolean answered, boolean correct, double marksAwarded) {

    static QuestionOutcome skipped(UUID questionId) {
        return new QuestionOutcome(questionId, false, false, 0.0);
    }
}
