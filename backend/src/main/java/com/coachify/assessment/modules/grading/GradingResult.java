package com.coachify.assessment.modules.grading;

import java.util.List;

public record GradingResult(double totalScore, double maxScore, double percentage, int correctCount,
        int wrongCount, int skippedCount, List<QuestionOutcome> outcomes) {
}
