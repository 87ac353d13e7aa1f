package com.coachify.assessment.modules.attempt;

import com.coachify.assessment.exception.ResourceNotFoundException;
import com.coachify.assessment.exception.UnauthorizedAccessException;
import com.coachify.assessment.modules.assessment.Assessment;
import com.coachify.assessment.modules.assessment.AssessmentRepository;
import com.coachify.assessment.modules.attempt.dto.AttemptSummaryDto;
import com.coachify.assessment.modules.attempt.dto.StartAttemptResponse;
import com.coachify.assessment.modules.result.ResultView;
import com.coachify.assessment.modules.result.dto.AttemptResultDto;
import com.coachify.assessment.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Binds attempt operations to the authenticated caller and applies result
 * visibility rules.
 */
@Service
@RequiredArgsConstructor
public class AttemptService {

    private final AttemptLifecycleManager lifecycleManager;
    private final ResultView resultView;
    private final AttemptRepository attemptRepository;
    private final AssessmentRepository assessmentRepository;
    private final SecurityUtils securityUtils;

    public StartAttemptResponse startAttempt(UUID assessmentId) {
        return lifecycleManager.startOrResume(assessmentId, securityUtils.getCurrentUserId());
    }

    public AttemptSummaryDto submitAttempt(UUID attemptId) {
        return AttemptSummaryDto.from(lifecycleManager.submitAttempt(attemptId, securityUtils.getCurrentUserId()));
    }

    /**
     * Staff always see the answer key. Owners see it once their attempt is
     * submitted, and only if the assessment releases results on submit.
     */
    @Transactional(readOnly = true)
    public AttemptResultDto getAttemptResult(UUID attemptId) {
        Attempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));

        boolean revealKey;
        if (securityUtils.isStaff()) {
            revealKey = true;
        } else {
            if (!attempt.getUserId().equals(securityUtils.getCurrentUserId())) {
                throw new UnauthorizedAccessException("Not your attempt");
            }
            Assessment assessment = assessmentRepository.findById(attempt.getAssessmentId())
                    .orElseThrow(() -> new ResourceNotFoundException("Assessment",
                            attempt.getAssessmentId().toString()));
            revealKey = attempt.getStatus() == Attempt.AttemptStatus.SUBMITTED
                    && assessment.getShowResultAfter() == Assessment.ResultRelease.SUBMIT;
        }
        return resultView.getAttemptResult(attemptId, revealKey);
    }

    public List<AttemptSummaryDto> getAttemptsByAssessment(UUID assessmentId) {
        return resultView.getAttemptsByAssessment(assessmentId);
    }
}
