package com.coachify.assessment.modules.attempt;

import com.coachify.assessment.modules.attempt.dto.AttemptSummaryDto;
import com.coachify.assessment.modules.attempt.dto.StartAttemptResponse;
import com.coachify.assessment.modules.result.dto.AttemptResultDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/assessments")
@RequiredArgsConstructor
@Tag(name = "Attempts", description = "Start, submit and review assessment attempts")
public class AttemptController {

    private final AttemptService attemptService;

    @PostMapping("/{assessmentId}/start")
    @PreAuthorize("hasRole('STUDENT')")
    @Operation(summary = "Start a new attempt or resume the open one")
    public ResponseEntity<StartAttemptResponse> startAttempt(@PathVariable UUID assessmentId) {
        return ResponseEntity.ok(attemptService.startAttempt(assessmentId));
    }

    @PostMapping("/attempts/{attemptId}/submit")
    @PreAuthorize("hasRole('STUDENT')")
    @Operation(summary = "Submit an attempt for grading")
    public ResponseEntity<AttemptSummaryDto> submitAttempt(@PathVariable UUID attemptId) {
        return ResponseEntity.ok(attemptService.submitAttempt(attemptId));
    }

    @GetMapping("/attempts/{attemptId}/result")
    @Operation(summary = "Get the per-question result of an attempt")
    public ResponseEntity<AttemptResultDto> getResult(@PathVariable UUID attemptId) {
        return ResponseEntity.ok(attemptService.getAttemptResult(attemptId));
    }

    @GetMapping("/{assessmentId}/attempts")
    @PreAuthorize("hasAnyRole('TEACHER', 'ADMIN')")
    @Operation(summary = "Leaderboard of submitted attempts (Teacher/Admin)")
    public ResponseEntity<List<AttemptSummaryDto>> getAttempts(@PathVariable UUID assessmentId) {
        return ResponseEntity.ok(attemptService.getAttemptsByAssessment(assessmentId));
    }
}
