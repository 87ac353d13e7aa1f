package com.coachify.assessment.modules.assessment;

import com.coachify.assessment.modules.assessment.dto.AddQuestionsRequest;
import com.coachify.assessment.modules.assessment.dto.AssessmentDto;
import com.coachify.assessment.modules.assessment.dto.CreateAssessmentRequest;
import com.coachify.assessment.modules.assessment.dto.UpdateStatusRequest;
import com.coachify.assessment.modules.question.dto.QuestionDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Assessments", description = "Assessment and question authoring")
public class AssessmentController {

    private final AssessmentService assessmentService;

    @PostMapping("/coachings/{coachingId}/batches/{batchId}/assessments")
    @PreAuthorize("hasAnyRole('TEACHER', 'ADMIN')")
    @Operation(summary = "Create an assessment, optionally with questions (Teacher/Admin)")
    public ResponseEntity<AssessmentDto> create(@PathVariable UUID coachingId, @PathVariable UUID batchId,
            @Valid @RequestBody CreateAssessmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(assessmentService.create(coachingId, batchId, request));
    }

    @GetMapping("/coachings/{coachingId}/batches/{batchId}/assessments")
    @Operation(summary = "List a batch's assessments, newest first")
    public ResponseEntity<List<AssessmentDto>> listByBatch(@PathVariable UUID coachingId,
            @PathVariable UUID batchId) {
        return ResponseEntity.ok(assessmentService.listByBatch(batchId));
    }

    @GetMapping("/assessments/{assessmentId}")
    @Operation(summary = "Get assessment details with questions")
    public ResponseEntity<AssessmentDto> getById(@PathVariable UUID assessmentId) {
        return ResponseEntity.ok(assessmentService.getById(assessmentId));
    }

    @PatchMapping("/assessments/{assessmentId}/status")
    @PreAuthorize("hasAnyRole('TEACHER', 'ADMIN')")
    @Operation(summary = "Publish, close or revert an assessment to draft (Teacher/Admin)")
    public ResponseEntity<AssessmentDto> updateStatus(@PathVariable UUID assessmentId,
            @Valid @RequestBody UpdateStatusRequest request) {
        return ResponseEntity.ok(assessmentService.updateStatus(assessmentId, request.getStatus()));
    }

    @DeleteMapping("/assessments/{assessmentId}")
    @PreAuthorize("hasAnyRole('TEACHER', 'ADMIN')")
    @Operation(summary = "Delete an assessment with its questions and attempts (Teacher/Admin)")
    public ResponseEntity<Map<String, String>> delete(@PathVariable UUID assessmentId) {
        assessmentService.delete(assessmentId);
        return ResponseEntity.ok(Map.of("message", "Assessment deleted successfully"));
    }

    @PostMapping("/assessments/{assessmentId}/questions")
    @PreAuthorize("hasAnyRole('TEACHER', 'ADMIN')")
    @Operation(summary = "Append questions (Teacher/Admin)")
    public ResponseEntity<List<QuestionDto>> addQuestions(@PathVariable UUID assessmentId,
            @Valid @RequestBody AddQuestionsRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(assessmentService.addQuestions(assessmentId, request.getQuestions()));
    }

    @DeleteMapping("/assessments/questions/{questionId}")
    @PreAuthorize("hasAnyRole('TEACHER', 'ADMIN')")
    @Operation(summary = "Delete a question (Teacher/Admin)")
    public ResponseEntity<Map<String, String>> deleteQuestion(@PathVariable UUID questionId) {
        assessmentService.deleteQuestion(questionId);
        return ResponseEntity.ok(Map.of("message", "Question deleted successfully"));
    }
}
