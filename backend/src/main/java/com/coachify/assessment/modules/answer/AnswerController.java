package com.coachify.assessment.modules.answer;

import com.coachify.assessment.modules.answer.dto.SaveAnswerRequest;
import com.coachify.assessment.modules.answer.dto.SavedAnswerDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/assessments/attempts/{attemptId}")
@RequiredArgsConstructor
@Tag(name = "Answers", description = "Autosave answers during an attempt")
public class AnswerController {

    private final AnswerJournal answerJournal;

    @PostMapping("/answer")
    @Operation(summary = "Save (upsert) an answer for one question")
    public ResponseEntity<SavedAnswerDto> saveAnswer(@PathVariable UUID attemptId,
            @Valid @RequestBody SaveAnswerRequest request) {
        return ResponseEntity.ok(answerJournal.saveAnswer(attemptId, request.getQuestionId(), request.getAnswer()));
    }

    @GetMapping("/answers")
    @Operation(summary = "Get all saved answers for an attempt")
    public ResponseEntity<List<SavedAnswerDto>> getAnswers(@PathVariable UUID attemptId) {
        return ResponseEntity.ok(answerJournal.getSavedAnswers(attemptId));
    }
}
