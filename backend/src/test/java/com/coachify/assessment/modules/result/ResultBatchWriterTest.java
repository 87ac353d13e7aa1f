package com.coachify.assessment.modules.result;

import com.coachify.assessment.exception.AlreadySubmittedException;
import com.coachify.assessment.modules.answer.AnswerRepository;
import com.coachify.assessment.modules.attempt.Attempt;
import com.coachify.assessment.modules.attempt.AttemptRepository;
import com.coachify.assessment.modules.grading.GradingResult;
import com.coachify.assessment.modules.grading.QuestionOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResultBatchWriter")
class ResultBatchWriterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private AttemptRepository attemptRepository;

    @Mock
    private AnswerRepository answerRepository;

    @InjectMocks
    private ResultBatchWriter writer;

    private final UUID attemptId = UUID.randomUUID();
    private final UUID q1 = UUID.randomUUID();
    private final UUID q2 = UUID.randomUUID();
    private final UUID q3 = UUID.randomUUID();
    private final UUID q4 = UUID.randomUUID();

    @Test
    @DisplayName("one bulk update per distinct outcome, then a conditional finalise")
    void write_groupsOutcomesAndFinalises() {
        when(attemptRepository.findById(attemptId)).thenReturn(Optional.of(attempt(Attempt.AttemptStatus.IN_PROGRESS)));
        when(attemptRepository.markSubmitted(eq(attemptId), eq(NOW), anyDouble(), anyDouble(), anyDouble(), anyInt(),
                anyInt(), anyInt())).thenReturn(1);

        GradingResult result = new GradingResult(4.5, 7, 64.29, 2, 1, 1, List.of(
                new QuestionOutcome(q1, true, true, 2),
                new QuestionOutcome(q2, true, true, 2),
                new QuestionOutcome(q3, true, false, -0.5),
                new QuestionOutcome(q4, false, false, 0.0)));

        writer.write(attemptId, result, NOW);

        verify(answerRepository).applyOutcome(attemptId, List.of(q1, q2), true, 2.0);
        verify(answerRepository).applyOutcome(attemptId, List.of(q3), false, -0.5);
        verify(answerRepository).applyOutcome(attemptId, List.of(q4), false, 0.0);
        verifyNoMoreInteractions(answerRepository);
        verify(attemptRepository).markSubmitted(attemptId, NOW, 4.5, 7, 64.29, 2, 1, 1);
    }

    @Test
    @DisplayName("already submitted attempt is rejected before any write")
    void write_alreadySubmitted_noWrites() {
        when(attemptRepository.findById(attemptId)).thenReturn(Optional.of(attempt(Attempt.AttemptStatus.SUBMITTED)));

        GradingResult result = new GradingResult(0, 1, 0, 0, 0, 1, List.of(new QuestionOutcome(q1, false, false, 0)));

        assertThatThrownBy(() -> writer.write(attemptId, result, NOW))
                .isInstanceOf(AlreadySubmittedException.class);
        verifyNoInteractions(answerRepository);
        verify(attemptRepository, never()).markSubmitted(any(), any(), anyDouble(), anyDouble(), anyDouble(),
                anyInt(), anyInt(), anyInt());
    }

    @Test
    @DisplayName("losing the conditional finalise raises AlreadySubmitted")
    void write_finaliseTouchesNoRow_throws() {
        when(attemptRepository.findById(attemptId)).thenReturn(Optional.of(attempt(Attempt.AttemptStatus.IN_PROGRESS)));
        when(attemptRepository.markSubmitted(eq(attemptId), eq(NOW), anyDouble(), anyDouble(), anyDouble(), anyInt(),
                anyInt(), anyInt())).thenReturn(0);

        GradingResult result = new GradingResult(1, 1, 100, 1, 0, 0, List.of(new QuestionOutcome(q1, true, true, 1)));

        assertThatThrownBy(() -> writer.write(attemptId, result, NOW))
                .isInstanceOf(AlreadySubmittedException.class);
    }

    @Test
    @DisplayName("zero-penalty wrong answers share a group with skipped questions")
    void groupByOutcome_mergesZeroGroups() {
        Map<ResultBatchWriter.OutcomeKey, List<UUID>> groups = ResultBatchWriter.groupByOutcome(List.of(
                new QuestionOutcome(q1, true, false, 0.0),
                new QuestionOutcome(q2, false, false, 0.0),
                new QuestionOutcome(q3, true, true, 1.0)));

        assertThat(groups).hasSize(2);
        assertThat(groups.get(new ResultBatchWriter.OutcomeKey(false, 0.0))).containsExactly(q1, q2);
        assertThat(groups.get(new ResultBatchWriter.OutcomeKey(true, 1.0))).containsExactly(q3);
    }

    private Attempt attempt(Attempt.AttemptStatus status) {
        return Attempt.builder()
                .id(attemptId)
                .assessmentId(UUID.randomUUID())
                .userId(UUID.randomUUID())
                .status(status)
                .startedAt(NOW.minusSeconds(600))
                .build();
    }
}
