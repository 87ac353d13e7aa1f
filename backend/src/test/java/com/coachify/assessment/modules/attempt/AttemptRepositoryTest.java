package com.coachify.assessment.modules.attempt;

import com.coachify.assessment.modules.answer.Answer;
import com.coachify.assessment.modules.answer.AnswerRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.TestPropertySource;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@DisplayName("Attempt and Answer repositories")
class AttemptRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private AttemptRepository attemptRepository;

    @Autowired
    private AnswerRepository answerRepository;

    private final UUID assessmentId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();

    @Test
    @DisplayName("markSubmitted finalises an open attempt exactly once")
    void markSubmitted_onlyOnce() {
        Attempt open = entityManager.persistFlushFind(attempt(userId, Attempt.AttemptStatus.IN_PROGRESS, null, null));

        int first = attemptRepository.markSubmitted(open.getId(), T0.plusSeconds(60), 4.0, 5.0, 80.0, 2, 0, 1);
        int second = attemptRepository.markSubmitted(open.getId(), T0.plusSeconds(120), 0.0, 5.0, 0.0, 0, 2, 1);

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();

        Attempt stored = attemptRepository.findById(open.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(Attempt.AttemptStatus.SUBMITTED);
        assertThat(stored.getTotalScore()).isEqualTo(4.0);
        assertThat(stored.getPercentage()).isEqualTo(80.0);
        assertThat(stored.getSubmittedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(stored.getSkippedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("share-locked lookup returns the current status")
    void findByIdForShare_readsStatus() {
        Attempt open = entityManager.persistFlushFind(attempt(userId, Attempt.AttemptStatus.IN_PROGRESS, null, null));
        attemptRepository.markSubmitted(open.getId(), T0.plusSeconds(60), 1.0, 1.0, 100.0, 1, 0, 0);

        Attempt locked = attemptRepository.findByIdForShare(open.getId()).orElseThrow();

        assertThat(locked.getStatus()).isEqualTo(Attempt.AttemptStatus.SUBMITTED);
    }

    @Test
    @DisplayName("ranking orders by percentage, then earlier submission")
    void findSubmittedRanked_order() {
        Attempt late = entityManager.persist(attempt(UUID.randomUUID(), Attempt.AttemptStatus.SUBMITTED, 75.0,
                T0.plusSeconds(300)));
        Attempt early = entityManager.persist(attempt(UUID.randomUUID(), Attempt.AttemptStatus.SUBMITTED, 75.0,
                T0.plusSeconds(100)));
        Attempt best = entityManager.persist(attempt(UUID.randomUUID(), Attempt.AttemptStatus.SUBMITTED, 92.5,
                T0.plusSeconds(500)));
        entityManager.persist(attempt(UUID.randomUUID(), Attempt.AttemptStatus.IN_PROGRESS, null, null));
        entityManager.flush();

        List<Attempt> ranked = attemptRepository.findSubmittedRanked(assessmentId);

        assertThat(ranked).extracting(Attempt::getId).containsExactly(best.getId(), early.getId(), late.getId());
    }

    @Test
    @DisplayName("submitted attempts are counted per user")
    void countSubmitted_perUser() {
        entityManager.persist(attempt(userId, Attempt.AttemptStatus.SUBMITTED, 50.0, T0));
        entityManager.persist(attempt(userId, Attempt.AttemptStatus.IN_PROGRESS, null, null));
        entityManager.persist(attempt(UUID.randomUUID(), Attempt.AttemptStatus.SUBMITTED, 60.0, T0));
        entityManager.flush();

        assertThat(attemptRepository.countByAssessmentIdAndUserIdAndStatus(assessmentId, userId,
                Attempt.AttemptStatus.SUBMITTED)).isEqualTo(1);
        assertThat(attemptRepository.findFirstByAssessmentIdAndUserIdAndStatus(assessmentId, userId,
                Attempt.AttemptStatus.IN_PROGRESS)).isPresent();
    }

    @Test
    @DisplayName("applyOutcome updates only the listed answers of the attempt")
    void applyOutcome_targetsListedQuestions() {
        Attempt open = entityManager.persist(attempt(userId, Attempt.AttemptStatus.IN_PROGRESS, null, null));
        UUID q1 = UUID.randomUUID();
        UUID q2 = UUID.randomUUID();
        UUID q3 = UUID.randomUUID();
        entityManager.persist(answer(open.getId(), q1));
        entityManager.persist(answer(open.getId(), q2));
        entityManager.persist(answer(open.getId(), q3));
        entityManager.flush();

        int updated = answerRepository.applyOutcome(open.getId(), List.of(q1, q3), false, -0.5);
        entityManager.clear();

        assertThat(updated).isEqualTo(2);
        List<Answer> answers = answerRepository.findByAttemptId(open.getId());
        assertThat(answers).filteredOn(a -> a.getQuestionId().equals(q2))
                .singleElement()
                .satisfies(a -> assertThat(a.getIsCorrect()).isNull());
        assertThat(answers).filteredOn(a -> !a.getQuestionId().equals(q2))
                .allSatisfy(a -> {
                    assertThat(a.getIsCorrect()).isFalse();
                    assertThat(a.getMarksAwarded()).isEqualTo(-0.5);
                });
    }

    @Test
    @DisplayName("deleting by assessment removes answers through their attempts")
    void deleteByAssessment_removesAnswersAndAttempts() {
        Attempt open = entityManager.persist(attempt(userId, Attempt.AttemptStatus.IN_PROGRESS, null, null));
        entityManager.persist(answer(open.getId(), UUID.randomUUID()));
        entityManager.flush();

        assertThat(answerRepository.deleteByAssessmentId(assessmentId)).isEqualTo(1);
        assertThat(attemptRepository.deleteByAssessmentId(assessmentId)).isEqualTo(1);
        assertThat(answerRepository.findByAttemptId(open.getId())).isEmpty();
    }

    private Attempt attempt(UUID user, Attempt.AttemptStatus status, Double percentage, Instant submittedAt) {
        return Attempt.builder()
                .assessmentId(assessmentId)
                .userId(user)
                .status(status)
                .startedAt(T0)
                .submittedAt(submittedAt)
                .percentage(percentage)
                .build();
    }

    private Answer answer(UUID attemptId, UUID questionId) {
        return Answer.builder()
                .attemptId(attemptId)
                .questionId(questionId)
                .answeredAt(T0)
                .build();
    }
}
