package com.coachify.assessment.modules.assessment;

import com.coachify.assessment.exception.BusinessException;
import com.coachify.assessment.exception.ResourceNotFoundException;
import com.coachify.assessment.modules.answer.AnswerRepository;
import com.coachify.assessment.modules.assessment.dto.AssessmentDto;
import com.coachify.assessment.modules.assessment.dto.CreateAssessmentRequest;
import com.coachify.assessment.modules.attempt.Attempt;
import com.coachify.assessment.modules.attempt.AttemptRepository;
import com.coachify.assessment.modules.attempt.dto.AttemptSummaryDto;
import com.coachify.assessment.modules.question.AnswerPayloadValidator;
import com.coachify.assessment.modules.question.Question;
import com.coachify.assessment.modules.question.QuestionRepository;
import com.coachify.assessment.modules.question.dto.CreateQuestionRequest;
import com.coachify.assessment.modules.question.dto.QuestionDto;
import com.coachify.assessment.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class AssessmentService {

    private final AssessmentRepository assessmentRepository;
    private final QuestionRepository questionRepository;
    private final AttemptRepository attemptRepository;
    private final AnswerRepository answerRepository;
    private final AnswerPayloadValidator payloadValidator;
    private final ApplicationEventPublisher eventPublisher;
    private final SecurityUtils securityUtils;
    private final Clock clock;

    /**
     * Creates an assessment, optionally with its questions. Supplying questions
     * publishes it straight away; otherwise it starts as a DRAFT.
     */
    @Transactional
    public AssessmentDto create(UUID coachingId, UUID batchId, CreateAssessmentRequest request) {
        if (request.getStartTime() != null && request.getEndTime() != null
                && !request.getEndTime().isAfter(request.getStartTime())) {
            throw new BusinessException("End time must be after start time");
        }
        List<CreateQuestionRequest> questionRequests = request.getQuestions() != null
                ? request.getQuestions()
                : List.of();
        questionRequests.forEach(payloadValidator::validateQuestion);

        boolean publish = !questionRequests.isEmpty();
        int totalMarks = questionRequests.stream().mapToInt(AssessmentService::marksOf).sum();
        if (request.getPassingMarks() != null && publish && request.getPassingMarks() > totalMarks) {
            throw new BusinessException("Passing marks cannot exceed total marks");
        }

        Assessment assessment = Assessment.builder()
                .coachingId(coachingId)
                .batchId(batchId)
                .createdById(securityUtils.getCurrentUserId())
                .title(request.getTitle())
                .description(request.getDescription())
                .type(request.getType() != null ? request.getType() : Assessment.AssessmentType.QUIZ)
                .durationMinutes(request.getDurationMinutes())
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .totalMarks(totalMarks)
                .passingMarks(request.getPassingMarks())
                .shuffleQuestions(valueOr(request.getShuffleQuestions(), false))
                .shuffleOptions(valueOr(request.getShuffleOptions(), false))
                .showResultAfter(request.getShowResultAfter() != null
                        ? request.getShowResultAfter()
                        : Assessment.ResultRelease.SUBMIT)
                .maxAttempts(valueOr(request.getMaxAttempts(), 1))
                .negativeMarking(valueOr(request.getNegativeMarking(), 0.0))
                .status(publish ? Assessment.AssessmentStatus.PUBLISHED : Assessment.AssessmentStatus.DRAFT)
                .build();
        assessment = assessmentRepository.save(assessment);

        List<Question> questions = new ArrayList<>();
        for (int i = 0; i < questionRequests.size(); i++) {
            CreateQuestionRequest q = questionRequests.get(i);
            questions.add(toEntity(assessment, q, orderIndexOf(q, i)));
        }
        questions = questionRepository.saveAll(questions);

        log.info("Assessment created: id={} batch={} status={} questions={}", assessment.getId(), batchId,
                assessment.getStatus(), questions.size());
        if (publish) {
            publishEvent(assessment, questions.size());
        }

        AssessmentDto dto = AssessmentDto.from(assessment);
        dto.setQuestionCount((long) questions.size());
        dto.setQuestions(questions.stream().map(q -> QuestionDto.from(q, true)).collect(Collectors.toList()));
        return dto;
    }

    /** Newest first. Students only see published or closed assessments, each with their own attempts. */
    @Transactional(readOnly = true)
    public List<AssessmentDto> listByBatch(UUID batchId) {
        boolean staff = securityUtils.isStaff();
        List<Assessment> assessments = assessmentRepository.findByBatchIdOrderByCreatedAtDesc(batchId).stream()
                .filter(a -> staff || a.getStatus() != Assessment.AssessmentStatus.DRAFT)
                .collect(Collectors.toList());
        if (assessments.isEmpty()) {
            return List.of();
        }

        List<UUID> ids = assessments.stream().map(Assessment::getId).collect(Collectors.toList());
        Map<UUID, Long> counts = buildQuestionCountMap(ids);

        Map<UUID, List<AttemptSummaryDto>> myAttempts = new HashMap<>();
        if (!staff) {
            UUID userId = securityUtils.getCurrentUserId();
            for (Attempt attempt : attemptRepository.findByAssessmentIdInAndUserIdOrderByStartedAtDesc(ids, userId)) {
                myAttempts.computeIfAbsent(attempt.getAssessmentId(), k -> new ArrayList<>())
                        .add(AttemptSummaryDto.from(attempt));
            }
        }

        return assessments.stream().map(a -> {
            AssessmentDto dto = AssessmentDto.from(a);
            dto.setQuestionCount(counts.getOrDefault(a.getId(), 0L));
            if (!staff) {
                dto.setMyAttempts(myAttempts.getOrDefault(a.getId(), List.of()));
            }
            return dto;
        }).collect(Collectors.toList());
    }

    /** Questions in order; the answer key is only included for teachers and admins. */
    @Transactional(readOnly = true)
    public AssessmentDto getById(UUID assessmentId) {
        Assessment assessment = findAssessment(assessmentId);
        boolean staff = securityUtils.isStaff();
        if (!staff && assessment.getStatus() == Assessment.AssessmentStatus.DRAFT) {
            throw new ResourceNotFoundException("Assessment", assessmentId.toString());
        }

        List<QuestionDto> questions = questionRepository.findByAssessmentIdOrderByOrderIndexAsc(assessmentId)
                .stream()
                .map(q -> QuestionDto.from(q, staff))
                .collect(Collectors.toList());
        AssessmentDto dto = AssessmentDto.from(assessment);
        dto.setQuestionCount((long) questions.size());
        dto.setQuestions(questions);
        return dto;
    }

    /**
     * Changes only the status column. totalMarks belongs to the question edits,
     * which hold the same row lock.
     */
    @Transactional
    public AssessmentDto updateStatus(UUID assessmentId, Assessment.AssessmentStatus status) {
        Assessment assessment = lockAssessment(assessmentId);
        Assessment.AssessmentStatus previous = assessment.getStatus();
        long questionCount = questionRepository.countByAssessmentId(assessmentId);

        if (status == Assessment.AssessmentStatus.PUBLISHED && questionCount == 0) {
            throw new BusinessException("Assessment must have at least one question before publishing");
        }

        assessmentRepository.changeStatus(assessmentId, status, clock.instant());
        assessment.setStatus(status);
        log.info("Assessment {} status: {} -> {}", assessmentId, previous, status);

        if (status == Assessment.AssessmentStatus.PUBLISHED && previous != Assessment.AssessmentStatus.PUBLISHED) {
            publishEvent(assessment, questionCount);
        }

        AssessmentDto dto = AssessmentDto.from(assessment);
        dto.setQuestionCount(questionCount);
        return dto;
    }

    /** Removes the assessment with its answers, attempts and questions. */
    @Transactional
    public void delete(UUID assessmentId) {
        Assessment assessment = lockAssessment(assessmentId);
        int answers = answerRepository.deleteByAssessmentId(assessmentId);
        int attempts = attemptRepository.deleteByAssessmentId(assessmentId);
        int questions = questionRepository.deleteByAssessmentId(assessmentId);
        assessmentRepository.delete(assessment);
        log.info("Assessment deleted: id={} (questions={}, attempts={}, answers={})", assessmentId, questions,
                attempts, answers);
    }

    /**
     * Appends questions after the current last one and recomputes totalMarks.
     * An explicit orderIndex on a request is kept as given.
     * The assessment row stays locked until commit.
     */
    @Transactional
    public List<QuestionDto> addQuestions(UUID assessmentId, List<CreateQuestionRequest> requests) {
        Assessment assessment = lockAssessment(assessmentId);
        requests.forEach(payloadValidator::validateQuestion);

        int startIndex = questionRepository.findMaxOrderIndex(assessmentId).map(max -> max + 1).orElse(0);
        List<Question> questions = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            CreateQuestionRequest request = requests.get(i);
            questions.add(toEntity(assessment, request, orderIndexOf(request, startIndex + i)));
        }
        questions = questionRepository.saveAll(questions);
        questionRepository.flush();

        int totalMarks = recomputeTotalMarks(assessmentId);
        log.info("Added {} questions to assessment {} (totalMarks={})", questions.size(), assessmentId, totalMarks);
        return questions.stream().map(q -> QuestionDto.from(q, true)).collect(Collectors.toList());
    }

    @Transactional
    public void deleteQuestion(UUID questionId) {
        Question question = questionRepository.findById(questionId)
                .orElseThrow(() -> new ResourceNotFoundException("Question", questionId.toString()));
        UUID assessmentId = question.getAssessment().getId();
        lockAssessment(assessmentId);

        answerRepository.deleteByQuestionId(questionId);
        questionRepository.delete(question);
        questionRepository.flush();

        int totalMarks = recomputeTotalMarks(assessmentId);
        log.info("Deleted question {} from assessment {} (totalMarks={})", questionId, assessmentId, totalMarks);
    }

    private int recomputeTotalMarks(UUID assessmentId) {
        int totalMarks = Math.toIntExact(questionRepository.sumMarks(assessmentId));
        assessmentRepository.updateTotalMarks(assessmentId, totalMarks);
        return totalMarks;
    }

    private void publishEvent(Assessment assessment, long questionCount) {
        eventPublisher.publishEvent(new AssessmentPublishedEvent(assessment.getId(), assessment.getCoachingId(),
                assessment.getBatchId(), assessment.getTitle(), assessment.getType(), questionCount));
    }

    private Question toEntity(Assessment assessment, CreateQuestionRequest request, int orderIndex) {
        return Question.builder()
                .assessment(assessment)
                .type(request.getType())
                .prompt(request.getQuestion())
                .imageUrl(request.getImageUrl())
                .options(request.getOptions())
                .correctAnswer(request.getCorrectAnswer())
                .marks(marksOf(request))
                .orderIndex(orderIndex)
                .explanation(request.getExplanation())
                .build();
    }

    private Assessment findAssessment(UUID assessmentId) {
        return assessmentRepository.findById(assessmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assessment", assessmentId.toString()));
    }

    private Assessment lockAssessment(UUID assessmentId) {
        return assessmentRepository.findByIdForUpdate(assessmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assessment", assessmentId.toString()));
    }

    private Map<UUID, Long> buildQuestionCountMap(List<UUID> assessmentIds) {
        Map<UUID, Long> counts = new HashMap<>();
        for (Object[] row : questionRepository.countByAssessmentIds(assessmentIds)) {
            counts.put((UUID) row[0], (Long) row[1]);
        }
        return counts;
    }

    private static int marksOf(CreateQuestionRequest request) {
        return request.getMarks() != null ? request.getMarks() : 1;
    }

    private static int orderIndexOf(CreateQuestionRequest request, int fallback) {
        return request.getOrderIndex() != null ? request.getOrderIndex() : fallback;
    }

    private static <T> T valueOr(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
