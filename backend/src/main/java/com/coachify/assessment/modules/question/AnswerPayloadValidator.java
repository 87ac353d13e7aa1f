package com.coachify.assessment.modules.question;

import com.coachify.assessment.exception.InvalidAnswerException;
import com.coachify.assessment.modules.question.dto.CreateQuestionRequest;
import com.coachify.assessment.modules.question.payload.AnswerPayload;
import com.coachify.assessment.modules.question.payload.McqAnswer;
import com.coachify.assessment.modules.question.payload.MsqAnswer;
import com.coachify.assessment.modules.question.payload.NatAnswer;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Boundary checks for answer payloads. Everything that reaches the grading
 * engine has passed through here, so payload kinds always match question types.
 */
@Component
public class AnswerPayloadValidator {

    /** Validates an authored question: options shape and answer key. */
    public void validateQuestion(CreateQuestionRequest request) {
        Question.QuestionType type = request.getType();
        AnswerPayload key = request.getCorrectAnswer();
        requireKind(type, key, "Correct answer");

        switch (type) {
            case MCQ -> {
                Set<String> optionIds = requireOptions(request.getOptions());
                McqAnswer mcq = (McqAnswer) key;
                if (!StringUtils.hasText(mcq.optionId()) || !optionIds.contains(mcq.optionId())) {
                    throw new InvalidAnswerException("MCQ correct answer must reference one of the options");
                }
            }
            case MSQ -> {
                Set<String> optionIds = requireOptions(request.getOptions());
                MsqAnswer msq = (MsqAnswer) key;
                if (msq.optionIds() == null || msq.optionIds().isEmpty()) {
                    throw new InvalidAnswerException("MSQ must have at least one correct option");
                }
                if (!optionIds.containsAll(msq.optionIds())) {
                    throw new InvalidAnswerException("MSQ correct answer must only reference existing options");
                }
            }
            case NAT -> {
                NatAnswer nat = (NatAnswer) key;
                if (nat.value() == null || !Double.isFinite(nat.value())) {
                    throw new InvalidAnswerException("NAT correct answer must have a numeric value");
                }
                if (nat.tolerance() != null && (nat.tolerance() < 0 || !Double.isFinite(nat.tolerance()))) {
                    throw new InvalidAnswerException("NAT tolerance must be a non-negative number");
                }
            }
        }
    }

    /**
     * Validates a student's answer against the question it answers. Only shape
     * is checked here; correctness is decided at grading time.
     */
    public void validateSubmitted(Question question, AnswerPayload answer) {
        requireKind(question.getType(), answer, "Answer");

        switch (question.getType()) {
            case MCQ -> {
                String optionId = ((McqAnswer) answer).optionId();
                if (!StringUtils.hasText(optionId) || !optionIdsOf(question).contains(optionId)) {
                    throw new InvalidAnswerException("Unknown option for question " + question.getId());
                }
            }
            case MSQ -> {
                List<String> selected = ((MsqAnswer) answer).optionIds();
                if (selected == null || selected.stream().anyMatch(Objects::isNull)) {
                    throw new InvalidAnswerException("MSQ answer must be a list of option ids");
                }
                if (!optionIdsOf(question).containsAll(selected)) {
                    throw new InvalidAnswerException("Unknown option for question " + question.getId());
                }
            }
            case NAT -> {
                Double value = ((NatAnswer) answer).value();
                if (value == null || !Double.isFinite(value)) {
                    throw new InvalidAnswerException("NAT answer must be a finite number");
                }
            }
        }
    }

    private void requireKind(Question.QuestionType type, AnswerPayload payload, String label) {
        if (payload == null) {
            throw new InvalidAnswerException(label + " is required");
        }
        if (payload.kind() != type) {
            throw new InvalidAnswerException(
                    label + " of kind " + payload.kind() + " does not match question type " + type);
        }
    }

    private Set<String> requireOptions(List<QuestionOption> options) {
        if (options == null || options.size() < 2) {
            throw new InvalidAnswerException("Choice questions must have at least 2 options");
        }
        Set<String> ids = new HashSet<>();
        for (QuestionOption option : options) {
            if (option == null || !StringUtils.hasText(option.getId())) {
                throw new InvalidAnswerException("Each option must have a non-empty id");
            }
            if (!ids.add(option.getId())) {
                throw new InvalidAnswerException("Option ids must be unique, found duplicate: " + option.getId());
            }
        }
        return ids;
    }

    private Set<String> optionIdsOf(Question question) {
        if (question.getOptions() == null) {
            return Set.of();
        }
        return question.getOptions().stream().map(QuestionOption::getId).collect(Collectors.toSet());
    }
}
