package com.coachify.assessment.modules.question.payload;

import com.coachify.assessment.modules.question.Question;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Type-tagged answer value, used both for a question's answer key and for a
 * student's submitted answer. Serialised with a {@code kind} discriminator:
 * <pre>
 * {"kind":"MCQ","optionId":"B"}
 * {"kind":"MSQ","optionIds":["A","C"]}
 * {"kind":"NAT","value":9.81,"tolerance":0.05}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = McqAnswer.class, name = "MCQ"),
        @JsonSubTypes.Type(value = MsqAnswer.class, name = "MSQ"),
        @JsonSubTypes.Type(value = NatAnswer.class, name = "NAT")
})
public sealed interface AnswerPayload permits McqAnswer, MsqAnswer, NatAnswer {

    @JsonIgnore
    Question.QuestionType kind();
}
