package com.coachify.assessment.modules.answer;

import com.coachify.assessment.config.SecurityConfig;
import com.coachify.assessment.exception.AlreadySubmittedException;
import com.coachify.assessment.modules.answer.dto.SavedAnswerDto;
import com.coachify.assessment.modules.question.payload.MsqAnswer;
import com.coachify.assessment.modules.question.payload.NatAnswer;
import com.coachify.assessment.security.JwtTokenProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnswerController.class)
@Import(SecurityConfig.class)
@DisplayName("AnswerController")
class AnswerControllerTest {

    private static final UUID ATTEMPT_ID = UUID.fromString("20000000-0000-0000-0000-000000000002");
    private static final UUID QUESTION_ID = UUID.fromString("30000000-0000-0000-0000-000000000003");
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AnswerJournal answerJournal;

    @MockitoBean
    private JwtTokenProvider jwtTokenProvider;

    @Test
    @DisplayName("POST /answer: tagged MSQ payload is decoded and saved")
    @WithMockUser(roles = "STUDENT")
    void saveAnswer_msq() throws Exception {
        MsqAnswer answer = new MsqAnswer(List.of("A", "C"));
        when(answerJournal.saveAnswer(ATTEMPT_ID, QUESTION_ID, answer))
                .thenReturn(new SavedAnswerDto(QUESTION_ID, answer, NOW));

        mockMvc.perform(post("/api/assessments/attempts/{id}/answer", ATTEMPT_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionId\":\"" + QUESTION_ID
                                + "\",\"answer\":{\"kind\":\"MSQ\",\"optionIds\":[\"A\",\"C\"]}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer.kind").value("MSQ"))
                .andExpect(jsonPath("$.answer.optionIds[1]").value("C"));
    }

    @Test
    @DisplayName("POST /answer: NAT payload without tolerance is accepted")
    @WithMockUser(roles = "STUDENT")
    void saveAnswer_nat() throws Exception {
        NatAnswer answer = new NatAnswer(9.81);
        when(answerJournal.saveAnswer(ATTEMPT_ID, QUESTION_ID, answer))
                .thenReturn(new SavedAnswerDto(QUESTION_ID, answer, NOW));

        mockMvc.perform(post("/api/assessments/attempts/{id}/answer", ATTEMPT_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionId\":\"" + QUESTION_ID + "\",\"answer\":{\"kind\":\"NAT\",\"value\":9.81}}"))
                .andExpect(status().isOk());

        verify(answerJournal).saveAnswer(eq(ATTEMPT_ID), eq(QUESTION_ID), eq(answer));
    }

    @Test
    @DisplayName("POST /answer: unknown kind is a malformed body")
    @WithMockUser(roles = "STUDENT")
    void saveAnswer_unknownKind_badRequest() throws Exception {
        mockMvc.perform(post("/api/assessments/attempts/{id}/answer", ATTEMPT_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionId\":\"" + QUESTION_ID + "\",\"answer\":{\"kind\":\"ESSAY\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
        verifyNoInteractions(answerJournal);
    }

    @Test
    @DisplayName("POST /answer: missing question id fails validation")
    @WithMockUser(roles = "STUDENT")
    void saveAnswer_missingQuestion_badRequest() throws Exception {
        mockMvc.perform(post("/api/assessments/attempts/{id}/answer", ATTEMPT_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":{\"kind\":\"MCQ\",\"optionId\":\"A\"}}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(answerJournal);
    }

    @Test
    @DisplayName("POST /answer: writing to a submitted attempt maps to 409")
    @WithMockUser(roles = "STUDENT")
    void saveAnswer_afterSubmit_conflict() throws Exception {
        when(answerJournal.saveAnswer(eq(ATTEMPT_ID), eq(QUESTION_ID), any()))
                .thenThrow(new AlreadySubmittedException(ATTEMPT_ID));

        mockMvc.perform(post("/api/assessments/attempts/{id}/answer", ATTEMPT_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionId\":\"" + QUESTION_ID + "\",\"answer\":{\"kind\":\"MCQ\",\"optionId\":\"A\"}}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("GET /answers: returns saved answers")
    @WithMockUser(roles = "STUDENT")
    void getAnswers_ok() throws Exception {
        when(answerJournal.getSavedAnswers(ATTEMPT_ID))
                .thenReturn(List.of(new SavedAnswerDto(QUESTION_ID, new NatAnswer(1.5), NOW)));

        mockMvc.perform(get("/api/assessments/attempts/{id}/answers", ATTEMPT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].questionId").value(QUESTION_ID.toString()))
                .andExpect(jsonPath("$[0].answer.value").value(1.5));
    }
}
