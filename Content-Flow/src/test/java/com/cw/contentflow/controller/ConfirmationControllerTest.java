package com.cw.contentflow.controller;

import com.cw.contentflow.DTO.ExpansionResult;
import com.cw.contentflow.DTO.PlatformResult;
import com.cw.contentflow.service.DraftExpanderService;
import com.cw.contentflow.trace.TraceContext;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfirmationController.class)
class ConfirmationControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    DraftExpanderService draftExpanderService;

    @Test
    void handshakeRespondsWithChallengeOnly() throws Exception {
        when(draftExpanderService.handle(anyMap(), eq(false))).thenReturn(ExpansionResult.handshake("tok-42"));

        mockMvc.perform(post("/api/events/confirmation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"url_verification\",\"challenge\":\"tok-42\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.challenge").value("tok-42"))
                .andExpect(jsonPath("$.status").doesNotExist());
    }

    @Test
    void acceptedExpansionReturnsManifest() throws Exception {
        ExpansionResult accepted = ExpansionResult.builder()
                .status(ExpansionResult.Status.ACCEPTED)
                .topicTraceId("t1")
                .generatedCount(1)
                .results(List.of(
                        PlatformResult.builder().platform("twitter").traceId("t1-twitter")
                                .status(PlatformResult.Status.SUCCEEDED).docUrl("http://doc/t1-twitter").backend("LOCAL").build(),
                        PlatformResult.builder().platform("zhihu").traceId("t1-zhihu")
                                .status(PlatformResult.Status.FAILED).error("[generation] server error 503").build()))
                .build();
        when(draftExpanderService.handle(anyMap(), eq(true))).thenReturn(accepted);

        mockMvc.perform(post("/api/events/confirmation").param("force", "true")
                        .header(TraceContext.TRACE_HEADER, "inbound-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\":{\"Status\":\"confirm\",\"Title\":\"X Released\"}}"))
                .andExpect(status().isOk())
                .andExpect(header().string(TraceContext.TRACE_HEADER, "inbound-1"))
                .andExpect(header().exists(TraceContext.REQUEST_HEADER))
                .andExpect(jsonPath("$.status").value("ACCEPTED"))
                .andExpect(jsonPath("$.generatedCount").value(1))
                .andExpect(jsonPath("$.results[0].traceId").value("t1-twitter"))
                .andExpect(jsonPath("$.results[1].status").value("FAILED"))
                .andExpect(jsonPath("$.results[1].docUrl").doesNotExist());

        verify(draftExpanderService).handle(anyMap(), eq(true));
    }

    @Test
    void rejectedEventStillAnswers200() throws Exception {
        when(draftExpanderService.handle(anyMap(), eq(false))).thenReturn(ExpansionResult.rejected("missing_title"));

        mockMvc.perform(post("/api/events/confirmation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\":{\"Status\":\"confirm\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.reason").value("missing_title"));
    }

    @Test
    void unexpectedFailureMapsToErrorBody() throws Exception {
        when(draftExpanderService.handle(anyMap(), eq(false))).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/events/confirmation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fields\":{}}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("boom"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/events/confirmation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }
}
