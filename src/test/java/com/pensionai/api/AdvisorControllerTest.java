package com.pensionai.api;

import com.pensionai.orchestration.AdvisoryRunService;
import com.pensionai.orchestration.OrchestrationError;
import com.pensionai.orchestration.model.FinalResult;
import com.pensionai.orchestration.model.RequestContext;
import com.pensionai.orchestration.model.RunMetadata;
import com.pensionai.orchestration.model.RunSummary;
import com.pensionai.orchestration.model.Termination;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.junit.jupiter.api.Assertions.assertEquals;

@WebMvcTest(AdvisorController.class)
class AdvisorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AdvisoryRunService runService;

    private static FinalResult result(Termination termination, String summary) {
        RunMetadata metadata = new RunMetadata(3, termination, List.of("risk", "visualize", "consolidate"), 1,
                List.of(), termination.isPartial());
        return new FinalResult(summary, Map.of("risk", Map.of("mark", "bar")), Map.of(), Map.of(), Map.of(), metadata);
    }

    @Test
    void testQueryReturnsFinalResult() throws Exception {
        when(runService.answer(eq("Show me a chart of my risk profile"), any(RequestContext.class)))
                .thenReturn(result(Termination.CONSOLIDATED, "Your risk is medium."));

        mockMvc.perform(post("/api/advisor/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"Show me a chart of my risk profile\", \"userId\": \"user-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.summary").value("Your risk is medium."))
                .andExpect(jsonPath("$.charts.risk.mark").value("bar"))
                .andExpect(jsonPath("$.metadata.turnCount").value(3));

        ArgumentCaptor<RequestContext> context = ArgumentCaptor.forClass(RequestContext.class);
        verify(runService).answer(anyString(), context.capture());
        assertEquals("user-1", context.getValue().userId());
    }

    @Test
    void testPartialResultIsMarkedPartial() throws Exception {
        when(runService.answer(anyString(), any(RequestContext.class)))
                .thenReturn(result(Termination.TURN_CAP, "Here is what was gathered"));

        mockMvc.perform(post("/api/advisor/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"Check everything\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PARTIAL"))
                .andExpect(jsonPath("$.metadata.termination").value("TURN_CAP"));
    }

    @Test
    void testBlankMessageIsRejected() throws Exception {
        mockMvc.perform(post("/api/advisor/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fields.message").exists());

        verifyNoInteractions(runService);
    }

    @Test
    void testMalformedBodyIsRejected() throws Exception {
        mockMvc.perform(post("/api/advisor/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void testOrchestrationErrorReturnsBadGatewayWithPartialResult() throws Exception {
        OrchestrationError error = new OrchestrationError("run-9", "Worker risk failed", List.of(),
                result(Termination.FAILED, "Here is what was gathered"), new IllegalStateException("down"));
        when(runService.answer(anyString(), any(RequestContext.class))).thenThrow(error);

        mockMvc.perform(post("/api/advisor/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"How risky am I?\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.requestId").value("run-9"))
                .andExpect(jsonPath("$.status").value("FAILED"));
    }

    @Test
    void testStreamReturnsRunId() throws Exception {
        when(runService.startStreaming("How risky am I?", "user-1")).thenReturn("run-s");

        mockMvc.perform(post("/api/advisor/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"How risky am I?\", \"userId\": \"user-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-s"));
    }

    @Test
    void testCancelStream() throws Exception {
        when(runService.cancel("run-s")).thenReturn(true);

        mockMvc.perform(post("/api/advisor/cancel/{runId}", "run-s"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

        verify(runService).cancel("run-s");
    }

    @Test
    void testCancelUnknownRun() throws Exception {
        mockMvc.perform(post("/api/advisor/cancel/{runId}", "missing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("not-found"));
    }

    @Test
    void testUnknownRunReturnsNotFound() throws Exception {
        when(runService.findRun("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/advisor/runs/{runId}", "missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testRunSummaryIsReturned() throws Exception {
        RunSummary summary = new RunSummary("run-1", "user-1", "How risky am I?", "COMPLETED", "CONSOLIDATED", 3,
                "Your risk is medium.", List.of(new RunSummary.ToolCall(1, "risk", "analyze_risk_profile")),
                OffsetDateTime.parse("2026-01-01T00:00:00Z"));
        when(runService.findRun("run-1")).thenReturn(Optional.of(summary));

        mockMvc.perform(get("/api/advisor/runs/{runId}", "run-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ledger[0].toolName").value("analyze_risk_profile"));
    }
}
