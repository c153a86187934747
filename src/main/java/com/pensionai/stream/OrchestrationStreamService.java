package com.pensionai.stream;

import com.pensionai.orchestration.model.FinalResult;
import com.pensionai.orchestration.model.StepEvent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class OrchestrationStreamService {

    private final OrchestrationStreamHub hub;

    public OrchestrationStreamService(OrchestrationStreamHub hub) {
        this.hub = hub;
    }

    public String createRun() {
        return hub.createRun();
    }

    public void emitStatus(String runId, String message) {
        hub.emit(runId, StreamEvent.STATUS, Map.of("message", message));
    }

    public void emitStep(String runId, StepEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turn", event.turn());
        payload.put("step", event.step());
        payload.put("delta", event.delta());
        hub.emit(runId, StreamEvent.STEP, payload);
    }

    public void emitFinal(String runId, FinalResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("summary", result.summaryText());
        payload.put("charts", result.charts());
        payload.put("images", result.images());
        payload.put("figures", result.figures());
        payload.put("indicators", result.indicators());
        payload.put("metadata", result.metadata());
        hub.emit(runId, StreamEvent.FINAL, payload);
    }

    public void emitRunComplete(String runId, String status) {
        hub.emit(runId, StreamEvent.RUN_COMPLETE, Map.of("status", status));
    }

    public void emitError(String runId, String message) {
        hub.emit(runId, StreamEvent.ERROR, Map.of("message", message == null ? "Run failed." : message));
    }

    public boolean cancelRun(String runId) {
        return hub.cancelRun(runId);
    }

    public boolean isCancelled(String runId) {
        return hub.isCancelled(runId);
    }
}
