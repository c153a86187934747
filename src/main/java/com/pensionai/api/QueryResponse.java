package com.pensionai.api;

import com.pensionai.orchestration.OrchestrationError;
import com.pensionai.orchestration.model.FinalResult;
import com.pensionai.orchestration.model.RunMetadata;

import java.time.Instant;
import java.util.Map;

public record QueryResponse(
        String requestId,
        Instant createdAt,
        String status,
        String summary,
        Map<String, Object> charts,
        Map<String, String> images,
        Map<String, Object> figures,
        Map<String, Object> indicators,
        RunMetadata metadata
) {
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_PARTIAL = "PARTIAL";
    public static final String STATUS_FAILED = "FAILED";

    public static QueryResponse from(String runId, FinalResult result) {
        String status = result.metadata().partial() ? STATUS_PARTIAL : STATUS_COMPLETED;
        return of(runId, status, result);
    }

    public static QueryResponse failed(OrchestrationError error) {
        return of(error.getRunId(), STATUS_FAILED, error.getBestEffortResult());
    }

    private static QueryResponse of(String requestId, String status, FinalResult result) {
        return new QueryResponse(requestId, Instant.now(), status, result.summaryText(),
                result.charts(), result.images(), result.figures(), result.indicators(), result.metadata());
    }
}
