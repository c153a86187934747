package com.pensionai.orchestration.model;

import java.time.OffsetDateTime;
import java.util.List;

public record RunSummary(
        String runId,
        String userId,
        String userQuery,
        String status,
        String termination,
        int turnCount,
        String summary,
        List<ToolCall> ledger,
        OffsetDateTime createdAt
) {
    public record ToolCall(int sequence, String workerName, String toolName) {
    }
}
