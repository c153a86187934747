package com.pensionai.orchestration.service;

import com.pensionai.orchestration.model.ToolTraceEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the tool calls made during one worker invocation. Payloads are stored in full
 * because they become ledger entries; only the log line is shortened.
 */
@Slf4j
public final class ToolCallAudit {

    private static final int LOG_SNIPPET = 240;

    private final List<ToolTraceEntry> calls = Collections.synchronizedList(new ArrayList<>());
    private final String worker;
    private final String runId;

    public ToolCallAudit(String worker, String runId) {
        this.worker = worker;
        this.runId = runId;
    }

    void recordCall(@Nullable String name, @Nullable String input, @Nullable String output) {
        String safeName = StringUtils.hasText(name) ? name : "unknown";
        calls.add(new ToolTraceEntry(safeName, input == null ? "" : input, output == null ? "" : output));
        log.info("Tool call: name={}, worker={}, runId={}, inputSnippet={}", safeName, worker, runId,
                JsonProcessingService.truncate(input, LOG_SNIPPET));
    }

    public int count() {
        return calls.size();
    }

    public List<ToolTraceEntry> trace() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }
}
