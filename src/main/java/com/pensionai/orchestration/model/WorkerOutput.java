package com.pensionai.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a specialist worker hands back: plain text, or text accompanied by the trace of the
 * tools it called.
 */
public sealed interface WorkerOutput permits WorkerOutput.Text, WorkerOutput.Structured {

    @Nullable
    String text();

    List<ToolTraceEntry> toolTrace();

    static WorkerOutput of(@Nullable String text, @Nullable List<ToolTraceEntry> toolTrace) {
        if (toolTrace == null || toolTrace.isEmpty()) {
            return new Text(text);
        }
        return new Structured(text, toolTrace);
    }

    record Text(@Nullable String text) implements WorkerOutput {
        @Override
        public List<ToolTraceEntry> toolTrace() {
            return List.of();
        }
    }

    record Structured(@Nullable String text, List<ToolTraceEntry> toolTrace) implements WorkerOutput {
        public Structured {
            // trace elements may be null when the integration could not capture a call
            toolTrace = toolTrace == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(toolTrace));
        }
    }
}
