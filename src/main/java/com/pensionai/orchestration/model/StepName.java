package com.pensionai.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Closed set of steps the orchestrator can route to. Anything the routing collaborators
 * produce is coerced into this set through {@link #parse(String)}.
 */
public enum StepName {
    RISK("risk", true),
    FRAUD("fraud", true),
    PROJECTION("projection", true),
    VISUALIZE("visualize", false),
    CONSOLIDATE("consolidate", false),
    FINISH("finish", false);

    private static final Map<String, StepName> ALIASES = Map.of(
            "risk_analyst", RISK,
            "fraud_detector", FRAUD,
            "projection_specialist", PROJECTION,
            "visualizer", VISUALIZE,
            "summarizer", CONSOLIDATE,
            "end", FINISH
    );

    private final String id;
    private final boolean worker;

    StepName(String id, boolean worker) {
        this.id = id;
        this.worker = worker;
    }

    public String id() {
        return id;
    }

    public boolean isWorker() {
        return worker;
    }

    /**
     * Resolves a step from free text. Blank or unknown values resolve to {@link #FINISH}.
     */
    public static StepName parse(@Nullable String value) {
        if (value == null) {
            return FINISH;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return FINISH;
        }
        for (StepName step : values()) {
            if (step.id.equals(normalized)) {
                return step;
            }
        }
        return ALIASES.getOrDefault(normalized, FINISH);
    }

    @Override
    public String toString() {
        return id;
    }
}
