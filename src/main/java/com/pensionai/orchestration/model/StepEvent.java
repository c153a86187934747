package com.pensionai.orchestration.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One state transition of a run: the turn it happened in, the step that ran and what it changed.
 * The step is {@code supervisor} for routing decisions.
 */
public record StepEvent(int turn, String step, Map<String, Object> delta) {

    public static final String SUPERVISOR = "supervisor";

    public StepEvent {
        delta = delta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(delta));
    }
}
