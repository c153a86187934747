package com.pensionai.orchestration.model;

import java.util.List;
import java.util.Optional;

/**
 * The three analyses a worker can request from the analytics service, keyed by tool name.
 */
public enum AnalysisKind {
    PROJECTION("project_pension", "projection"),
    RISK("analyze_risk_profile", "risk"),
    FRAUD("detect_fraud", "fraud");

    private final String toolName;
    private final String resource;

    AnalysisKind(String toolName, String resource) {
        this.toolName = toolName;
        this.resource = resource;
    }

    public String toolName() {
        return toolName;
    }

    /** Path segment of the analytics endpoint serving this analysis. */
    public String resource() {
        return resource;
    }

    public boolean presentIn(List<LedgerEntry> ledger) {
        return ledger.stream().anyMatch(entry -> toolName.equals(entry.toolName()));
    }

    public static Optional<AnalysisKind> forTool(String toolName) {
        for (AnalysisKind kind : values()) {
            if (kind.toolName.equals(toolName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
