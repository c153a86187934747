package com.pensionai.orchestration.routing;

import com.pensionai.orchestration.model.AnalysisKind;
import com.pensionai.orchestration.model.LedgerEntry;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One row of the visualization trigger table: a keyword set matched against the user's
 * message, optionally gated on the ledger holding data of a given analysis kind.
 */
public record VisualizationTrigger(String name, Set<String> keywords, @Nullable AnalysisKind requiredData) {

    public VisualizationTrigger {
        keywords = Set.copyOf(keywords);
    }

    /**
     * The default table. "pension" on its own is not a trigger, so plain projection questions
     * are answered without charts.
     */
    public static List<VisualizationTrigger> defaults() {
        return List.of(
                new VisualizationTrigger("explicit-request",
                        Set.of("chart", "graph", "visual", "plot", "show me", "display"), null),
                new VisualizationTrigger("projection-growth",
                        Set.of("growth", "grow", "progress", "goal", "retirement", "projection"), AnalysisKind.PROJECTION),
                new VisualizationTrigger("risk-profile", Set.of("risk"), AnalysisKind.RISK),
                new VisualizationTrigger("fraud-check", Set.of("fraud"), AnalysisKind.FRAUD)
        );
    }

    public boolean matches(String userMessage, List<LedgerEntry> ledger) {
        if (userMessage == null || userMessage.isBlank()) {
            return false;
        }
        if (requiredData != null && !requiredData.presentIn(ledger)) {
            return false;
        }
        String lowered = userMessage.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lowered::contains);
    }
}
