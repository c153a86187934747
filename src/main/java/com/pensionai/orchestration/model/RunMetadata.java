package com.pensionai.orchestration.model;

import java.util.List;

public record RunMetadata(
        int turnCount,
        Termination termination,
        List<String> stepsVisited,
        int ledgerSize,
        List<String> blockedCategories,
        boolean partial
) {
    public RunMetadata {
        stepsVisited = stepsVisited == null ? List.of() : List.copyOf(stepsVisited);
        blockedCategories = blockedCategories == null ? List.of() : List.copyOf(blockedCategories);
    }
}
