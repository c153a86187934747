package com.pensionai.orchestration.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record FinalResult(
        String summaryText,
        Map<String, Object> charts,
        Map<String, String> images,
        Map<String, Object> figures,
        Map<String, Object> indicators,
        RunMetadata metadata
) {
    public FinalResult {
        summaryText = summaryText == null ? "" : summaryText;
        charts = frozen(charts);
        images = frozen(images);
        figures = frozen(figures);
        indicators = frozen(indicators);
    }

    private static <V> Map<String, V> frozen(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
