package com.pensionai.orchestration.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record VisualizationResult(
        Map<String, Object> charts,
        Map<String, String> images,
        Map<String, Object> figures,
        Map<String, Object> indicators,
        List<ConversationMessage> notes
) {
    public VisualizationResult {
        charts = copy(charts);
        images = copy(images);
        figures = copy(figures);
        indicators = copy(indicators);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public boolean isEmpty() {
        return charts.isEmpty() && images.isEmpty() && figures.isEmpty() && indicators.isEmpty();
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
