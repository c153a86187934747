package com.pensionai.orchestration.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.pensionai.orchestration.api.ChartRasterizer;
import com.pensionai.orchestration.model.AnalysisKind;
import com.pensionai.orchestration.model.ConversationMessage;
import com.pensionai.orchestration.model.LedgerEntry;
import com.pensionai.orchestration.model.StepName;
import com.pensionai.orchestration.model.VisualizationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.pensionai.orchestration.OrchestrationConstants.TAG_CHART_IMAGES;
import static com.pensionai.orchestration.OrchestrationConstants.TAG_CHART_SPECS;
import static com.pensionai.orchestration.OrchestrationConstants.TAG_INDICATORS;
import static com.pensionai.orchestration.OrchestrationConstants.TAG_PLOTLY_FIGS;

/**
 * Derives chart descriptors from the analysis results in the ledger. Each analysis kind is
 * handled on its own; a kind whose data is missing or malformed simply yields no chart.
 */
@Service
@Slf4j
public class VisualizationService {

    static final String VEGA_LITE_SCHEMA = "https://vega.github.io/schema/vega-lite/v5.json";
    static final String PNG_DATA_URI_PREFIX = "data:image/png;base64,";
    static final int DEFAULT_PROJECTION_YEARS = 10;

    private final JsonProcessingService jsonProcessingService;
    private final ObjectProvider<ChartRasterizer> rasterizerProvider;

    public VisualizationService(JsonProcessingService jsonProcessingService,
                                ObjectProvider<ChartRasterizer> rasterizerProvider) {
        this.jsonProcessingService = jsonProcessingService;
        this.rasterizerProvider = rasterizerProvider;
    }

    public VisualizationResult visualize(List<LedgerEntry> ledger) {
        Map<AnalysisKind, JsonNode> sources = firstObservations(ledger);
        Map<String, Map<String, Object>> charts = new LinkedHashMap<>();
        Map<String, Object> figures = new LinkedHashMap<>();
        Map<String, Object> indicators = new LinkedHashMap<>();

        JsonNode projection = sources.get(AnalysisKind.PROJECTION);
        if (projection != null) {
            addProjection(projection, charts, figures);
        }
        JsonNode risk = sources.get(AnalysisKind.RISK);
        if (risk != null) {
            addRisk(risk, charts, figures);
        }
        JsonNode fraud = sources.get(AnalysisKind.FRAUD);
        if (fraud != null) {
            addFraud(fraud, charts, figures, indicators);
        }

        Map<String, String> images = rasterize(charts);
        List<ConversationMessage> notes = describe(charts, images, figures, indicators);
        log.info("Visualization produced charts={} images={} indicators={}.",
                charts.keySet(), images.keySet(), indicators.keySet());
        return new VisualizationResult(new LinkedHashMap<String, Object>(charts), images, figures, indicators, notes);
    }

    private Map<AnalysisKind, JsonNode> firstObservations(List<LedgerEntry> ledger) {
        Map<AnalysisKind, JsonNode> sources = new EnumMap<>(AnalysisKind.class);
        for (LedgerEntry entry : ledger) {
            AnalysisKind.forTool(entry.toolName()).ifPresent(kind -> {
                if (sources.containsKey(kind)) {
                    return;
                }
                JsonNode observation = jsonProcessingService.readObject(entry.outputPayload());
                if (observation != null) {
                    sources.put(kind, observation);
                }
            });
        }
        return sources;
    }

    private void addProjection(JsonNode data, Map<String, Map<String, Object>> charts, Map<String, Object> figures) {
        Double start = firstNumber(data, "starting_balance", "current_savings");
        Double end = firstNumber(data, "projected_balance", "projected_balance_at_retirement");
        if (start == null || end == null) {
            log.debug("Projection data lacks balances, skipping chart.");
            return;
        }
        int years = projectionYears(data);

        Map<String, Object> chart = vegaLite("Projected balance over time");
        chart.put("data", Map.of("values", List.of(
                point("year", 0, "balance", start),
                point("year", years, "balance", end))));
        chart.put("mark", Map.of("type", "line", "point", true));
        chart.put("encoding", Map.of(
                "x", axis("year", "Years from now"),
                "y", axis("balance", "Balance ($)")));
        charts.put("projection", chart);

        Map<String, Object> trace = new LinkedHashMap<>();
        trace.put("type", "scatter");
        trace.put("mode", "lines+markers");
        trace.put("name", "Projected balance");
        trace.put("x", List.of(0, years));
        trace.put("y", List.of(start, end));
        figures.put("projection", figure(trace, "Projected balance over time", "Years from now", "Balance ($)"));
    }

    private void addRisk(JsonNode data, Map<String, Map<String, Object>> charts, Map<String, Object> figures) {
        JsonNode score = data.get("risk_score");
        if (score == null || !score.isNumber()) {
            log.debug("Risk data has no numeric risk_score, skipping chart.");
            return;
        }
        charts.put("risk", singleBar("Risk score", "Risk score", score.doubleValue()));
        figures.put("risk", barFigure("Risk score", score.doubleValue()));
    }

    private void addFraud(JsonNode data, Map<String, Map<String, Object>> charts, Map<String, Object> figures,
                          Map<String, Object> indicators) {
        JsonNode confidence = data.get("confidence_score");
        if (confidence != null && confidence.isNumber()) {
            charts.put("fraud", singleBar("Fraud confidence", "Confidence", confidence.doubleValue()));
            figures.put("fraud", barFigure("Fraud confidence", confidence.doubleValue()));
        }
        JsonNode fraudulent = data.get("is_fraudulent");
        if (fraudulent != null && fraudulent.isBoolean()) {
            indicators.put("fraud_flag", Map.of("is_fraudulent", fraudulent.booleanValue()));
        }
    }

    private Map<String, String> rasterize(Map<String, Map<String, Object>> charts) {
        Map<String, String> images = new LinkedHashMap<>();
        ChartRasterizer rasterizer = rasterizerProvider.getIfAvailable();
        if (rasterizer == null || charts.isEmpty()) {
            return images;
        }
        for (Map.Entry<String, Map<String, Object>> chart : charts.entrySet()) {
            try {
                byte[] png = rasterizer.rasterize(chart.getValue());
                if (png != null && png.length > 0) {
                    images.put(chart.getKey(), PNG_DATA_URI_PREFIX + Base64.getEncoder().encodeToString(png));
                }
            } catch (RuntimeException ex) {
                log.warn("Rasterizing chart {} failed, keeping descriptor only: {}", chart.getKey(), ex.getMessage());
            }
        }
        return images;
    }

    private List<ConversationMessage> describe(Map<String, Map<String, Object>> charts, Map<String, String> images,
                                               Map<String, Object> figures, Map<String, Object> indicators) {
        String author = StepName.VISUALIZE.id();
        List<ConversationMessage> notes = new ArrayList<>();
        notes.add(ConversationMessage.note(author, TAG_CHART_SPECS + " " + jsonProcessingService.toJson(charts)));
        if (!images.isEmpty()) {
            notes.add(ConversationMessage.note(author, TAG_CHART_IMAGES + " " + jsonProcessingService.toJson(images.keySet())));
        }
        if (!figures.isEmpty()) {
            notes.add(ConversationMessage.note(author, TAG_PLOTLY_FIGS + " " + jsonProcessingService.toJson(figures)));
        }
        if (!indicators.isEmpty()) {
            notes.add(ConversationMessage.note(author, TAG_INDICATORS + " " + jsonProcessingService.toJson(indicators)));
        }
        return notes;
    }

    private static int projectionYears(JsonNode data) {
        Double years = firstNumber(data, "projection_period_years", "years_remaining");
        if (years == null || years.intValue() <= 0) {
            return DEFAULT_PROJECTION_YEARS;
        }
        return years.intValue();
    }

    private static @Nullable Double firstNumber(JsonNode data, String... fields) {
        for (String field : fields) {
            Double value = toNumber(data.get(field));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    static @Nullable Double toNumber(@Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            String cleaned = node.asText().replace("$", "").replace(",", "").replaceAll("\\s+", "");
            if (cleaned.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(cleaned);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static Map<String, Object> vegaLite(String description) {
        Map<String, Object> chart = new LinkedHashMap<>();
        chart.put("$schema", VEGA_LITE_SCHEMA);
        chart.put("description", description);
        return chart;
    }

    private static Map<String, Object> singleBar(String description, String label, double value) {
        Map<String, Object> chart = vegaLite(description);
        chart.put("data", Map.of("values", List.of(point("metric", label, "value", value))));
        chart.put("mark", "bar");
        Map<String, Object> x = new LinkedHashMap<>();
        x.put("field", "metric");
        x.put("type", "nominal");
        x.put("title", "");
        chart.put("encoding", Map.of("x", x, "y", axis("value", label)));
        return chart;
    }

    private static Map<String, Object> barFigure(String title, double value) {
        Map<String, Object> trace = new LinkedHashMap<>();
        trace.put("type", "bar");
        trace.put("x", List.of(title));
        trace.put("y", List.of(value));
        return figure(trace, title, "", title);
    }

    private static Map<String, Object> figure(Map<String, Object> trace, String title, String xTitle, String yTitle) {
        Map<String, Object> layout = new LinkedHashMap<>();
        layout.put("title", title);
        layout.put("xaxis", Map.of("title", xTitle));
        layout.put("yaxis", Map.of("title", yTitle));
        Map<String, Object> figure = new LinkedHashMap<>();
        figure.put("data", List.of(trace));
        figure.put("layout", layout);
        return figure;
    }

    private static Map<String, Object> point(String xField, Object x, String yField, Object y) {
        Map<String, Object> point = new LinkedHashMap<>();
        point.put(xField, x);
        point.put(yField, y);
        return point;
    }

    private static Map<String, Object> axis(String field, String title) {
        Map<String, Object> axis = new LinkedHashMap<>();
        axis.put("field", field);
        axis.put("type", "quantitative");
        axis.put("title", title);
        return axis;
    }
}
