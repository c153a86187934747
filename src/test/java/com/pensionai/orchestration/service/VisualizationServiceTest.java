package com.pensionai.orchestration.service;

import com.pensionai.orchestration.OrchestrationFixtures;
import com.pensionai.orchestration.api.ChartRasterizer;
import com.pensionai.orchestration.model.ConversationMessage;
import com.pensionai.orchestration.model.LedgerEntry;
import com.pensionai.orchestration.model.VisualizationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.pensionai.orchestration.OrchestrationFixtures.FRAUD_OBSERVATION;
import static com.pensionai.orchestration.OrchestrationFixtures.PROJECTION_OBSERVATION;
import static com.pensionai.orchestration.OrchestrationFixtures.RISK_OBSERVATION;
import static org.junit.jupiter.api.Assertions.*;

class VisualizationServiceTest {

    private final VisualizationService service = OrchestrationFixtures.visualization();

    private static LedgerEntry entry(String tool, String observation) {
        return new LedgerEntry("worker", tool, "{}", observation);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> chartValues(VisualizationResult result, String chartId) {
        Map<String, Object> chart = (Map<String, Object>) result.charts().get(chartId);
        Map<String, Object> data = (Map<String, Object>) chart.get("data");
        return (List<Map<String, Object>>) data.get("values");
    }

    @Test
    void testProjectionChartStripsCurrencyFormatting() {
        VisualizationResult result = service.visualize(List.of(entry("project_pension", PROJECTION_OBSERVATION)));

        List<Map<String, Object>> values = chartValues(result, "projection");
        assertEquals(0, values.get(0).get("year"));
        assertEquals(42000.0, values.get(0).get("balance"));
        assertEquals(10, values.get(1).get("year"));
        assertEquals(118500.5, values.get(1).get("balance"));
        assertTrue(result.figures().containsKey("projection"));
    }

    @Test
    void testProjectionYearsDefaultWhenMissingOrZero() {
        VisualizationResult result = service.visualize(List.of(entry("project_pension",
                "{\"starting_balance\": 1000, \"projected_balance\": 2000, \"projection_period_years\": 0}")));

        assertEquals(10, chartValues(result, "projection").get(1).get("year"));
    }

    @Test
    void testProjectionWithoutBalancesIsSkipped() {
        VisualizationResult result = service.visualize(List.of(entry("project_pension", "{\"error\": \"No pension data found\"}")));

        assertFalse(result.charts().containsKey("projection"));
        assertTrue(result.isEmpty());
    }

    @Test
    void testRiskChart() {
        VisualizationResult result = service.visualize(List.of(entry("analyze_risk_profile", RISK_OBSERVATION)));

        assertEquals(5.5, chartValues(result, "risk").get(0).get("value"));
        assertTrue(result.figures().containsKey("risk"));
    }

    @Test
    void testRiskScoreMustBeNumeric() {
        VisualizationResult result = service.visualize(List.of(entry("analyze_risk_profile", "{\"risk_score\": \"high\"}")));

        assertTrue(result.charts().isEmpty());
    }

    @Test
    void testFraudChartAndIndicator() {
        VisualizationResult result = service.visualize(List.of(entry("detect_fraud", FRAUD_OBSERVATION)));

        assertEquals(0.87, chartValues(result, "fraud").get(0).get("value"));
        assertEquals(Map.of("is_fraudulent", true), result.indicators().get("fraud_flag"));
        assertFalse(result.charts().containsKey("fraud_flag"));
    }

    @Test
    void testFirstParsableEntryPerKindWins() {
        VisualizationResult result = service.visualize(List.of(
                entry("analyze_risk_profile", "Risk looks fine"),
                entry("analyze_risk_profile", "{\"risk_score\": 2}"),
                entry("analyze_risk_profile", "{\"risk_score\": 9}")));

        assertEquals(2.0, chartValues(result, "risk").get(0).get("value"));
    }

    @Test
    void testKindsAreIndependent() {
        VisualizationResult result = service.visualize(List.of(
                entry("project_pension", "{broken"),
                entry("analyze_risk_profile", RISK_OBSERVATION),
                entry("detect_fraud", FRAUD_OBSERVATION)));

        assertEquals(List.of("risk", "fraud"), List.copyOf(result.charts().keySet()));
    }

    @Test
    void testNotesDescribeCharts() {
        VisualizationResult result = service.visualize(List.of(entry("analyze_risk_profile", RISK_OBSERVATION)));

        List<String> notes = result.notes().stream().map(ConversationMessage::content).toList();
        assertTrue(notes.get(0).startsWith("[CHART_SPECS] {\"risk\""));
        assertTrue(notes.stream().anyMatch(note -> note.startsWith("[PLOTLY_FIGS] ")));
        assertTrue(notes.stream().noneMatch(note -> note.startsWith("[CHART_IMAGES]")));
    }

    @Test
    void testRasterizedImagesBecomeDataUris() {
        ChartRasterizer rasterizer = chart -> new byte[]{1, 2, 3};
        VisualizationResult result = OrchestrationFixtures.visualization(rasterizer)
                .visualize(List.of(entry("analyze_risk_profile", RISK_OBSERVATION)));

        assertEquals("data:image/png;base64,AQID", result.images().get("risk"));
    }

    @Test
    void testRasterizerFailureLeavesChartWithoutImage() {
        ChartRasterizer rasterizer = chart -> {
            throw new IllegalStateException("renderer missing");
        };
        VisualizationResult result = OrchestrationFixtures.visualization(rasterizer)
                .visualize(List.of(entry("analyze_risk_profile", RISK_OBSERVATION)));

        assertTrue(result.charts().containsKey("risk"));
        assertTrue(result.images().isEmpty());
    }

    @Test
    void testUnrelatedToolsAreIgnored() {
        VisualizationResult result = service.visualize(List.of(entry("knowledge_base_search", "{\"risk_score\": 3}")));

        assertTrue(result.isEmpty());
    }
}
