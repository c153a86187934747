package com.pensionai.orchestration;

import com.pensionai.config.AdvisorProperties;
import com.pensionai.orchestration.api.NarrativeSynthesizer;
import com.pensionai.orchestration.api.RouteClassifier;
import com.pensionai.orchestration.api.WorkerClient;
import com.pensionai.orchestration.model.ConversationState;
import com.pensionai.orchestration.model.FinalResult;
import com.pensionai.orchestration.model.LedgerEntry;
import com.pensionai.orchestration.model.RequestContext;
import com.pensionai.orchestration.model.RunControl;
import com.pensionai.orchestration.model.StepEvent;
import com.pensionai.orchestration.model.StepName;
import com.pensionai.orchestration.model.Termination;
import com.pensionai.orchestration.model.ToolTraceEntry;
import com.pensionai.orchestration.model.WorkerOutput;
import com.pensionai.orchestration.routing.RoutingPolicy;
import com.pensionai.orchestration.routing.SupervisorRoutingPolicy;
import com.pensionai.orchestration.service.CollaboratorRetry;
import com.pensionai.orchestration.service.ConsolidationService;
import com.pensionai.orchestration.service.ContentGuardrail;
import com.pensionai.orchestration.service.WorkerAdapter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.pensionai.orchestration.OrchestrationFixtures.PROJECTION_OBSERVATION;
import static com.pensionai.orchestration.OrchestrationFixtures.RISK_OBSERVATION;
import static org.junit.jupiter.api.Assertions.*;

class OrchestratorServiceTest {

    private final AdvisorProperties properties = OrchestrationFixtures.properties();
    private final CollaboratorRetry retry = OrchestrationFixtures.retry(properties);
    private final List<StepEvent> events = new ArrayList<>();
    private final List<StepName> workerCalls = new ArrayList<>();

    private RouteClassifier classifier = text -> StepName.FINISH;
    private NarrativeSynthesizer synthesizer = history -> "Here is your summary.";

    /** Worker stub answering every worker step with the matching analysis tool call. */
    private final WorkerClient workerClient = (workerId, query, context) -> {
        workerCalls.add(workerId);
        return switch (workerId) {
            case PROJECTION -> WorkerOutput.of("Your pension projection is ready.",
                    List.of(new ToolTraceEntry("project_pension", "{}", PROJECTION_OBSERVATION)));
            case RISK -> WorkerOutput.of("Your risk profile is medium.",
                    List.of(new ToolTraceEntry("analyze_risk_profile", "{}", RISK_OBSERVATION)));
            default -> new WorkerOutput.Text("No suspicious activity found.");
        };
    };

    private OrchestratorService orchestrator(RoutingPolicy policy, WorkerClient worker) {
        ConsolidationService consolidation = new ConsolidationService(
                history -> synthesizer.synthesize(history), new ContentGuardrail(), retry, properties);
        return new OrchestratorService(policy, new WorkerAdapter(worker, retry, properties),
                OrchestrationFixtures.visualization(), consolidation, properties);
    }

    private OrchestratorService orchestrator() {
        RouteClassifier delegate = text -> classifier.classify(text);
        return orchestrator(new SupervisorRoutingPolicy(delegate, retry), workerClient);
    }

    private List<String> executedSteps() {
        return events.stream()
                .map(StepEvent::step)
                .filter(step -> !StepEvent.SUPERVISOR.equals(step))
                .toList();
    }

    @Test
    void testPensionProjectionScenarioConsolidatesWithoutCharts() {
        classifier = text -> StepName.PROJECTION;
        ConversationState state = ConversationState.seed("What will my pension be in 10 years?",
                new RequestContext("run-p", "user-1"));

        FinalResult result = orchestrator().run(state, RunControl.unbounded(), events::add);

        assertEquals(List.of("projection", "consolidate"), executedSteps());
        assertEquals(1, state.ledger().size());
        assertEquals("project_pension", state.ledger().get(0).toolName());
        assertEquals("Here is your summary.", result.summaryText());
        assertTrue(result.charts().isEmpty());
        assertEquals(Termination.CONSOLIDATED, result.metadata().termination());
        assertEquals(2, result.metadata().turnCount());
    }

    @Test
    void testRiskChartScenarioVisualizesBeforeConsolidating() {
        classifier = text -> StepName.RISK;

        FinalResult result = orchestrator().run("Show me a chart of my risk profile",
                new RequestContext("run-r", "user-1"), RunControl.unbounded(), events::add);

        assertEquals(List.of("risk", "visualize", "consolidate"), executedSteps());
        assertTrue(result.charts().containsKey("risk"));
        assertTrue(result.figures().containsKey("risk"));
        assertEquals(List.of("risk", "visualize", "consolidate"), result.metadata().stepsVisited());
        assertEquals(3, result.metadata().turnCount());
    }

    @Test
    void testClassifierRiskRunsRiskWorkerThenReturnsToSupervisor() {
        classifier = text -> StepName.RISK;

        orchestrator().run("How risky is my portfolio?", new RequestContext("run-c", "user-1"),
                RunControl.unbounded(), events::add);

        assertEquals(StepEvent.SUPERVISOR, events.get(0).step());
        assertEquals("risk", events.get(0).delta().get("next"));
        assertEquals("risk", events.get(1).step());
        assertEquals(StepEvent.SUPERVISOR, events.get(2).step());
        assertEquals(List.of(StepName.RISK), workerCalls);
    }

    @Test
    void testAdversarialPolicyIsStoppedByTurnCap() {
        RoutingPolicy alwaysWorker = state -> StepName.FRAUD;

        FinalResult result = orchestrator(alwaysWorker, workerClient)
                .run("Check everything forever", new RequestContext("run-a", "user-1"), RunControl.unbounded(), events::add);

        assertEquals(5, result.metadata().turnCount());
        assertEquals(Termination.TURN_CAP, result.metadata().termination());
        assertTrue(result.metadata().partial());
        assertFalse(result.summaryText().isBlank());
        assertEquals(4, workerCalls.size());
        assertEquals("fraud", events.stream()
                .filter(event -> event.turn() == 5 && StepEvent.SUPERVISOR.equals(event.step()))
                .findFirst().orElseThrow().delta().get("overridden"));
    }

    @Test
    void testTurnCapIsConfigurable() {
        properties.setTurnCap(2);
        RoutingPolicy alwaysWorker = state -> StepName.RISK;

        FinalResult result = orchestrator(alwaysWorker, workerClient)
                .run("q", new RequestContext("run-t", "user-1"));

        assertEquals(2, result.metadata().turnCount());
        assertEquals(1, workerCalls.size());
        assertTrue(result.summaryText().contains("analyze_risk_profile"));
    }

    @Test
    void testStateIsFrozenAfterRun() {
        classifier = text -> StepName.PROJECTION;
        ConversationState state = ConversationState.seed("What will my pension be?", new RequestContext("run-f", "u"));
        orchestrator().run(state, RunControl.unbounded(), events::add);
        int ledgerSize = state.ledger().size();
        int messageCount = state.messages().size();

        FinalResult again = orchestrator().run(state, RunControl.unbounded(), events::add);

        assertSame(state.finalResult(), again);
        assertEquals(ledgerSize, state.ledger().size());
        assertEquals(messageCount, state.messages().size());
    }

    @Test
    void testLedgerEntryIsSeenUnchangedByRoutingAndVisualization() {
        List<LedgerEntry> seenByPolicy = new ArrayList<>();
        RoutingPolicy recording = new RoutingPolicy() {
            private final RoutingPolicy delegate = new SupervisorRoutingPolicy(text -> StepName.PROJECTION, retry);

            @Override
            public StepName decide(ConversationState state) {
                seenByPolicy.addAll(state.ledger());
                return delegate.decide(state);
            }
        };

        FinalResult result = orchestrator(recording, workerClient).run("Chart my retirement projection",
                new RequestContext("run-l", "user-1"));

        assertEquals(new LedgerEntry("projection", "project_pension", "{}", PROJECTION_OBSERVATION), seenByPolicy.get(0));
        assertTrue(result.charts().containsKey("projection"));
    }

    @Test
    void testFreshQueryFinishWithoutDataGivesClosingNotice() {
        FinalResult result = orchestrator().run("Thanks, bye!", new RequestContext("run-b", null));

        assertEquals(OrchestrationConstants.CLOSING_NOTICE, result.summaryText());
        assertEquals(Termination.FINISHED, result.metadata().termination());
        assertEquals(1, result.metadata().turnCount());
    }

    @Test
    void testWorkerFailureRaisesOrchestrationErrorWithPartialLedger() {
        AtomicInteger calls = new AtomicInteger();
        WorkerClient flaky = (workerId, query, context) -> {
            if (calls.incrementAndGet() == 1) {
                return workerClient.runWorker(workerId, query, context);
            }
            throw new IllegalStateException("analytics down");
        };
        RoutingPolicy policy = state -> state.ledger().isEmpty() ? StepName.RISK : StepName.FRAUD;

        OrchestrationError error = assertThrows(OrchestrationError.class, () -> orchestrator(policy, flaky)
                .run("Risk and fraud please", new RequestContext("run-e", "user-1")));

        assertEquals("run-e", error.getRunId());
        assertEquals(1, error.getLedger().size());
        assertEquals(Termination.FAILED, error.getBestEffortResult().metadata().termination());
        assertTrue(error.getBestEffortResult().summaryText().contains("analyze_risk_profile"));
        assertEquals(3, calls.get());
    }

    @Test
    void testCancelledRunReturnsPartialResult() {
        classifier = text -> StepName.RISK;
        AtomicInteger checks = new AtomicInteger();
        RunControl cancelAfterFirstTurn = new RunControl(null, () -> checks.incrementAndGet() > 1);

        FinalResult result = orchestrator().run("How risky am I?", new RequestContext("run-x", "user-1"),
                cancelAfterFirstTurn, events::add);

        assertEquals(Termination.CANCELLED, result.metadata().termination());
        assertTrue(result.metadata().partial());
        assertEquals(1, result.metadata().ledgerSize());
        assertEquals(1, result.metadata().turnCount());
    }

    @Test
    void testExpiredDeadlineStopsBeforeFirstTurn() {
        RunControl expired = new RunControl(Instant.now().minusSeconds(1), () -> false);

        FinalResult result = orchestrator().run("q", new RequestContext("run-d", "user-1"), expired, events::add);

        assertEquals(Termination.TIMEOUT, result.metadata().termination());
        assertEquals(0, result.metadata().turnCount());
        assertEquals(OrchestrationConstants.NO_DATA_NOTICE, result.summaryText());
        assertTrue(workerCalls.isEmpty());
    }

    @Test
    void testSlowWorkerIsCutOffAtRunDeadline() {
        classifier = text -> StepName.RISK;
        WorkerClient slow = (workerId, query, context) -> {
            try {
                Thread.sleep(3_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return new WorkerOutput.Text("too late");
        };
        RouteClassifier delegate = text -> classifier.classify(text);
        long started = System.nanoTime();

        FinalResult result = orchestrator(new SupervisorRoutingPolicy(delegate, retry), slow).run("How risky am I?",
                new RequestContext("run-w", "user-1"), RunControl.withTimeout(Duration.ofMillis(200), () -> false),
                events::add);

        assertTrue((System.nanoTime() - started) / 1_000_000 < 2_000);
        assertEquals(Termination.TIMEOUT, result.metadata().termination());
        assertTrue(result.metadata().partial());
        assertEquals(1, result.metadata().turnCount());
        assertEquals(0, result.metadata().ledgerSize());
    }

    @Test
    void testTurnCapAboveFiveIsClamped() {
        properties.setTurnCap(12);
        RoutingPolicy alwaysWorker = state -> StepName.FRAUD;

        FinalResult result = orchestrator(alwaysWorker, workerClient)
                .run("Keep checking", new RequestContext("run-k", "user-1"));

        assertEquals(OrchestratorService.MAX_TURNS, result.metadata().turnCount());
        assertEquals(Termination.TURN_CAP, result.metadata().termination());
        assertEquals(4, workerCalls.size());
    }

    @Test
    void testBlockedNarrativeIsRefusedEndToEnd() {
        classifier = text -> StepName.PROJECTION;
        synthesizer = history -> "Your pension grows steadily; also consider buying bitcoin.";

        FinalResult result = orchestrator().run("What will my pension be?", new RequestContext("run-g", "user-1"));

        assertTrue(result.summaryText().startsWith(OrchestrationConstants.REFUSAL_TEMPLATE));
        assertEquals(List.of("INVESTMENT_ADVICE"), result.metadata().blockedCategories());
    }

    @Test
    void testStepEventsCarryDeltas() {
        classifier = text -> StepName.RISK;

        orchestrator().run("Show me a chart of my risk profile", new RequestContext("run-s", "user-1"),
                RunControl.unbounded(), events::add);

        Map<String, Object> workerDelta = events.get(1).delta();
        assertEquals(List.of("analyze_risk_profile"), workerDelta.get("ledgerEntries"));
        StepEvent last = events.get(events.size() - 1);
        assertEquals("consolidate", last.step());
        assertEquals("CONSOLIDATED", last.delta().get("termination"));
    }
}
