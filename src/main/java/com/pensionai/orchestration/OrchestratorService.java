package com.pensionai.orchestration;

import com.pensionai.config.AdvisorProperties;
import com.pensionai.orchestration.api.StepListener;
import com.pensionai.orchestration.model.ConversationMessage;
import com.pensionai.orchestration.model.ConversationState;
import com.pensionai.orchestration.model.FinalResult;
import com.pensionai.orchestration.model.LedgerEntry;
import com.pensionai.orchestration.model.RequestContext;
import com.pensionai.orchestration.model.RunControl;
import com.pensionai.orchestration.model.StateDelta;
import com.pensionai.orchestration.model.StepEvent;
import com.pensionai.orchestration.model.StepName;
import com.pensionai.orchestration.model.Termination;
import com.pensionai.orchestration.model.VisualizationResult;
import com.pensionai.orchestration.routing.RoutingPolicy;
import com.pensionai.orchestration.service.CollaboratorTimeoutException;
import com.pensionai.orchestration.service.ConsolidationService;
import com.pensionai.orchestration.service.VisualizationService;
import com.pensionai.orchestration.service.WorkerAdapter;
import com.pensionai.orchestration.service.WorkerInvocationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one run from the user's message to its {@link FinalResult}. Each iteration asks the
 * routing policy for the next step, runs it and folds its output into the state. Worker and
 * visualization steps hand control back to the policy; consolidation and finish end the run.
 */
@Service
@Slf4j
public class OrchestratorService {

    static final int MAX_TURNS = 5;

    private final RoutingPolicy routingPolicy;
    private final WorkerAdapter workerAdapter;
    private final VisualizationService visualizationService;
    private final ConsolidationService consolidationService;
    private final AdvisorProperties properties;

    public OrchestratorService(RoutingPolicy routingPolicy,
                               WorkerAdapter workerAdapter,
                               VisualizationService visualizationService,
                               ConsolidationService consolidationService,
                               AdvisorProperties properties) {
        this.routingPolicy = routingPolicy;
        this.workerAdapter = workerAdapter;
        this.visualizationService = visualizationService;
        this.consolidationService = consolidationService;
        this.properties = properties;
    }

    public FinalResult run(String userMessage, RequestContext context) {
        return run(ConversationState.seed(userMessage, context), RunControl.unbounded(), StepListener.NONE);
    }

    public FinalResult run(String userMessage, RequestContext context, RunControl control, StepListener listener) {
        return run(ConversationState.seed(userMessage, context), control, listener);
    }

    /**
     * Runs the loop on a caller-owned state, which stays readable after the run ends.
     *
     * @throws OrchestrationError when a worker fails after its retry or a step faults unexpectedly
     */
    public FinalResult run(ConversationState state, RunControl control, StepListener listener) {
        String runId = state.context().runId();
        int turnCap = Math.min(MAX_TURNS, Math.max(1, properties.getTurnCap()));
        log.info("Run {} started (user={}, turnCap={}).", runId, state.context().userId(), turnCap);
        if (!state.isTerminal()) {
            state.setDeadline(control.deadline());
        }
        try {
            while (!state.isTerminal()) {
                Optional<Termination> interruption = control.interruption();
                if (interruption.isPresent()) {
                    log.warn("Run {} interrupted ({}) after {} turns.", runId, interruption.get(), state.turnCount());
                    finishEarly(state, interruption.get(), listener);
                    break;
                }
                int turn = state.incrementTurn();
                try {
                    runTurn(state, turn, turnCap, listener);
                } catch (CollaboratorTimeoutException ex) {
                    log.warn("Run {} hit its deadline while waiting for {} on turn {}.", runId, ex.getCollaborator(), turn);
                    finishEarly(state, Termination.TIMEOUT, listener);
                }
            }
        } catch (OrchestrationError ex) {
            throw ex;
        } catch (WorkerInvocationException ex) {
            throw fail(state, "Worker " + ex.getWorkerId().id() + " failed", ex);
        } catch (RuntimeException ex) {
            log.error("Run {} failed unexpectedly.", runId, ex);
            throw fail(state, "Unexpected orchestration failure", ex);
        }
        FinalResult result = state.finalResult();
        log.info("Run {} finished: termination={}, turns={}, ledger={}.", runId,
                result.metadata().termination(), state.turnCount(), state.ledger().size());
        return result;
    }

    private void runTurn(ConversationState state, int turn, int turnCap, StepListener listener) {
        StepName decided = routingPolicy.decide(state);
        boolean capped = turn >= turnCap && decided != StepName.CONSOLIDATE && decided != StepName.FINISH;
        StepName next = capped ? StepName.FINISH : decided;
        state.route(next);
        listener.onStep(new StepEvent(turn, StepEvent.SUPERVISOR, routingDelta(decided, next)));
        log.info("Run {} turn {}: next={}{}.", state.context().runId(), turn, next, capped ? " (turn cap)" : "");

        if (capped) {
            finishEarly(state, Termination.TURN_CAP, listener);
        } else {
            execute(state, next, turn, listener);
        }
    }

    private void execute(ConversationState state, StepName step, int turn, StepListener listener) {
        switch (step) {
            case RISK, FRAUD, PROJECTION -> {
                StateDelta delta = workerAdapter.invoke(step, state);
                state.apply(delta);
                state.recordStep(step);
                listener.onStep(new StepEvent(turn, step.id(), workerDelta(delta)));
            }
            case VISUALIZE -> {
                VisualizationResult result = visualizationService.visualize(state.ledger());
                state.applyVisualization(result);
                state.recordStep(step);
                listener.onStep(new StepEvent(turn, step.id(), visualizationDelta(result)));
            }
            case CONSOLIDATE -> {
                state.recordStep(step);
                FinalResult result = consolidationService.consolidate(state);
                listener.onStep(new StepEvent(turn, step.id(), resultDelta(result)));
            }
            case FINISH -> {
                state.recordStep(step);
                FinalResult result = consolidationService.close(state);
                listener.onStep(new StepEvent(turn, step.id(), resultDelta(result)));
            }
        }
    }

    private void finishEarly(ConversationState state, Termination termination, StepListener listener) {
        state.recordStep(StepName.FINISH);
        FinalResult result = consolidationService.bestEffort(state, termination);
        listener.onStep(new StepEvent(state.turnCount(), StepName.FINISH.id(), resultDelta(result)));
    }

    private OrchestrationError fail(ConversationState state, String message, RuntimeException cause) {
        List<LedgerEntry> ledger = List.copyOf(state.ledger());
        FinalResult partial = consolidationService.bestEffortResult(state, Termination.FAILED);
        return new OrchestrationError(state.context().runId(), message, ledger, partial, cause);
    }

    private static Map<String, Object> routingDelta(StepName decided, StepName next) {
        Map<String, Object> delta = new LinkedHashMap<>();
        delta.put("next", next.id());
        if (decided != next) {
            delta.put("overridden", decided.id());
        }
        return delta;
    }

    private static Map<String, Object> workerDelta(StateDelta stateDelta) {
        Map<String, Object> delta = new LinkedHashMap<>();
        delta.put("messages", stateDelta.appendedMessages().stream().map(ConversationMessage::content).toList());
        delta.put("ledgerEntries", stateDelta.appendedLedgerEntries().stream().map(LedgerEntry::toolName).toList());
        return delta;
    }

    private static Map<String, Object> visualizationDelta(VisualizationResult result) {
        Map<String, Object> delta = new LinkedHashMap<>();
        delta.put("charts", result.charts().keySet());
        delta.put("images", result.images().keySet());
        delta.put("figures", result.figures().keySet());
        delta.put("indicators", result.indicators());
        return delta;
    }

    private static Map<String, Object> resultDelta(FinalResult result) {
        Map<String, Object> delta = new LinkedHashMap<>();
        delta.put("termination", result.metadata().termination().name());
        delta.put("summary", result.summaryText());
        delta.put("blockedCategories", result.metadata().blockedCategories());
        return delta;
    }
}
