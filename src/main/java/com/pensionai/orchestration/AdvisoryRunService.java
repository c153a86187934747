package com.pensionai.orchestration;

import com.pensionai.config.AdvisorProperties;
import com.pensionai.orchestration.api.RunAuditService;
import com.pensionai.orchestration.api.StepListener;
import com.pensionai.orchestration.model.ConversationState;
import com.pensionai.orchestration.model.FinalResult;
import com.pensionai.orchestration.model.RequestContext;
import com.pensionai.orchestration.model.RunControl;
import com.pensionai.orchestration.model.RunSummary;
import com.pensionai.stream.OrchestrationStreamService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for answering queries: applies the run timeout, wires cancellation and
 * streaming, and records every finished run.
 */
@Service
@Slf4j
public class AdvisoryRunService {

    private final OrchestratorService orchestratorService;
    private final RunAuditService runAuditService;
    private final OrchestrationStreamService streamService;
    private final ExecutorService orchestrationExecutor;
    private final AdvisorProperties properties;

    public AdvisoryRunService(OrchestratorService orchestratorService,
                              RunAuditService runAuditService,
                              OrchestrationStreamService streamService,
                              @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor,
                              AdvisorProperties properties) {
        this.orchestratorService = orchestratorService;
        this.runAuditService = runAuditService;
        this.streamService = streamService;
        this.orchestrationExecutor = orchestrationExecutor;
        this.properties = properties;
    }

    public FinalResult answer(String message, RequestContext context) {
        ConversationState state = ConversationState.seed(message, context);
        RunControl control = RunControl.withTimeout(properties.getRunTimeout(), () -> false);
        return execute(state, control, StepListener.NONE);
    }

    /**
     * Starts a run in the background and returns its id; progress is published on the stream.
     */
    public String startStreaming(String message, @Nullable String userId) {
        String runId = streamService.createRun();
        ConversationState state = ConversationState.seed(message, new RequestContext(runId, userId));
        RunControl control = RunControl.withTimeout(properties.getRunTimeout(), () -> streamService.isCancelled(runId));
        streamService.emitStatus(runId, "Queued");
        CompletableFuture.runAsync(() -> {
            try {
                FinalResult result = execute(state, control, event -> streamService.emitStep(runId, event));
                streamService.emitFinal(runId, result);
                streamService.emitRunComplete(runId, result.metadata().termination().name());
            } catch (OrchestrationError ex) {
                streamService.emitFinal(runId, ex.getBestEffortResult());
                streamService.emitError(runId, ex.getMessage());
            } catch (RuntimeException ex) {
                log.error("Streaming run {} failed.", runId, ex);
                streamService.emitError(runId, "Run failed.");
            }
        }, orchestrationExecutor);
        return runId;
    }

    public boolean cancel(String runId) {
        boolean cancelled = streamService.cancelRun(runId);
        if (cancelled) {
            log.info("Cancellation requested for run {}.", runId);
        }
        return cancelled;
    }

    public Optional<RunSummary> findRun(String runId) {
        return runAuditService.findRun(runId);
    }

    private FinalResult execute(ConversationState state, RunControl control, StepListener listener) {
        FinalResult result;
        try {
            result = orchestratorService.run(state, control, listener);
        } catch (OrchestrationError ex) {
            audit(state, () -> runAuditService.recordFailure(state, ex));
            throw ex;
        }
        audit(state, () -> runAuditService.recordRun(state));
        return result;
    }

    private void audit(ConversationState state, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException ex) {
            log.warn("Failed to record run {}: {}", state.context().runId(), ex.getMessage());
        }
    }
}
