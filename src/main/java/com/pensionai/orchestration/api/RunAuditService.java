package com.pensionai.orchestration.api;

import com.pensionai.orchestration.OrchestrationError;
import com.pensionai.orchestration.model.ConversationState;
import com.pensionai.orchestration.model.RunSummary;

import java.util.Optional;

/**
 * Service interface for recording finished runs together with their tool-result ledger so they
 * can be looked up after the caller received the answer.
 */
public interface RunAuditService {

    /**
     * Persists a run that reached a terminal state.
     *
     * @param state The terminal {@link ConversationState} of the run.
     */
    void recordRun(ConversationState state);

    /**
     * Persists a run that ended with an {@link OrchestrationError}.
     *
     * @param state The state as it was when the run failed.
     * @param error The error raised by the orchestrator.
     */
    void recordFailure(ConversationState state, OrchestrationError error);

    /**
     * Looks up a recorded run.
     *
     * @param runId The run identifier returned to the caller.
     * @return The run summary, or empty when no run with this id was recorded.
     */
    Optional<RunSummary> findRun(String runId);
}
