package com.pensionai.orchestration;

import com.pensionai.orchestration.model.FinalResult;
import com.pensionai.orchestration.model.LedgerEntry;

import java.util.List;

/**
 * Raised when a run cannot continue. Carries what was gathered so far so callers can still
 * show a partial answer.
 */
public class OrchestrationError extends RuntimeException {

    private final String runId;
    private final List<LedgerEntry> ledger;
    private final FinalResult bestEffortResult;

    public OrchestrationError(String runId, String message, List<LedgerEntry> ledger,
                              FinalResult bestEffortResult, Throwable cause) {
        super(message, cause);
        this.runId = runId;
        this.ledger = ledger == null ? List.of() : List.copyOf(ledger);
        this.bestEffortResult = bestEffortResult;
    }

    public String getRunId() {
        return runId;
    }

    public List<LedgerEntry> getLedger() {
        return ledger;
    }

    public FinalResult getBestEffortResult() {
        return bestEffortResult;
    }
}
