package com.pensionai.orchestration.service;

import com.pensionai.entity.AdvisoryRun;
import com.pensionai.entity.LedgerEntryLog;
import com.pensionai.orchestration.OrchestrationError;
import com.pensionai.orchestration.api.RunAuditService;
import com.pensionai.orchestration.model.ConversationMessage;
import com.pensionai.orchestration.model.ConversationState;
import com.pensionai.orchestration.model.FinalResult;
import com.pensionai.orchestration.model.LedgerEntry;
import com.pensionai.orchestration.model.RunSummary;
import com.pensionai.repository.AdvisoryRunRepository;
import com.pensionai.repository.LedgerEntryLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class RunAuditServiceImpl implements RunAuditService {

    static final String STATUS_COMPLETED = "COMPLETED";
    static final String STATUS_FAILED = "FAILED";

    private final AdvisoryRunRepository runRepository;
    private final LedgerEntryLogRepository ledgerEntryLogRepository;

    @Override
    @Transactional
    public void recordRun(ConversationState state) {
        FinalResult result = state.finalResult();
        if (result == null) {
            throw new IllegalArgumentException("Run " + state.context().runId() + " has not finished.");
        }
        AdvisoryRun run = baseRun(state)
                .status(STATUS_COMPLETED)
                .termination(result.metadata().termination().name())
                .partialResult(result.metadata().partial())
                .blockedCategories(String.join(",", result.metadata().blockedCategories()))
                .summary(result.summaryText())
                .build();
        saveWithLedger(run, state.ledger());
    }

    @Override
    @Transactional
    public void recordFailure(ConversationState state, OrchestrationError error) {
        FinalResult partial = error.getBestEffortResult();
        AdvisoryRun run = baseRun(state)
                .status(STATUS_FAILED)
                .termination(partial != null ? partial.metadata().termination().name() : null)
                .partialResult(true)
                .summary(partial != null ? partial.summaryText() : null)
                .errorMessage(error.getMessage())
                .build();
        saveWithLedger(run, error.getLedger());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RunSummary> findRun(String runId) {
        return runRepository.findByRunId(runId).map(run -> {
            List<RunSummary.ToolCall> calls = ledgerEntryLogRepository.findByRunOrderBySequenceAsc(run).stream()
                    .map(entry -> new RunSummary.ToolCall(entry.getSequence(), entry.getWorkerName(), entry.getToolName()))
                    .toList();
            return new RunSummary(run.getRunId(), run.getUserId(), run.getUserQuery(), run.getStatus(),
                    run.getTermination(), run.getTurnCount(), run.getSummary(), calls, run.getCreatedAt());
        });
    }

    private AdvisoryRun.AdvisoryRunBuilder baseRun(ConversationState state) {
        String query = state.messages().stream()
                .findFirst()
                .map(ConversationMessage::content)
                .orElse("");
        return AdvisoryRun.builder()
                .runId(state.context().runId())
                .userId(state.context().userId())
                .userQuery(query)
                .turnCount(state.turnCount());
    }

    private void saveWithLedger(AdvisoryRun run, List<LedgerEntry> ledger) {
        AdvisoryRun saved = runRepository.save(run);
        List<LedgerEntryLog> logs = new ArrayList<>(ledger.size());
        for (int i = 0; i < ledger.size(); i++) {
            LedgerEntry entry = ledger.get(i);
            logs.add(LedgerEntryLog.builder()
                    .run(saved)
                    .sequence(i + 1)
                    .workerName(entry.workerName())
                    .toolName(entry.toolName())
                    .toolInput(entry.inputPayload())
                    .toolOutput(entry.outputPayload())
                    .build());
        }
        ledgerEntryLogRepository.saveAll(logs);
    }
}
