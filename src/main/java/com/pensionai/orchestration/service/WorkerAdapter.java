package com.pensionai.orchestration.service;

import com.pensionai.config.AdvisorProperties;
import com.pensionai.orchestration.api.WorkerClient;
import com.pensionai.orchestration.model.ConversationMessage;
import com.pensionai.orchestration.model.ConversationState;
import com.pensionai.orchestration.model.LedgerEntry;
import com.pensionai.orchestration.model.StateDelta;
import com.pensionai.orchestration.model.StepName;
import com.pensionai.orchestration.model.ToolTraceEntry;
import com.pensionai.orchestration.model.WorkerOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.pensionai.orchestration.OrchestrationConstants.EMPTY_WORKER_OUTPUT;
import static com.pensionai.orchestration.OrchestrationConstants.NO_USER_MESSAGE;

/**
 * Runs one specialist worker and turns whatever it returns into messages and ledger entries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkerAdapter {

    private final WorkerClient workerClient;
    private final CollaboratorRetry collaboratorRetry;
    private final AdvisorProperties properties;

    public StateDelta invoke(StepName workerId, ConversationState state) {
        if (workerId == null || !workerId.isWorker()) {
            throw new IllegalArgumentException("Not a worker step: " + workerId);
        }
        Optional<ConversationMessage> userMessage = state.latestUserMessage();
        if (userMessage.isEmpty()) {
            log.warn("Run {}: no user message for worker {}.", state.context().runId(), workerId);
            return StateDelta.ofMessage(ConversationMessage.note(workerId.id(), NO_USER_MESSAGE));
        }
        String query = userMessage.get().content();
        WorkerOutput output;
        try {
            output = collaboratorRetry.call("worker-" + workerId.id(), state.deadline(),
                    () -> workerClient.runWorker(workerId, query, state.context()));
        } catch (CollaboratorTimeoutException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Run {}: worker {} failed after retry.", state.context().runId(), workerId, ex);
            throw new WorkerInvocationException(workerId, ex);
        }
        StateDelta delta = normalize(workerId, output);
        log.info("Run {}: worker {} produced {} ledger entr{}.", state.context().runId(), workerId,
                delta.appendedLedgerEntries().size(), delta.appendedLedgerEntries().size() == 1 ? "y" : "ies");
        return delta;
    }

    StateDelta normalize(StepName workerId, @Nullable WorkerOutput output) {
        String text = output != null && output.text() != null ? output.text().trim() : "";
        List<ToolTraceEntry> trace = output != null ? output.toolTrace() : List.of();

        List<LedgerEntry> entries = new ArrayList<>();
        StringBuilder message = new StringBuilder(text);
        for (ToolTraceEntry step : trace) {
            if (step == null) {
                continue;
            }
            LedgerEntry entry = new LedgerEntry(workerId.id(), step.toolName(), step.input(), step.observation());
            entries.add(entry);
            if (message.length() > 0) {
                message.append('\n');
            }
            message.append('[').append(entry.toolName()).append("] ")
                    .append(JsonProcessingService.truncate(entry.outputPayload(), properties.getPreviewLength()));
        }

        if (!StringUtils.hasText(message)) {
            return StateDelta.ofMessage(ConversationMessage.note(workerId.id(), EMPTY_WORKER_OUTPUT.formatted(workerId.id())));
        }
        return new StateDelta(List.of(ConversationMessage.worker(workerId.id(), message.toString())), entries);
    }
}
