package com.pensionai.orchestration.service;

import com.pensionai.config.AdvisorProperties;
import com.pensionai.orchestration.api.NarrativeSynthesizer;
import com.pensionai.orchestration.model.ConversationMessage;
import com.pensionai.orchestration.model.ConversationState;
import com.pensionai.orchestration.model.FinalResult;
import com.pensionai.orchestration.model.LedgerEntry;
import com.pensionai.orchestration.model.MessageRole;
import com.pensionai.orchestration.model.RunMetadata;
import com.pensionai.orchestration.model.StepName;
import com.pensionai.orchestration.model.Termination;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.pensionai.orchestration.OrchestrationConstants.BEST_EFFORT_HEADER;
import static com.pensionai.orchestration.OrchestrationConstants.CLOSING_NOTICE;
import static com.pensionai.orchestration.OrchestrationConstants.NO_DATA_NOTICE;
import static com.pensionai.orchestration.OrchestrationConstants.REFUSAL_DATA_HEADER;
import static com.pensionai.orchestration.OrchestrationConstants.REFUSAL_TEMPLATE;

/**
 * Builds the terminal {@link FinalResult} of a run, either from a synthesized narrative or,
 * on the degraded paths, from the ledger alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsolidationService {

    private final NarrativeSynthesizer narrativeSynthesizer;
    private final ContentGuardrail contentGuardrail;
    private final CollaboratorRetry collaboratorRetry;
    private final AdvisorProperties properties;

    /**
     * Synthesizes the answer, screens it, and marks the state terminal.
     */
    public FinalResult consolidate(ConversationState state) {
        String narrative = synthesizeNarrative(state);
        ContentGuardrail.Verdict verdict = contentGuardrail.review(narrative);
        String summary = verdict.allowed() ? narrative : refusal(state.ledger());
        List<String> blocked = verdict.blockedCategories().stream().map(Enum::name).toList();

        FinalResult result = buildResult(state, summary, Termination.CONSOLIDATED, blocked);
        state.complete(result);
        return result;
    }

    /**
     * Terminates a run whose routing chose to finish without consolidating.
     */
    public FinalResult close(ConversationState state) {
        String summary = state.ledger().isEmpty() ? CLOSING_NOTICE : bestEffortSummary(state.ledger());
        FinalResult result = buildResult(state, summary, Termination.FINISHED, List.of());
        state.complete(result);
        return result;
    }

    /**
     * Terminates a run that was stopped early, summarizing the ledger without any collaborator call.
     */
    public FinalResult bestEffort(ConversationState state, Termination termination) {
        FinalResult result = bestEffortResult(state, termination);
        state.complete(result);
        return result;
    }

    /**
     * Same as {@link #bestEffort} but leaves the state untouched.
     */
    public FinalResult bestEffortResult(ConversationState state, Termination termination) {
        return buildResult(state, bestEffortSummary(state.ledger()), termination, List.of());
    }

    public String bestEffortSummary(List<LedgerEntry> ledger) {
        if (ledger.isEmpty()) {
            return NO_DATA_NOTICE;
        }
        int previewLength = properties.getPreviewLength();
        return ledger.stream()
                .map(entry -> "- %s (%s): %s".formatted(entry.toolName(), entry.workerName(),
                        JsonProcessingService.truncate(entry.outputPayload(), previewLength)))
                .collect(Collectors.joining("\n", BEST_EFFORT_HEADER + "\n", ""));
    }

    private String synthesizeNarrative(ConversationState state) {
        List<ConversationMessage> history = List.copyOf(state.messages());
        try {
            String narrative = collaboratorRetry.call("narrative-synthesizer", state.deadline(),
                    () -> narrativeSynthesizer.synthesize(history));
            if (StringUtils.hasText(narrative)) {
                return narrative.trim();
            }
            log.warn("Run {}: synthesizer returned blank text, falling back to worker output.", state.context().runId());
        } catch (CollaboratorTimeoutException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Run {}: narrative synthesis failed, falling back to worker output. Cause: {}",
                    state.context().runId(), ex.getMessage());
        }
        return latestWorkerMessage(state.messages()).orElse(NO_DATA_NOTICE);
    }

    private Optional<String> latestWorkerMessage(List<ConversationMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ConversationMessage message = messages.get(i);
            if (message.role() == MessageRole.WORKER && StringUtils.hasText(message.content())) {
                return Optional.of(message.content());
            }
        }
        return Optional.empty();
    }

    private String refusal(List<LedgerEntry> ledger) {
        if (ledger.isEmpty()) {
            return REFUSAL_TEMPLATE;
        }
        String data = ledger.stream()
                .map(entry -> entry.toolName() + ": " + entry.outputPayload())
                .collect(Collectors.joining(" | "));
        return REFUSAL_TEMPLATE + "\n\n" + REFUSAL_DATA_HEADER + " "
                + JsonProcessingService.truncate(data, properties.getRefusalPreviewLength());
    }

    private FinalResult buildResult(ConversationState state, String summary, Termination termination,
                                    List<String> blockedCategories) {
        RunMetadata metadata = new RunMetadata(
                state.turnCount(),
                termination,
                state.stepsVisited().stream().map(StepName::id).toList(),
                state.ledger().size(),
                blockedCategories,
                termination.isPartial());
        return new FinalResult(summary, state.charts(), state.images(), state.figures(), state.indicators(), metadata);
    }
}
