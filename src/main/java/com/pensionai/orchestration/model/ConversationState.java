package com.pensionai.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Mutable record threaded through every step of one run. Owned by a single orchestrator
 * invocation and never shared between runs, so it carries no synchronization.
 *
 * <p>Messages and ledger entries are append-only. Once a {@link FinalResult} is attached the
 * state is terminal and every mutator throws {@link IllegalStateException} without touching
 * the state.
 */
public final class ConversationState {

    private final RequestContext context;
    private final List<ConversationMessage> messages = new ArrayList<>();
    private final List<LedgerEntry> ledger = new ArrayList<>();
    private final Map<String, Object> charts = new LinkedHashMap<>();
    private final Map<String, String> images = new LinkedHashMap<>();
    private final Map<String, Object> figures = new LinkedHashMap<>();
    private final Map<String, Object> indicators = new LinkedHashMap<>();
    private final List<StepName> stepsVisited = new ArrayList<>();

    private StepName next;
    private StepName lastStep;
    private int turnCount;
    private int ledgerMark;
    private boolean visualized;
    private Instant deadline;
    private FinalResult finalResult;

    public ConversationState(RequestContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context is required");
        }
        this.context = context;
    }

    public static ConversationState seed(String userMessage, RequestContext context) {
        ConversationState state = new ConversationState(context);
        state.appendMessage(ConversationMessage.user(userMessage));
        return state;
    }

    public void appendMessage(ConversationMessage message) {
        ensureMutable();
        messages.add(message);
    }

    public void apply(StateDelta delta) {
        ensureMutable();
        messages.addAll(delta.appendedMessages());
        ledger.addAll(delta.appendedLedgerEntries());
    }

    /**
     * Stores chart output. Keys already present are overwritten.
     */
    public void applyVisualization(VisualizationResult result) {
        ensureMutable();
        charts.putAll(result.charts());
        images.putAll(result.images());
        figures.putAll(result.figures());
        indicators.putAll(result.indicators());
        messages.addAll(result.notes());
        visualized = true;
    }

    public int incrementTurn() {
        ensureMutable();
        return ++turnCount;
    }

    /**
     * Records a routing decision and remembers the ledger size it was taken against.
     */
    public void route(StepName step) {
        ensureMutable();
        next = step == null ? StepName.FINISH : step;
        ledgerMark = ledger.size();
    }

    /**
     * Sets the wall-clock deadline that collaborator calls of this run must answer by.
     */
    public void setDeadline(@Nullable Instant deadline) {
        ensureMutable();
        this.deadline = deadline;
    }

    public void recordStep(StepName step) {
        ensureMutable();
        lastStep = step;
        stepsVisited.add(step);
    }

    public void complete(FinalResult result) {
        ensureMutable();
        if (result == null) {
            throw new IllegalArgumentException("result is required");
        }
        this.finalResult = result;
    }

    public boolean isTerminal() {
        return finalResult != null;
    }

    public Optional<ConversationMessage> latestUserMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ConversationMessage message = messages.get(i);
            if (message.role() == MessageRole.USER) {
                return Optional.of(message);
            }
        }
        return Optional.empty();
    }

    public boolean hasChartData() {
        return !charts.isEmpty() || !images.isEmpty() || !figures.isEmpty();
    }

    public boolean ledgerGrewSinceLastDecision() {
        return ledger.size() > ledgerMark;
    }

    public boolean workerJustRan() {
        return ledgerGrewSinceLastDecision() || (lastStep != null && lastStep.isWorker());
    }

    public String conversationText() {
        return messages.stream()
                .map(ConversationMessage::render)
                .collect(Collectors.joining("\n"));
    }

    private void ensureMutable() {
        if (finalResult != null) {
            throw new IllegalStateException("Run " + context.runId() + " already finished; state is read-only.");
        }
    }

    public RequestContext context() {
        return context;
    }

    public List<ConversationMessage> messages() {
        return Collections.unmodifiableList(messages);
    }

    public List<LedgerEntry> ledger() {
        return Collections.unmodifiableList(ledger);
    }

    public Map<String, Object> charts() {
        return Collections.unmodifiableMap(charts);
    }

    public Map<String, String> images() {
        return Collections.unmodifiableMap(images);
    }

    public Map<String, Object> figures() {
        return Collections.unmodifiableMap(figures);
    }

    public Map<String, Object> indicators() {
        return Collections.unmodifiableMap(indicators);
    }

    public List<StepName> stepsVisited() {
        return Collections.unmodifiableList(stepsVisited);
    }

    @Nullable
    public StepName next() {
        return next;
    }

    @Nullable
    public StepName lastStep() {
        return lastStep;
    }

    public int turnCount() {
        return turnCount;
    }

    public int ledgerMark() {
        return ledgerMark;
    }

    public boolean isVisualized() {
        return visualized;
    }

    @Nullable
    public Instant deadline() {
        return deadline;
    }

    @Nullable
    public FinalResult finalResult() {
        return finalResult;
    }
}
