package com.pensionai.orchestration.model;

import java.util.List;

public record StateDelta(List<ConversationMessage> appendedMessages, List<LedgerEntry> appendedLedgerEntries) {

    public StateDelta {
        appendedMessages = appendedMessages == null ? List.of() : List.copyOf(appendedMessages);
        appendedLedgerEntries = appendedLedgerEntries == null ? List.of() : List.copyOf(appendedLedgerEntries);
    }

    public static StateDelta ofMessage(ConversationMessage message) {
        return new StateDelta(List.of(message), List.of());
    }
}
