package com.pensionai.orchestration.api;

import com.pensionai.orchestration.model.ConversationMessage;

import java.util.List;

public interface NarrativeSynthesizer {

    /**
     * Turns the message history of a run into the final answer text.
     */
    String synthesize(List<ConversationMessage> messageHistory);
}
