package com.pensionai.orchestration.service;

import com.pensionai.orchestration.api.NarrativeSynthesizer;
import com.pensionai.orchestration.model.ConversationMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

import static com.pensionai.orchestration.OrchestrationConstants.PURPOSE_SYNTHESIS;
import static com.pensionai.orchestration.OrchestrationConstants.SYNTHESIS_SYSTEM_PROMPT;
import static com.pensionai.orchestration.OrchestrationConstants.SYNTHESIS_USER_TEMPLATE;

@Service
@RequiredArgsConstructor
public class ChatNarrativeSynthesizer implements NarrativeSynthesizer {

    private final ChatRequestFactory chatRequestFactory;

    @Override
    public String synthesize(List<ConversationMessage> messageHistory) {
        String history = messageHistory.stream()
                .map(ConversationMessage::render)
                .collect(Collectors.joining("\n"));
        return chatRequestFactory.prompt(PURPOSE_SYNTHESIS)
                .system(SYNTHESIS_SYSTEM_PROMPT)
                .user(user -> user.text(SYNTHESIS_USER_TEMPLATE).param("messages", history))
                .call()
                .content();
    }
}
