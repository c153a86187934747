package com.pensionai.orchestration.service;

import com.pensionai.config.AdvisorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out chat requests for the configured provider and counts them.
 */
@Component
@Slf4j
public class ChatRequestFactory {

    private final ChatClient chatClient;
    private final ChatClient openAiChatClient;
    private final AdvisorProperties properties;
    private final AtomicLong requestCount = new AtomicLong();

    public ChatRequestFactory(ChatClient chatClient,
                              @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
                              AdvisorProperties properties) {
        this.chatClient = chatClient;
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
    }

    public ChatClient.ChatClientRequestSpec prompt(String purpose) {
        long count = requestCount.incrementAndGet();
        log.info("LLM request #{} sent (purpose={}, provider={}).", count, purpose, properties.getAiProvider());
        if (properties.getAiProvider() == AdvisorProperties.AiProvider.OPENAI) {
            if (openAiChatClient == null) {
                throw new IllegalStateException("OpenAI provider is not properly configured. "
                        + "Check that you have a valid API key or a custom Base URL in your configuration.");
            }
            ChatClient.ChatClientRequestSpec spec = openAiChatClient.prompt();
            if (StringUtils.hasText(properties.getModel())) {
                spec = spec.options(OpenAiChatOptions.builder().model(properties.getModel()).build());
            }
            return spec;
        }
        return chatClient.prompt();
    }
}
