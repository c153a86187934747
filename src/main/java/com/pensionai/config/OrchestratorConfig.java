package com.pensionai.config;

import com.pensionai.tools.AdvisoryTools;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OrchestratorConfig {

    @Bean
    @Primary
    public ChatClient chatClient(GoogleGenAiChatModel googleGenAiChatModel) {
        return ChatClient.builder(googleGenAiChatModel).build();
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        OpenAiChatModel model = openAiChatModelProvider.getIfAvailable();
        return model != null ? ChatClient.builder(model).build() : null;
    }

    /**
     * Analysis tools offered to the specialist workers. Kept out of the default tool set of
     * the chat clients; {@code ChatWorkerClient} attaches them per call with an audit wrapper.
     */
    @Bean
    public ToolCallbackProvider advisoryToolCallbacks(AdvisoryTools advisoryTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(advisoryTools)
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService orchestrationExecutor(AdvisorProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getOrchestrationConcurrency()));
    }

    /** Runs single collaborator calls so they can be abandoned at the run deadline. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService collaboratorExecutor() {
        return Executors.newCachedThreadPool();
    }
}
