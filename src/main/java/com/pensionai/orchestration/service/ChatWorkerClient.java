package com.pensionai.orchestration.service;

import com.pensionai.orchestration.api.WorkerClient;
import com.pensionai.orchestration.model.RequestContext;
import com.pensionai.orchestration.model.StepName;
import com.pensionai.orchestration.model.WorkerOutput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Arrays;

import static com.pensionai.orchestration.OrchestrationConstants.FRAUD_WORKER_PROMPT;
import static com.pensionai.orchestration.OrchestrationConstants.PROJECTION_WORKER_PROMPT;
import static com.pensionai.orchestration.OrchestrationConstants.PURPOSE_WORKER;
import static com.pensionai.orchestration.OrchestrationConstants.RISK_WORKER_PROMPT;

/**
 * Runs a specialist worker as a tool-calling chat request. The run's {@link RequestContext}
 * travels to the tools through the Spring AI tool context.
 */
@Service
@Slf4j
public class ChatWorkerClient implements WorkerClient {

    private final ChatRequestFactory chatRequestFactory;
    private final ToolCallbackProvider advisoryToolCallbacks;
    private final JsonProcessingService jsonProcessingService;

    public ChatWorkerClient(ChatRequestFactory chatRequestFactory,
                            @Qualifier("advisoryToolCallbacks") ToolCallbackProvider advisoryToolCallbacks,
                            JsonProcessingService jsonProcessingService) {
        this.chatRequestFactory = chatRequestFactory;
        this.advisoryToolCallbacks = advisoryToolCallbacks;
        this.jsonProcessingService = jsonProcessingService;
    }

    @Override
    public WorkerOutput runWorker(StepName workerId, String queryText, RequestContext context) {
        ToolCallAudit audit = new ToolCallAudit(workerId.id(), context.runId());
        ToolCallback[] tools = Arrays.stream(advisoryToolCallbacks.getToolCallbacks())
                .map(callback -> (ToolCallback) new AuditedToolCallback(callback, audit, jsonProcessingService))
                .toArray(ToolCallback[]::new);

        String text = chatRequestFactory.prompt(PURPOSE_WORKER + ":" + workerId.id())
                .system(systemPrompt(workerId))
                .user(queryText)
                .toolCallbacks(tools)
                .toolContext(context.toolContext())
                .call()
                .content();
        log.debug("Worker {} finished with {} tool call(s).", workerId, audit.count());
        return WorkerOutput.of(text, audit.trace());
    }

    static String systemPrompt(StepName workerId) {
        return switch (workerId) {
            case RISK -> RISK_WORKER_PROMPT;
            case FRAUD -> FRAUD_WORKER_PROMPT;
            case PROJECTION -> PROJECTION_WORKER_PROMPT;
            default -> throw new IllegalArgumentException("Not a worker step: " + workerId);
        };
    }
}
