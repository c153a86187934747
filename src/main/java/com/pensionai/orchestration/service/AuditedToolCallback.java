package com.pensionai.orchestration.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.tool.metadata.ToolMetadata;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Decorates a tool so every call, including a failing one, lands in a {@link ToolCallAudit}.
 */
@Slf4j
final class AuditedToolCallback implements ToolCallback {

    private final ToolCallback delegate;
    private final ToolCallAudit audit;
    private final JsonProcessingService jsonProcessingService;

    AuditedToolCallback(ToolCallback delegate, ToolCallAudit audit, JsonProcessingService jsonProcessingService) {
        this.delegate = delegate;
        this.audit = audit;
        this.jsonProcessingService = jsonProcessingService;
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return delegate.getToolDefinition();
    }

    @Override
    public ToolMetadata getToolMetadata() {
        return delegate.getToolMetadata();
    }

    @Override
    public String call(String input) {
        return executeWithAudit(input, () -> delegate.call(input));
    }

    @Override
    public String call(String input, ToolContext toolContext) {
        return executeWithAudit(input, () -> delegate.call(input, toolContext));
    }

    private String executeWithAudit(String input, Supplier<String> call) {
        String toolName = delegate.getToolDefinition().name();
        try {
            String output = call.get();
            audit.recordCall(toolName, input, output);
            return output;
        } catch (RuntimeException ex) {
            log.warn("Tool {} failed: {}", toolName, ex.getMessage());
            audit.recordCall(toolName, input, jsonProcessingService.toJson(Map.of("error", String.valueOf(ex.getMessage()))));
            throw ex;
        }
    }
}
