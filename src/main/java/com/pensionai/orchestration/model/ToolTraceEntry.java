package com.pensionai.orchestration.model;

import org.springframework.lang.Nullable;

public record ToolTraceEntry(@Nullable String toolName, @Nullable String input, @Nullable String observation) {
}
