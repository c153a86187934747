package com.pensionai.api;

import java.time.Instant;

public record StreamStartResponse(String runId, Instant createdAt) {
}
