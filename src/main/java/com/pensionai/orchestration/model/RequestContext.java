package com.pensionai.orchestration.model;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Identity of one run. Travels explicitly from the entry point down to the worker tools.
 */
public record RequestContext(String runId, @Nullable String userId) {

    public static final String RUN_ID_KEY = "runId";
    public static final String USER_ID_KEY = "userId";

    public RequestContext {
        if (!StringUtils.hasText(runId)) {
            throw new IllegalArgumentException("runId is required");
        }
        userId = StringUtils.hasText(userId) ? userId.trim() : null;
    }

    public static RequestContext forUser(@Nullable String userId) {
        return new RequestContext(UUID.randomUUID().toString(), userId);
    }

    public Map<String, Object> toolContext() {
        Map<String, Object> values = new HashMap<>();
        values.put(RUN_ID_KEY, runId);
        if (userId != null) {
            values.put(USER_ID_KEY, userId);
        }
        return values;
    }
}
