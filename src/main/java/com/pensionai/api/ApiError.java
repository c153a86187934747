package com.pensionai.api;

import java.util.Map;

public record ApiError(int status, String message, Map<String, Object> details) {

    public static ApiError of(int status, String message) {
        return new ApiError(status, message, Map.of());
    }
}
