package com.pensionai.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record QueryRequest(
        @NotBlank @Size(max = 4000) String message,
        @Size(max = 120) String userId
) {
}
