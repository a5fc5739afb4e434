package com.nosota.lingodesk.api.request;

import jakarta.validation.constraints.NotBlank;

public record CreateApiKeyRequest(
        @NotBlank(message = "Key name is required")
        String name
) {
}
