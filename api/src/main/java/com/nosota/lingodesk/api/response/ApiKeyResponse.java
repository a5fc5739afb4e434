package com.nosota.lingodesk.api.response;

import java.time.LocalDateTime;

/**
 * Newly issued API key. The plain key is only returned once, the server keeps a digest.
 */
public record ApiKeyResponse(
        Long id,
        String name,
        String key,
        LocalDateTime createdAt
) {
}
