package com.nosota.lingodesk.api.response;

public record RegisterResponse(
        String message,
        Long userId
) {
}
