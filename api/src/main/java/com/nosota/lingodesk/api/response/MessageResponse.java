package com.nosota.lingodesk.api.response;

public record MessageResponse(
        String message
) {
}
