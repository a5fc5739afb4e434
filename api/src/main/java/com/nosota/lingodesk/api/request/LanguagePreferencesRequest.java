package com.nosota.lingodesk.api.request;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record LanguagePreferencesRequest(
        @NotNull(message = "Preferred languages are required")
        List<String> preferredLanguages
) {
}
