package com.nosota.lingodesk.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record CreateTeamRequest(
        @NotBlank(message = "Team name is required")
        String name,

        String description,

        @Email(message = "Invalid email address")
        String billingEmail
) {
}
