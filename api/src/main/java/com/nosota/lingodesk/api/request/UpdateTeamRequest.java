package com.nosota.lingodesk.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record UpdateTeamRequest(
        @Size(min = 1, message = "Team name must not be empty")
        String name,

        String description,

        @Email(message = "Invalid email address")
        String billingEmail
) {
}
