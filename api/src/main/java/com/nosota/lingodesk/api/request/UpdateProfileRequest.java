package com.nosota.lingodesk.api.request;

import jakarta.validation.constraints.Email;

public record UpdateProfileRequest(
        String firstName,

        String lastName,

        @Email(message = "Invalid email address")
        String email,

        String phoneNumber,

        String jobTitle
) {
}
