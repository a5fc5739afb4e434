package com.nosota.lingodesk.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * @param email         Login e-mail
 * @param password      Plain password
 * @param twoFactorCode TOTP code, required only when two-factor authentication is enabled
 */
public record LoginRequest(
        @NotBlank(message = "Email is required")
        @Email(message = "Invalid email address")
        String email,

        @NotBlank(message = "Password is required")
        String password,

        String twoFactorCode
) {
}
