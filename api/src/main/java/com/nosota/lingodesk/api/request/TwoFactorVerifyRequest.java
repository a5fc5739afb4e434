package com.nosota.lingodesk.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Confirms a two-factor secret obtained from the setup call.
 *
 * @param secret Base32 secret returned by setup
 * @param token  Current 6-digit code from the authenticator app
 */
public record TwoFactorVerifyRequest(
        @NotBlank(message = "Secret is required")
        String secret,

        @NotBlank(message = "Verification code is required")
        @Pattern(regexp = "\\d{6}", message = "Verification code must be 6 digits")
        String token
) {
}
