package com.nosota.lingodesk.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a login attempt.
 *
 * <p>When the user has two-factor authentication enabled and no code was supplied,
 * {@code requiresTwoFactor} is {@code true}, {@code user} is absent and no session is created.
 *
 * @param message           Human-readable outcome
 * @param requiresTwoFactor Whether a TOTP code must be supplied to complete login
 * @param user              Logged-in user, without credentials
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResponse(
        String message,
        boolean requiresTwoFactor,
        UserResponse user
) {
    public static LoginResponse success(UserResponse user) {
        return new LoginResponse("Login successful", false, user);
    }

    public static LoginResponse twoFactorRequired() {
        return new LoginResponse("Two-factor authentication required", true, null);
    }
}
