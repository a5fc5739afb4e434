package com.nosota.lingodesk.api;

import com.nosota.lingodesk.api.request.ForgotPasswordRequest;
import com.nosota.lingodesk.api.request.LoginRequest;
import com.nosota.lingodesk.api.request.RegisterRequest;
import com.nosota.lingodesk.api.request.ResetPasswordRequest;
import com.nosota.lingodesk.api.request.TwoFactorVerifyRequest;
import com.nosota.lingodesk.api.response.LoginResponse;
import com.nosota.lingodesk.api.response.MessageResponse;
import com.nosota.lingodesk.api.response.RegisterResponse;
import com.nosota.lingodesk.api.response.TwoFactorSetupResponse;
import com.nosota.lingodesk.api.response.UserResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Session authentication API.
 *
 * <p>Login stores the authenticated user in a server-side HTTP session identified by a cookie;
 * every other session route of the service relies on that cookie.
 *
 * <p>Failure semantics:
 * <ul>
 *   <li>invalid credentials - 401</li>
 *   <li>unverified e-mail - 403, whatever the password</li>
 *   <li>invalid or unknown token - 404, expired token - 400</li>
 *   <li>invalid two-factor code - 401 on login, 400 on verification</li>
 * </ul>
 */
@RequestMapping("/api/auth")
public interface AuthApi {

    /**
     * Registers a new account with its first user and sends an e-mail verification link.
     *
     * @param request Registration data
     * @return 201 with the new user ID; 409 if the e-mail or username is taken
     */
    @PostMapping("/register")
    ResponseEntity<RegisterResponse> register(@RequestBody @Valid RegisterRequest request);

    /**
     * Authenticates a user and establishes a session.
     *
     * <p>If two-factor authentication is enabled and no code is supplied, returns 200 with
     * {@code requiresTwoFactor=true} and does not create a session.
     */
    @PostMapping("/login")
    ResponseEntity<LoginResponse> login(@RequestBody @Valid LoginRequest request);

    @PostMapping("/logout")
    ResponseEntity<MessageResponse> logout();

    /**
     * Returns the user bound to the current session.
     */
    @GetMapping("/user")
    ResponseEntity<UserResponse> currentUser();

    /**
     * Confirms an e-mail address with the token sent at registration.
     */
    @GetMapping("/verify-email")
    ResponseEntity<MessageResponse> verifyEmail(@RequestParam(value = "token", required = false) String token);

    /**
     * Issues a password reset token. The response is identical whether or not the e-mail exists.
     */
    @PostMapping("/forgot-password")
    ResponseEntity<MessageResponse> forgotPassword(@RequestBody @Valid ForgotPasswordRequest request);

    /**
     * Sets a new password using a single-use reset token.
     */
    @PostMapping("/reset-password")
    ResponseEntity<MessageResponse> resetPassword(@RequestBody @Valid ResetPasswordRequest request);

    /**
     * Generates a new TOTP secret for the current user. Two-factor authentication is only
     * enabled once a code generated from this secret is verified.
     */
    @PostMapping("/2fa/setup")
    ResponseEntity<TwoFactorSetupResponse> setupTwoFactor();

    @PostMapping("/2fa/verify")
    ResponseEntity<MessageResponse> verifyTwoFactor(@RequestBody @Valid TwoFactorVerifyRequest request);

    @PostMapping("/2fa/disable")
    ResponseEntity<MessageResponse> disableTwoFactor();
}
