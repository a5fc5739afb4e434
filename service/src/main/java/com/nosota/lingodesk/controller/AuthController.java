package com.nosota.lingodesk.controller;

import com.nosota.lingodesk.api.AuthApi;
import com.nosota.lingodesk.api.request.*;
import com.nosota.lingodesk.api.response.*;
import com.nosota.lingodesk.mapper.UserMapper;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.security.CurrentUserProvider;
import com.nosota.lingodesk.security.SessionAuthenticator;
import com.nosota.lingodesk.service.AuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for registration, login and credential management.
 *
 * <p>Successful logins bind the user to the HTTP session through {@link SessionAuthenticator}.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class AuthController implements AuthApi {

    static final String PASSWORD_RESET_MESSAGE =
            "If an account with that email exists, a password reset email has been sent.";

    private final AuthService authService;
    private final SessionAuthenticator sessionAuthenticator;
    private final CurrentUserProvider currentUserProvider;

    @Override
    public ResponseEntity<RegisterResponse> register(RegisterRequest request) {
        User user = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(new RegisterResponse(
                "Registration successful. Please check your email to verify your account.",
                user.getId()));
    }

    @Override
    public ResponseEntity<LoginResponse> login(LoginRequest request) {
        AuthService.LoginResult result =
                authService.authenticate(request.email(), request.password(), request.twoFactorCode());
        if (result.requiresTwoFactor()) {
            return ResponseEntity.ok(LoginResponse.twoFactorRequired());
        }
        sessionAuthenticator.signIn(result.user());
        return ResponseEntity.ok(LoginResponse.success(UserMapper.INSTANCE.toResponse(result.user())));
    }

    @Override
    public ResponseEntity<MessageResponse> logout() {
        sessionAuthenticator.signOut();
        return ResponseEntity.ok(new MessageResponse("Logout successful"));
    }

    @Override
    public ResponseEntity<UserResponse> currentUser() {
        return ResponseEntity.ok(UserMapper.INSTANCE.toResponse(currentUserProvider.requireUser()));
    }

    @Override
    public ResponseEntity<MessageResponse> verifyEmail(String token) {
        authService.verifyEmail(token);
        return ResponseEntity.ok(new MessageResponse("Email verified successfully"));
    }

    @Override
    public ResponseEntity<MessageResponse> forgotPassword(ForgotPasswordRequest request) {
        authService.requestPasswordReset(request.email());
        return ResponseEntity.ok(new MessageResponse(PASSWORD_RESET_MESSAGE));
    }

    @Override
    public ResponseEntity<MessageResponse> resetPassword(ResetPasswordRequest request) {
        authService.resetPassword(request.token(), request.password());
        return ResponseEntity.ok(new MessageResponse("Password reset successful"));
    }

    @Override
    public ResponseEntity<TwoFactorSetupResponse> setupTwoFactor() {
        return ResponseEntity.ok(authService.setupTwoFactor(currentUserProvider.requireUser()));
    }

    @Override
    public ResponseEntity<MessageResponse> verifyTwoFactor(TwoFactorVerifyRequest request) {
        authService.enableTwoFactor(currentUserProvider.requireUser(), request.secret(), request.token());
        return ResponseEntity.ok(new MessageResponse("Two-factor authentication enabled successfully"));
    }

    @Override
    public ResponseEntity<MessageResponse> disableTwoFactor() {
        authService.disableTwoFactor(currentUserProvider.requireUser());
        return ResponseEntity.ok(new MessageResponse("Two-factor authentication disabled successfully"));
    }
}
