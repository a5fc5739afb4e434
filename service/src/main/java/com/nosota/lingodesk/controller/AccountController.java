package com.nosota.lingodesk.controller;

import com.nosota.lingodesk.api.AccountApi;
import com.nosota.lingodesk.api.request.*;
import com.nosota.lingodesk.api.response.*;
import com.nosota.lingodesk.mapper.UserMapper;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.security.CurrentUserProvider;
import com.nosota.lingodesk.service.AccountService;
import com.nosota.lingodesk.service.ApiKeyService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

/**
 * Self-service profile and account endpoints of the logged-in user.
 */
@RestController
@Validated
@RequiredArgsConstructor
public class AccountController implements AccountApi {

    private final AccountService accountService;
    private final ApiKeyService apiKeyService;
    private final CurrentUserProvider currentUserProvider;

    @Override
    public ResponseEntity<AccountResponse> getAccount() {
        return ResponseEntity.ok(accountService.getAccount(currentUserProvider.requireUser().getAccountId()));
    }

    @Override
    public ResponseEntity<SubscriptionResponse> changeSubscription(ChangeSubscriptionRequest request) {
        return ResponseEntity.ok(accountService.changeSubscription(currentUserProvider.requireUser(), request.planId()));
    }

    @Override
    public ResponseEntity<UserResponse> getProfile() {
        return ResponseEntity.ok(UserMapper.INSTANCE.toResponse(currentUserProvider.requireUser()));
    }

    @Override
    public ResponseEntity<UserResponse> updateProfile(UpdateProfileRequest request) {
        User user = accountService.updateProfile(currentUserProvider.requireUser(), request);
        return ResponseEntity.ok(UserMapper.INSTANCE.toResponse(user));
    }

    @Override
    public ResponseEntity<MessageResponse> changePassword(ChangePasswordRequest request) {
        accountService.changePassword(currentUserProvider.requireUser(), request.password());
        return ResponseEntity.ok(new MessageResponse("Password updated successfully"));
    }

    @Override
    public ResponseEntity<UserResponse> updateLanguagePreferences(LanguagePreferencesRequest request) {
        User user = accountService.updateLanguagePreferences(currentUserProvider.requireUser(), request.preferredLanguages());
        return ResponseEntity.ok(UserMapper.INSTANCE.toResponse(user));
    }

    @Override
    public ResponseEntity<ApiKeyResponse> createApiKey(CreateApiKeyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(apiKeyService.createKey(currentUserProvider.requireUser(), request.name()));
    }
}
