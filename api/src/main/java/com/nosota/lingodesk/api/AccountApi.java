package com.nosota.lingodesk.api;

import com.nosota.lingodesk.api.request.ChangePasswordRequest;
import com.nosota.lingodesk.api.request.ChangeSubscriptionRequest;
import com.nosota.lingodesk.api.request.CreateApiKeyRequest;
import com.nosota.lingodesk.api.request.LanguagePreferencesRequest;
import com.nosota.lingodesk.api.request.UpdateProfileRequest;
import com.nosota.lingodesk.api.response.AccountResponse;
import com.nosota.lingodesk.api.response.ApiKeyResponse;
import com.nosota.lingodesk.api.response.MessageResponse;
import com.nosota.lingodesk.api.response.SubscriptionResponse;
import com.nosota.lingodesk.api.response.UserResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Self-service API for the current user and its account.
 */
@RequestMapping("/api")
public interface AccountApi {

    @GetMapping("/account")
    ResponseEntity<AccountResponse> getAccount();

    /**
     * Changes the subscription plan of the caller's account and renews it for one month.
     */
    @PostMapping("/account/subscription")
    ResponseEntity<SubscriptionResponse> changeSubscription(@RequestBody @Valid ChangeSubscriptionRequest request);

    @GetMapping("/user/profile")
    ResponseEntity<UserResponse> getProfile();

    @PatchMapping("/user/profile")
    ResponseEntity<UserResponse> updateProfile(@RequestBody @Valid UpdateProfileRequest request);

    @PatchMapping("/user/password")
    ResponseEntity<MessageResponse> changePassword(@RequestBody @Valid ChangePasswordRequest request);

    @PatchMapping("/user/language-preferences")
    ResponseEntity<UserResponse> updateLanguagePreferences(@RequestBody @Valid LanguagePreferencesRequest request);

    /**
     * Issues an API key for the {@code /api/v1} surface. The key is shown once.
     */
    @PostMapping("/user/api-keys")
    ResponseEntity<ApiKeyResponse> createApiKey(@RequestBody @Valid CreateApiKeyRequest request);
}
