package com.nosota.lingodesk.api.response;

import com.nosota.lingodesk.api.model.UserRole;

import java.time.LocalDateTime;
import java.util.List;

/**
 * User view without credentials, tokens or two-factor secret.
 */
public record UserResponse(
        Long id,
        Long accountId,
        String firstName,
        String lastName,
        String email,
        String username,
        UserRole role,
        Long teamId,
        String jobTitle,
        String phoneNumber,
        boolean emailVerified,
        boolean twoFactorEnabled,
        List<String> preferredLanguages,
        LocalDateTime lastLoginAt,
        LocalDateTime createdAt
) {
}
