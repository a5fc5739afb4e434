package com.nosota.lingodesk.security;

import com.nosota.lingodesk.api.model.UserRole;
import com.nosota.lingodesk.model.User;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.io.Serializable;
import java.util.List;

/**
 * Principal stored in the security context, for both session and API-key authentication.
 * Serializable because the session keeps it between requests.
 */
public record AuthenticatedUser(Long userId, Long accountId, String email, UserRole role) implements Serializable {

    public static AuthenticatedUser of(User user) {
        return new AuthenticatedUser(user.getId(), user.getAccountId(), user.getEmail(), user.getRole());
    }

    public List<SimpleGrantedAuthority> authorities() {
        return List.of(new SimpleGrantedAuthority("ROLE_" + role.name()));
    }
}
