package com.nosota.lingodesk.security;

import com.nosota.lingodesk.error.InvalidCredentialsException;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Resolves the caller of the current request to a fresh {@link User} row, so role and team
 * changes made by an administrator apply without a new login.
 */
@Component
@RequiredArgsConstructor
public class CurrentUserProvider {

    private final UserRepository userRepository;

    /**
     * @return the authenticated user
     * @throws InvalidCredentialsException if the request is anonymous or the user no longer exists
     */
    public User requireUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedUser principal)) {
            throw new InvalidCredentialsException("Not authenticated");
        }
        return userRepository.findById(principal.userId())
                .orElseThrow(() -> new InvalidCredentialsException("Not authenticated"));
    }
}
