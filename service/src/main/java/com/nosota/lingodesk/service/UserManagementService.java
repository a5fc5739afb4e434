package com.nosota.lingodesk.service;

import com.nosota.lingodesk.api.request.CreateUserRequest;
import com.nosota.lingodesk.api.request.UpdateUserRequest;
import com.nosota.lingodesk.error.DuplicateResourceException;
import com.nosota.lingodesk.error.ResourceNotFoundException;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.repository.ProjectUpdateRepository;
import com.nosota.lingodesk.repository.TeamRepository;
import com.nosota.lingodesk.repository.TranslationRequestRepository;
import com.nosota.lingodesk.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * User administration within the administrator's own account.
 *
 * <p>Rules:
 * <ul>
 *   <li>users of another account cannot be read, changed or deleted (403)</li>
 *   <li>an administrator cannot change their own role nor delete themselves</li>
 *   <li>users with orders or project updates cannot be deleted, since orders are kept forever</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserManagementService {

    private final UserRepository userRepository;
    private final TeamRepository teamRepository;
    private final TranslationRequestRepository translationRequestRepository;
    private final ProjectUpdateRepository projectUpdateRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<User> listUsers(User admin) {
        return userRepository.findByAccountIdOrderByCreatedAtDescIdDesc(admin.getAccountId());
    }

    /**
     * Creates a user in the administrator's account. The address is trusted, so the user
     * can log in without e-mail verification.
     */
    @Transactional
    public User createUser(User admin, CreateUserRequest request) {
        String email = AuthService.normalizeEmail(request.email());
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new DuplicateResourceException("Email already exists");
        }
        if (userRepository.existsByUsernameIgnoreCase(request.username().trim())) {
            throw new DuplicateResourceException("Username already exists");
        }
        if (request.teamId() != null) {
            requireTeam(request.teamId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        User user = new User();
        user.setAccountId(admin.getAccountId());
        user.setTeamId(request.teamId());
        user.setFirstName(request.firstName().trim());
        user.setLastName(request.lastName().trim());
        user.setEmail(email);
        user.setUsername(request.username().trim());
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setRole(request.role());
        user.setJobTitle(request.jobTitle());
        user.setPhoneNumber(request.phoneNumber());
        user.setPreferredLanguages(new ArrayList<>(AuthService.DEFAULT_PREFERRED_LANGUAGES));
        user.setEmailVerified(true);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        user = userRepository.save(user);

        log.info("User created by admin: userId={}, adminId={}, role={}", user.getId(), admin.getId(), user.getRole());
        return user;
    }

    /**
     * Applies the non-null fields of the request. A {@code teamId} of 0 removes the team assignment.
     */
    @Transactional
    public User updateUser(User admin, Long userId, UpdateUserRequest request) {
        User user = requireSameAccount(admin, userId);

        if (request.role() != null && Objects.equals(user.getId(), admin.getId()) && request.role() != admin.getRole()) {
            throw new IllegalArgumentException("Cannot change your own role");
        }
        if (request.email() != null) {
            String email = AuthService.normalizeEmail(request.email());
            if (!email.equalsIgnoreCase(user.getEmail()) && userRepository.existsByEmailIgnoreCase(email)) {
                throw new DuplicateResourceException("Email already exists");
            }
            user.setEmail(email);
        }
        if (request.username() != null) {
            String username = request.username().trim();
            if (!username.equalsIgnoreCase(user.getUsername()) && userRepository.existsByUsernameIgnoreCase(username)) {
                throw new DuplicateResourceException("Username already exists");
            }
            user.setUsername(username);
        }
        if (request.firstName() != null) {
            user.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            user.setLastName(request.lastName().trim());
        }
        if (request.password() != null) {
            user.setPasswordHash(passwordEncoder.encode(request.password()));
        }
        if (request.role() != null) {
            user.setRole(request.role());
        }
        if (request.teamId() != null) {
            if (request.teamId() == 0L) {
                user.setTeamId(null);
            } else {
                requireTeam(request.teamId());
                user.setTeamId(request.teamId());
            }
        }
        if (request.jobTitle() != null) {
            user.setJobTitle(request.jobTitle());
        }
        if (request.phoneNumber() != null) {
            user.setPhoneNumber(request.phoneNumber());
        }
        user.setUpdatedAt(LocalDateTime.now(clock));

        log.info("User updated by admin: userId={}, adminId={}", userId, admin.getId());
        return userRepository.save(user);
    }

    @Transactional
    public void deleteUser(User admin, Long userId) {
        User user = requireSameAccount(admin, userId);
        if (Objects.equals(user.getId(), admin.getId())) {
            throw new IllegalArgumentException("Cannot delete your own account");
        }
        if (translationRequestRepository.existsByUserId(userId) || projectUpdateRepository.existsByUserId(userId)) {
            throw new IllegalStateException("User " + userId + " has translation requests and cannot be deleted");
        }
        userRepository.delete(user);
        log.info("User deleted by admin: userId={}, adminId={}", userId, admin.getId());
    }

    private User requireSameAccount(User admin, Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
        if (!Objects.equals(user.getAccountId(), admin.getAccountId())) {
            throw new AccessDeniedException("Access denied");
        }
        return user;
    }

    private void requireTeam(Long teamId) {
        if (!teamRepository.existsById(teamId)) {
            throw new ResourceNotFoundException("Team", teamId);
        }
    }
}
