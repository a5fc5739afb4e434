package com.nosota.lingodesk.service;

import com.nosota.lingodesk.api.model.SubscriptionPlan;
import com.nosota.lingodesk.api.model.SubscriptionStatus;
import com.nosota.lingodesk.api.request.UpdateProfileRequest;
import com.nosota.lingodesk.api.response.AccountResponse;
import com.nosota.lingodesk.api.response.SubscriptionResponse;
import com.nosota.lingodesk.error.DuplicateResourceException;
import com.nosota.lingodesk.error.ResourceNotFoundException;
import com.nosota.lingodesk.mapper.AccountMapper;
import com.nosota.lingodesk.model.Account;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.repository.AccountRepository;
import com.nosota.lingodesk.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Self-service operations of a logged-in user on their own profile and account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AccountResponse getAccount(Long accountId) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
        return AccountMapper.INSTANCE.toResponse(account, userRepository.countByAccountId(accountId));
    }

    @Transactional(readOnly = true)
    public List<User> getAccountUsers(Long accountId) {
        return userRepository.findByAccountIdOrderByCreatedAtDescIdDesc(accountId);
    }

    /**
     * Switches the plan, reactivates the subscription and moves renewal one month ahead.
     * No payment is taken.
     */
    @Transactional
    public SubscriptionResponse changeSubscription(User user, SubscriptionPlan plan) {
        Account account = accountRepository.findById(user.getAccountId())
                .orElseThrow(() -> new ResourceNotFoundException("Account", user.getAccountId()));

        LocalDateTime renewal = LocalDateTime.now(clock).plusMonths(1);
        account.setSubscriptionPlan(plan);
        account.setSubscriptionStatus(SubscriptionStatus.ACTIVE);
        account.setSubscriptionRenewal(renewal);
        accountRepository.save(account);

        log.info("Subscription changed: accountId={}, plan={}", account.getId(), plan);
        return new SubscriptionResponse(
                "Subscription updated to " + displayName(plan) + " plan",
                plan,
                SubscriptionStatus.ACTIVE,
                renewal);
    }

    /**
     * Applies the non-null fields of the request.
     *
     * @throws DuplicateResourceException if the new e-mail belongs to another user
     */
    @Transactional
    public User updateProfile(User user, UpdateProfileRequest request) {
        if (request.email() != null) {
            String email = AuthService.normalizeEmail(request.email());
            if (!email.equalsIgnoreCase(user.getEmail()) && userRepository.existsByEmailIgnoreCase(email)) {
                throw new DuplicateResourceException("Email already registered");
            }
            user.setEmail(email);
        }
        if (request.firstName() != null) {
            user.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            user.setLastName(request.lastName().trim());
        }
        if (request.phoneNumber() != null) {
            user.setPhoneNumber(request.phoneNumber());
        }
        if (request.jobTitle() != null) {
            user.setJobTitle(request.jobTitle());
        }
        user.setUpdatedAt(LocalDateTime.now(clock));
        log.info("Profile updated: userId={}", user.getId());
        return userRepository.save(user);
    }

    @Transactional
    public void changePassword(User user, String newPassword) {
        user.setPasswordHash(passwordEncoder.encode(newPassword));
        user.setUpdatedAt(LocalDateTime.now(clock));
        userRepository.save(user);
        log.info("Password changed: userId={}", user.getId());
    }

    @Transactional
    public User updateLanguagePreferences(User user, List<String> languages) {
        List<String> cleaned = languages.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(language -> !language.isEmpty())
                .distinct()
                .toList();
        user.setPreferredLanguages(new ArrayList<>(cleaned));
        user.setUpdatedAt(LocalDateTime.now(clock));
        return userRepository.save(user);
    }

    private static String displayName(SubscriptionPlan plan) {
        String value = plan.getValue();
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }
}
