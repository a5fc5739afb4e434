package com.nosota.lingodesk.service;

import com.nosota.lingodesk.api.model.CreditTransactionType;
import com.nosota.lingodesk.api.model.SubscriptionPlan;
import com.nosota.lingodesk.api.model.SubscriptionStatus;
import com.nosota.lingodesk.api.model.UserRole;
import com.nosota.lingodesk.api.request.RegisterRequest;
import com.nosota.lingodesk.api.response.TwoFactorSetupResponse;
import com.nosota.lingodesk.config.LingodeskProperties;
import com.nosota.lingodesk.error.*;
import com.nosota.lingodesk.model.Account;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.repository.AccountRepository;
import com.nosota.lingodesk.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Registration, credential checks, e-mail verification, password reset and two-factor management.
 *
 * <p>Session handling is not done here: {@link #authenticate} only decides whether the
 * credentials are good, and the web layer binds the returned user to the session.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    static final List<String> DEFAULT_PREFERRED_LANGUAGES = List.of("French", "Italian", "German", "Spanish");
    private static final int TOKEN_BYTES = 32;

    private final UserRepository userRepository;
    private final AccountRepository accountRepository;
    private final CreditService creditService;
    private final EmailService emailService;
    private final TwoFactorService twoFactorService;
    private final TokenGenerator tokenGenerator;
    private final PasswordEncoder passwordEncoder;
    private final LingodeskProperties properties;
    private final Clock clock;

    /**
     * Outcome of a credential check.
     *
     * @param user              the authenticated user, null when a second factor is still needed
     * @param requiresTwoFactor true if the password was right but no two-factor code was supplied
     */
    public record LoginResult(User user, boolean requiresTwoFactor) {
    }

    /**
     * Creates an account, grants the signup credits and creates its first user.
     * The user must verify the e-mail address before logging in.
     *
     * @return the new user
     * @throws DuplicateResourceException if the e-mail or username is taken; nothing is created
     */
    @Transactional
    public User register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        ensureUnique(email, request.username());

        LocalDateTime now = LocalDateTime.now(clock);

        Account account = new Account();
        account.setName(request.accountName().trim());
        account.setCredits(0L);
        account.setSubscriptionPlan(SubscriptionPlan.FREE);
        account.setSubscriptionStatus(SubscriptionStatus.ACTIVE);
        account.setCreatedAt(now);
        account = accountRepository.save(account);

        User user = new User();
        user.setAccountId(account.getId());
        user.setFirstName(request.firstName().trim());
        user.setLastName(request.lastName().trim());
        user.setEmail(email);
        user.setUsername(request.username().trim());
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setRole(UserRole.USER);
        user.setJobTitle(request.jobTitle());
        user.setPhoneNumber(request.phoneNumber());
        user.setPreferredLanguages(new ArrayList<>(DEFAULT_PREFERRED_LANGUAGES));
        user.setEmailVerified(false);
        user.setEmailVerificationToken(tokenGenerator.hexToken(TOKEN_BYTES));
        user.setEmailVerificationExpires(now.plus(properties.getTokens().getEmailVerificationTtl()));
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        user = userRepository.save(user);

        if (properties.getSignupCredits() > 0) {
            creditService.addAccountCredits(account.getId(), properties.getSignupCredits(),
                    CreditTransactionType.SIGNUP_BONUS, "Signup bonus", null);
        }

        emailService.sendVerificationEmail(user, user.getEmailVerificationToken());
        log.info("Registered user: userId={}, accountId={}", user.getId(), account.getId());
        return user;
    }

    /**
     * Checks e-mail, password and, when enabled, the two-factor code.
     *
     * @throws InvalidCredentialsException on unknown e-mail, wrong password or wrong code
     * @throws EmailNotVerifiedException   if the e-mail address is not verified yet
     */
    @Transactional
    public LoginResult authenticate(String email, String password, String twoFactorCode) {
        User user = userRepository.findByEmailIgnoreCase(normalizeEmail(email))
                .orElseThrow(InvalidCredentialsException::new);

        if (!user.isEmailVerified()) {
            log.info("Login refused, e-mail not verified: userId={}", user.getId());
            throw new EmailNotVerifiedException();
        }
        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            log.info("Login refused, wrong password: userId={}", user.getId());
            throw new InvalidCredentialsException();
        }

        if (user.isTwoFactorEnabled()) {
            if (!StringUtils.hasText(twoFactorCode)) {
                return new LoginResult(null, true);
            }
            if (!twoFactorService.verifyCode(user.getTwoFactorSecret(), twoFactorCode)) {
                log.info("Login refused, wrong two-factor code: userId={}", user.getId());
                throw new InvalidCredentialsException("Invalid two-factor code");
            }
        }

        user.setLastLoginAt(LocalDateTime.now(clock));
        userRepository.save(user);
        log.info("User logged in: userId={}", user.getId());
        return new LoginResult(user, false);
    }

    /**
     * Marks the e-mail address verified and consumes the token.
     *
     * @throws IllegalArgumentException  if no token is given
     * @throws ResourceNotFoundException if the token is unknown
     * @throws TokenExpiredException     if the token is past its expiry
     */
    @Transactional
    public void verifyEmail(String token) {
        if (!StringUtils.hasText(token)) {
            throw new IllegalArgumentException("Invalid verification token");
        }
        User user = userRepository.findByEmailVerificationToken(token)
                .orElseThrow(() -> new ResourceNotFoundException("Invalid or expired verification token"));
        if (isExpired(user.getEmailVerificationExpires())) {
            throw new TokenExpiredException("Verification token has expired");
        }

        user.setEmailVerified(true);
        user.setEmailVerificationToken(null);
        user.setEmailVerificationExpires(null);
        user.setUpdatedAt(LocalDateTime.now(clock));
        userRepository.save(user);
        log.info("E-mail verified: userId={}", user.getId());
    }

    /**
     * Issues a single-use reset token when the e-mail belongs to a user. Does nothing otherwise,
     * and the caller answers the same way in both cases.
     */
    @Transactional
    public void requestPasswordReset(String email) {
        userRepository.findByEmailIgnoreCase(normalizeEmail(email)).ifPresentOrElse(user -> {
            LocalDateTime now = LocalDateTime.now(clock);
            user.setPasswordResetToken(tokenGenerator.hexToken(TOKEN_BYTES));
            user.setPasswordResetExpires(now.plus(properties.getTokens().getPasswordResetTtl()));
            user.setUpdatedAt(now);
            userRepository.save(user);
            emailService.sendPasswordResetEmail(user, user.getPasswordResetToken());
            log.info("Password reset requested: userId={}", user.getId());
        }, () -> log.debug("Password reset requested for unknown e-mail"));
    }

    /**
     * @throws ResourceNotFoundException if the token is unknown or already used
     * @throws TokenExpiredException     if the token is past its expiry
     */
    @Transactional
    public void resetPassword(String token, String newPassword) {
        User user = userRepository.findByPasswordResetToken(token)
                .orElseThrow(() -> new ResourceNotFoundException("Invalid or expired reset token"));
        if (isExpired(user.getPasswordResetExpires())) {
            throw new TokenExpiredException("Reset token has expired");
        }

        user.setPasswordHash(passwordEncoder.encode(newPassword));
        user.setPasswordResetToken(null);
        user.setPasswordResetExpires(null);
        user.setUpdatedAt(LocalDateTime.now(clock));
        userRepository.save(user);
        log.info("Password reset: userId={}", user.getId());
    }

    /**
     * Generates a new secret. Nothing is stored until {@link #enableTwoFactor} confirms a code.
     *
     * @throws IllegalArgumentException if two-factor authentication is already enabled
     */
    public TwoFactorSetupResponse setupTwoFactor(User user) {
        if (user.isTwoFactorEnabled()) {
            throw new IllegalArgumentException("Two-factor authentication is already enabled");
        }
        String secret = twoFactorService.generateSecret();
        return new TwoFactorSetupResponse(
                secret,
                twoFactorService.otpauthUri(secret, user.getEmail()),
                "Scan the QR code with your authenticator app and verify with a code to enable 2FA");
    }

    /**
     * @throws IllegalArgumentException if the code does not match the secret
     */
    @Transactional
    public void enableTwoFactor(User user, String secret, String code) {
        if (!twoFactorService.verifyCode(secret, code)) {
            throw new IllegalArgumentException("Invalid verification code");
        }
        user.setTwoFactorEnabled(true);
        user.setTwoFactorSecret(secret);
        user.setUpdatedAt(LocalDateTime.now(clock));
        userRepository.save(user);
        log.info("Two-factor authentication enabled: userId={}", user.getId());
    }

    /**
     * @throws IllegalArgumentException if two-factor authentication is not enabled
     */
    @Transactional
    public void disableTwoFactor(User user) {
        if (!user.isTwoFactorEnabled()) {
            throw new IllegalArgumentException("Two-factor authentication is not enabled");
        }
        user.setTwoFactorEnabled(false);
        user.setTwoFactorSecret(null);
        user.setUpdatedAt(LocalDateTime.now(clock));
        userRepository.save(user);
        log.info("Two-factor authentication disabled: userId={}", user.getId());
    }

    void ensureUnique(String email, String username) {
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new DuplicateResourceException("Email already registered");
        }
        if (userRepository.existsByUsernameIgnoreCase(username.trim())) {
            throw new DuplicateResourceException("Username already taken");
        }
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private boolean isExpired(LocalDateTime expires) {
        return expires == null || expires.isBefore(LocalDateTime.now(clock));
    }
}
