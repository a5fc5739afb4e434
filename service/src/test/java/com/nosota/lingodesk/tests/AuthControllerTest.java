package com.nosota.lingodesk.tests;

import com.nosota.lingodesk.TestBase;
import com.nosota.lingodesk.api.model.CreditTransactionType;
import com.nosota.lingodesk.api.model.UserRole;
import com.nosota.lingodesk.api.request.LoginRequest;
import com.nosota.lingodesk.api.request.RegisterRequest;
import com.nosota.lingodesk.api.request.ResetPasswordRequest;
import com.nosota.lingodesk.api.request.TwoFactorVerifyRequest;
import com.nosota.lingodesk.api.response.TwoFactorSetupResponse;
import com.nosota.lingodesk.model.Account;
import com.nosota.lingodesk.model.CreditTransaction;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.repository.CreditTransactionRepository;
import com.nosota.lingodesk.service.TwoFactorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.web.servlet.MvcResult;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Registration, e-mail verification, login, password reset and two-factor flows through the REST API.
 */
public class AuthControllerTest extends TestBase {

    @Autowired
    private CreditTransactionRepository creditTransactionRepository;

    @Autowired
    private TwoFactorService twoFactorService;

    private RegisterRequest registration(String email, String username) {
        return new RegisterRequest("Jane", "Doe", email, username, PASSWORD, "Acme Translations", null, null);
    }

    private User register(String email) throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(registration(email, "jane" + nextUnique()))))
                .andExpect(status().isCreated());
        return userRepository.findByEmailIgnoreCase(email).orElseThrow();
    }

    private void verify(User user) throws Exception {
        mockMvc.perform(get("/api/auth/verify-email").param("token", user.getEmailVerificationToken()))
                .andExpect(status().isOk());
    }

    // ==================== Registration ====================

    @Test
    public void register_ShouldCreateUnverifiedUserWithSignupCredits() throws Exception {
        String email = uniqueEmail("register");

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(registration(email, "reg" + nextUnique()))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Registration successful. Please check your email to verify your account."))
                .andExpect(jsonPath("$.userId").isNumber());

        User user = userRepository.findByEmailIgnoreCase(email).orElseThrow();
        assertThat(user.isEmailVerified()).isFalse();
        assertThat(user.getRole()).isEqualTo(UserRole.USER);
        assertThat(user.getEmailVerificationToken()).hasSize(64);
        assertThat(user.getEmailVerificationExpires()).isAfter(LocalDateTime.now(ZoneOffset.UTC).minusMinutes(1).plusHours(23));
        assertThat(user.getPreferredLanguages()).containsExactly("French", "Italian", "German", "Spanish");
        assertThat(passwordEncoder.matches(PASSWORD, user.getPasswordHash())).isTrue();

        Account account = accountRepository.findById(user.getAccountId()).orElseThrow();
        assertThat(account.getCredits()).isEqualTo(5000L);
        List<CreditTransaction> ledger = creditTransactionRepository.findByAccountIdOrderByCreatedAtDescIdDesc(account.getId());
        assertThat(ledger).hasSize(1);
        assertThat(ledger.get(0).getType()).isEqualTo(CreditTransactionType.SIGNUP_BONUS);
        assertThat(creditTransactionRepository.sumByAccountId(account.getId())).isEqualTo(account.getCredits());
    }

    @Test
    public void register_WithDuplicateEmail_ShouldReturn409AndCreateNothing() throws Exception {
        String email = uniqueEmail("duplicate");
        register(email);
        long users = userRepository.count();
        long accounts = accountRepository.count();

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(registration(email.toUpperCase(), "other" + nextUnique()))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Email already registered"));

        assertThat(userRepository.count()).isEqualTo(users);
        assertThat(accountRepository.count()).isEqualTo(accounts);
    }

    @Test
    public void register_WithDuplicateUsername_ShouldReturn409() throws Exception {
        String username = "taken" + nextUnique();
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(registration(uniqueEmail("first"), username))))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(registration(uniqueEmail("second"), username))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Username already taken"));
    }

    @Test
    public void register_WithShortPassword_ShouldReturn400() throws Exception {
        RegisterRequest request = new RegisterRequest("Jane", "Doe", uniqueEmail("short"), "short" + nextUnique(),
                "1234567", "Acme", null, null);

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"));
    }

    // ==================== E-mail verification ====================

    @Test
    public void login_BeforeVerification_ShouldReturn403EvenWithWrongPassword() throws Exception {
        User user = register(uniqueEmail("unverified"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), PASSWORD, null))))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), "wrong-password", null))))
                .andExpect(status().isForbidden());
    }

    @Test
    public void verifyEmail_ShouldEnableLoginAndConsumeToken() throws Exception {
        User user = register(uniqueEmail("verify"));
        String token = user.getEmailVerificationToken();

        mockMvc.perform(get("/api/auth/verify-email").param("token", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Email verified successfully"));

        User verified = userRepository.findById(user.getId()).orElseThrow();
        assertThat(verified.isEmailVerified()).isTrue();
        assertThat(verified.getEmailVerificationToken()).isNull();

        login(verified);

        mockMvc.perform(get("/api/auth/verify-email").param("token", token))
                .andExpect(status().isNotFound());
    }

    @Test
    public void verifyEmail_WithMissingUnknownOrExpiredToken_ShouldFail() throws Exception {
        mockMvc.perform(get("/api/auth/verify-email"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/auth/verify-email").param("token", "no-such-token"))
                .andExpect(status().isNotFound());

        User user = register(uniqueEmail("expired"));
        user.setEmailVerificationExpires(LocalDateTime.now(ZoneOffset.UTC).minusDays(2));
        userRepository.save(user);

        mockMvc.perform(get("/api/auth/verify-email").param("token", user.getEmailVerificationToken()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Verification token has expired"));
    }

    // ==================== Login and session ====================

    @Test
    public void login_WithBadCredentials_ShouldReturn401() throws Exception {
        User user = createVerifiedUser(UserRole.USER);

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), "wrong-password", null))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid credentials"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest("nobody-" + nextUnique() + "@example.com", PASSWORD, null))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Invalid credentials"));
    }

    @Test
    public void currentUser_ShouldRequireSession() throws Exception {
        mockMvc.perform(get("/api/auth/user"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Not authenticated"));

        User user = createVerifiedUser(UserRole.USER);
        MockHttpSession session = login(user);

        mockMvc.perform(get("/api/auth/user").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(user.getEmail()))
                .andExpect(jsonPath("$.role").value("user"))
                .andExpect(jsonPath("$.passwordHash").doesNotExist());

        assertThat(userRepository.findById(user.getId()).orElseThrow().getLastLoginAt()).isNotNull();
    }

    @Test
    public void logout_ShouldInvalidateSession() throws Exception {
        MockHttpSession session = login(createVerifiedUser(UserRole.USER));

        mockMvc.perform(post("/api/auth/logout").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Logout successful"));

        assertThat(session.isInvalid()).isTrue();
        mockMvc.perform(get("/api/auth/user").session(session))
                .andExpect(status().isUnauthorized());
    }

    // ==================== Password reset ====================

    @Test
    public void forgotPassword_ShouldAnswerTheSameForUnknownEmail() throws Exception {
        mockMvc.perform(post("/api/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "ghost-" + nextUnique() + "@example.com"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("If an account with that email exists, a password reset email has been sent."));
    }

    @Test
    public void resetPassword_ShouldReplacePasswordAndConsumeToken() throws Exception {
        User user = createVerifiedUser(UserRole.USER);

        mockMvc.perform(post("/api/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", user.getEmail()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("If an account with that email exists, a password reset email has been sent."));

        String token = userRepository.findById(user.getId()).orElseThrow().getPasswordResetToken();
        assertThat(token).isNotBlank();

        mockMvc.perform(post("/api/auth/reset-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ResetPasswordRequest(token, "new-password-1"))))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), "new-password-1", null))))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/auth/reset-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ResetPasswordRequest(token, "another-password"))))
                .andExpect(status().isNotFound());
    }

    @Test
    public void resetPassword_WithExpiredToken_ShouldReturn400() throws Exception {
        User user = createVerifiedUser(UserRole.USER);
        user.setPasswordResetToken("expired-" + nextUnique());
        user.setPasswordResetExpires(LocalDateTime.now(ZoneOffset.UTC).minusHours(3));
        userRepository.save(user);

        mockMvc.perform(post("/api/auth/reset-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ResetPasswordRequest(user.getPasswordResetToken(), "new-password-1"))))
                .andExpect(status().isBadRequest());
    }

    // ==================== Two-factor authentication ====================

    @Test
    public void twoFactor_FullLifecycle() throws Exception {
        User user = createVerifiedUser(UserRole.USER);
        MockHttpSession session = login(user);

        MvcResult setup = mockMvc.perform(post("/api/auth/2fa/setup").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.otpauthUrl").value(startsWith("otpauth://totp/")))
                .andReturn();
        String secret = read(setup, TwoFactorSetupResponse.class).secret();

        String wrongCode = shift(twoFactorService.currentCode(secret));
        mockMvc.perform(post("/api/auth/2fa/verify")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new TwoFactorVerifyRequest(secret, wrongCode))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid verification code"));

        mockMvc.perform(post("/api/auth/2fa/verify")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new TwoFactorVerifyRequest(secret, twoFactorService.currentCode(secret)))))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/auth/2fa/setup").session(session))
                .andExpect(status().isBadRequest());

        // password alone is no longer enough
        MvcResult partial = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), PASSWORD, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requiresTwoFactor").value(true))
                .andExpect(jsonPath("$.user").doesNotExist())
                .andReturn();
        MockHttpSession partialSession = (MockHttpSession) partial.getRequest().getSession(true);
        mockMvc.perform(get("/api/auth/user").session(partialSession))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), PASSWORD, wrongCode))))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), PASSWORD, twoFactorService.currentCode(secret)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requiresTwoFactor").value(false))
                .andExpect(jsonPath("$.user.twoFactorEnabled").value(true));

        mockMvc.perform(post("/api/auth/2fa/disable").session(session))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/auth/2fa/disable").session(session))
                .andExpect(status().isBadRequest());
        assertThat(userRepository.findById(user.getId()).orElseThrow().getTwoFactorSecret()).isNull();
    }

    /**
     * A six digit code that differs from the given one.
     */
    private static String shift(String code) {
        return String.format("%06d", (Integer.parseInt(code) + 500_000) % 1_000_000);
    }
}
