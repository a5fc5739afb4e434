package com.nosota.lingodesk.tests;

import com.nosota.lingodesk.TestBase;
import com.nosota.lingodesk.api.model.UserRole;
import com.nosota.lingodesk.api.request.ChangePasswordRequest;
import com.nosota.lingodesk.api.request.LanguagePreferencesRequest;
import com.nosota.lingodesk.api.request.LoginRequest;
import com.nosota.lingodesk.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpSession;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Self-service account and profile endpoints.
 */
public class AccountControllerTest extends TestBase {

    private User user;
    private MockHttpSession session;

    @BeforeEach
    public void setupUser() throws Exception {
        user = createVerifiedUser(UserRole.USER);
        session = login(user);
    }

    @Test
    public void getAccount_ShouldIncludeUsersCount() throws Exception {
        createVerifiedUser(user.getAccountId(), UserRole.CLIENT);

        mockMvc.perform(get("/api/account").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(user.getAccountId()))
                .andExpect(jsonPath("$.usersCount").value(2))
                .andExpect(jsonPath("$.subscriptionPlan").value("free"))
                .andExpect(jsonPath("$.subscriptionStatus").value("active"));
    }

    @Test
    public void changeSubscription_ShouldSwitchPlanAndSetRenewal() throws Exception {
        mockMvc.perform(post("/api/account/subscription")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("planId", "pro"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Subscription updated to Pro plan"))
                .andExpect(jsonPath("$.plan").value("pro"))
                .andExpect(jsonPath("$.renewal").isNotEmpty());

        assertThat(accountRepository.findById(user.getAccountId()).orElseThrow().getSubscriptionRenewal()).isNotNull();

        mockMvc.perform(post("/api/account/subscription")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("planId", "platinum"))))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void updateProfile_ShouldApplyGivenFields() throws Exception {
        mockMvc.perform(patch("/api/user/profile")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("jobTitle", "Localisation Manager", "phoneNumber", "+44 20 7946 0000"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobTitle").value("Localisation Manager"))
                .andExpect(jsonPath("$.firstName").value(user.getFirstName()));

        mockMvc.perform(get("/api/user/profile").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phoneNumber").value("+44 20 7946 0000"));
    }

    @Test
    public void updateProfile_WithTakenEmail_ShouldReturn409() throws Exception {
        User other = createVerifiedUser(UserRole.USER);

        mockMvc.perform(patch("/api/user/profile")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", other.getEmail()))))
                .andExpect(status().isConflict());
    }

    @Test
    public void changePassword_ShouldRequireMinimumLength() throws Exception {
        mockMvc.perform(patch("/api/user/password")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ChangePasswordRequest("short"))))
                .andExpect(status().isBadRequest());

        mockMvc.perform(patch("/api/user/password")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ChangePasswordRequest("a-much-longer-password"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Password updated successfully"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(user.getEmail(), "a-much-longer-password", null))))
                .andExpect(status().isOk());
    }

    @Test
    public void updateLanguagePreferences_ShouldReplaceList() throws Exception {
        mockMvc.perform(patch("/api/user/language-preferences")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LanguagePreferencesRequest(List.of("Japanese", " Korean ", "Japanese", "")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.preferredLanguages[0]").value("Japanese"))
                .andExpect(jsonPath("$.preferredLanguages[1]").value("Korean"))
                .andExpect(jsonPath("$.preferredLanguages.length()").value(2));

        assertThat(userRepository.findById(user.getId()).orElseThrow().getPreferredLanguages())
                .containsExactly("Japanese", "Korean");
    }

    @Test
    public void createApiKey_ShouldReturnRawKeyOnce() throws Exception {
        mockMvc.perform(post("/api/user/api-keys")
                        .session(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "CI pipeline"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("CI pipeline"))
                .andExpect(jsonPath("$.key").value(matchesPattern("ld_[0-9a-f]{48}")));
    }
}
