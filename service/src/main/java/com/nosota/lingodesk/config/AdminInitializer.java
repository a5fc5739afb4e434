package com.nosota.lingodesk.config;

import com.nosota.lingodesk.api.model.SubscriptionPlan;
import com.nosota.lingodesk.api.model.SubscriptionStatus;
import com.nosota.lingodesk.api.model.UserRole;
import com.nosota.lingodesk.model.Account;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.repository.AccountRepository;
import com.nosota.lingodesk.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Creates the first administrator from {@code lingodesk.bootstrap.admin.*} on startup.
 * Self-registered users never get the admin role, so this is how an installation gets one.
 * Skipped when the properties are blank or the e-mail already exists.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminInitializer implements ApplicationRunner {

    private final LingodeskProperties properties;
    private final AccountRepository accountRepository;
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        LingodeskProperties.Admin admin = properties.getBootstrap().getAdmin();
        if (!StringUtils.hasText(admin.getEmail()) || !StringUtils.hasText(admin.getPassword())) {
            return;
        }
        String email = admin.getEmail().trim().toLowerCase(Locale.ROOT);
        if (userRepository.existsByEmailIgnoreCase(email)) {
            log.debug("Bootstrap administrator already exists: {}", email);
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Account account = new Account();
        account.setName(admin.getAccountName());
        account.setCredits(0L);
        account.setSubscriptionPlan(SubscriptionPlan.FREE);
        account.setSubscriptionStatus(SubscriptionStatus.ACTIVE);
        account.setCreatedAt(now);
        account = accountRepository.save(account);

        User user = new User();
        user.setAccountId(account.getId());
        user.setFirstName("Admin");
        user.setLastName("User");
        user.setEmail(email);
        user.setUsername(email.substring(0, email.indexOf('@') > 0 ? email.indexOf('@') : email.length()));
        user.setPasswordHash(passwordEncoder.encode(admin.getPassword()));
        user.setRole(UserRole.ADMIN);
        user.setEmailVerified(true);
        user.setPreferredLanguages(new ArrayList<>(List.of("French", "Italian", "German", "Spanish")));
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        userRepository.save(user);

        log.info("Bootstrap administrator created: email={}, accountId={}", email, account.getId());
    }
}
