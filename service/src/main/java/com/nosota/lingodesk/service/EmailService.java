package com.nosota.lingodesk.service;

import com.nosota.lingodesk.config.LingodeskProperties;
import com.nosota.lingodesk.model.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

/**
 * Sends account e-mails through the configured SMTP server.
 * <p>
 * Without {@code spring.mail.host} there is no {@link JavaMailSender} bean and messages are
 * written to the log instead, which is how local and test environments read the links.
 * A delivery failure is logged and does not fail the calling operation.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmailService {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final LingodeskProperties properties;

    public void sendVerificationEmail(User user, String token) {
        String link = properties.getBaseUrl() + "/api/auth/verify-email?token=" + token;
        send(user.getEmail(),
                "Verify your LingoDesk account",
                "Hello " + user.getFirstName() + ",\n\n"
                        + "Please confirm your e-mail address by opening the link below:\n\n"
                        + link + "\n\n"
                        + "The link expires in " + properties.getTokens().getEmailVerificationTtl().toHours() + " hours.\n");
    }

    public void sendPasswordResetEmail(User user, String token) {
        String link = properties.getBaseUrl() + "/reset-password?token=" + token;
        send(user.getEmail(),
                "Reset your LingoDesk password",
                "Hello " + user.getFirstName() + ",\n\n"
                        + "A password reset was requested for your account. Open the link below to choose a new password:\n\n"
                        + link + "\n\n"
                        + "The link expires in " + properties.getTokens().getPasswordResetTtl().toMinutes() + " minutes "
                        + "and can be used once. If you did not request it, ignore this e-mail.\n");
    }

    private void send(String to, String subject, String text) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            log.info("Mail delivery disabled, message to {}: subject='{}'\n{}", to, subject, text);
            return;
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(properties.getMail().getFrom());
        message.setTo(to);
        message.setSubject(subject);
        message.setText(text);
        try {
            sender.send(message);
            log.info("Mail sent to {}: subject='{}'", to, subject);
        } catch (MailException e) {
            log.error("Failed to send mail to {}: subject='{}'", to, subject, e);
        }
    }
}
