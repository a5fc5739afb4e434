package com.nosota.lingodesk.service;

import com.nosota.lingodesk.config.LingodeskProperties;
import lombok.RequiredArgsConstructor;
import org.apache.commons.codec.binary.Base32;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Locale;

/**
 * Time-based one-time passwords (RFC 6238): HMAC-SHA1, 30 second step, 6 digits.
 *
 * <p>Secrets are 20 random bytes exchanged as unpadded Base32, the format authenticator apps
 * expect in an {@code otpauth://} URI. Verification accepts codes from
 * {@code lingodesk.two-factor.window} steps before and after the current one to absorb clock drift.
 */
@Service
@RequiredArgsConstructor
public class TwoFactorService {

    static final int TIME_STEP_SECONDS = 30;
    static final int DIGITS = 6;
    private static final int SECRET_BYTES = 20;
    private static final int[] POWERS_OF_TEN = {1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000, 100_000_000};

    private final TokenGenerator tokenGenerator;
    private final LingodeskProperties properties;
    private final Clock clock;

    public String generateSecret() {
        return new Base32().encodeToString(tokenGenerator.randomBytes(SECRET_BYTES)).replace("=", "");
    }

    /**
     * Provisioning URI to be rendered as a QR code by the client.
     */
    public String otpauthUri(String secret, String accountName) {
        String issuer = properties.getTwoFactor().getIssuer();
        String label = UriUtils.encodePathSegment(issuer + ":" + accountName, StandardCharsets.UTF_8);
        return "otpauth://totp/" + label
                + "?secret=" + secret
                + "&issuer=" + UriUtils.encodeQueryParam(issuer, StandardCharsets.UTF_8)
                + "&algorithm=SHA1&digits=" + DIGITS + "&period=" + TIME_STEP_SECONDS;
    }

    /**
     * Checks a user-supplied code against the secret at the current time.
     *
     * @param secret Base32 secret
     * @param code   six digit code, surrounding whitespace ignored
     * @return true if the code matches any step inside the tolerance window
     */
    public boolean verifyCode(String secret, String code) {
        if (secret == null || code == null) {
            return false;
        }
        String candidate = code.trim();
        if (candidate.length() != DIGITS || !candidate.chars().allMatch(Character::isDigit)) {
            return false;
        }

        byte[] key = decodeSecret(secret);
        long currentStep = clock.instant().getEpochSecond() / TIME_STEP_SECONDS;
        int window = properties.getTwoFactor().getWindow();
        for (long step = currentStep - window; step <= currentStep + window; step++) {
            if (generateCode(key, step).equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    public String currentCode(String secret) {
        return generateCode(decodeSecret(secret), clock.instant().getEpochSecond() / TIME_STEP_SECONDS);
    }

    /**
     * HOTP value (RFC 4226) for one counter value, zero-padded to {@link #DIGITS} digits.
     */
    static String generateCode(byte[] key, long counter) {
        byte[] hash = new HmacUtils(HmacAlgorithms.HMAC_SHA_1, key)
                .hmac(ByteBuffer.allocate(Long.BYTES).putLong(counter).array());

        int offset = hash[hash.length - 1] & 0x0f;
        int binary = ((hash[offset] & 0x7f) << 24)
                | ((hash[offset + 1] & 0xff) << 16)
                | ((hash[offset + 2] & 0xff) << 8)
                | (hash[offset + 3] & 0xff);
        int otp = binary % POWERS_OF_TEN[DIGITS];
        return String.format("%0" + DIGITS + "d", otp);
    }

    private static byte[] decodeSecret(String secret) {
        return new Base32().decode(secret.replace(" ", "").toUpperCase(Locale.ROOT));
    }
}
