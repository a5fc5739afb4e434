package com.nosota.lingodesk.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Random tokens for e-mail verification links, password reset links and API keys.
 */
@Component
public class TokenGenerator {

    private final SecureRandom random = new SecureRandom();

    /**
     * @param bytes entropy in bytes; the token is twice as long in hex characters
     */
    public String hexToken(int bytes) {
        byte[] buffer = new byte[bytes];
        random.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }

    public byte[] randomBytes(int bytes) {
        byte[] buffer = new byte[bytes];
        random.nextBytes(buffer);
        return buffer;
    }
}
