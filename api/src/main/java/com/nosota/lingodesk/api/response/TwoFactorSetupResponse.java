package com.nosota.lingodesk.api.response;

/**
 * @param secret      Base32 secret to enter manually in an authenticator app
 * @param otpauthUrl  {@code otpauth://} URI; rendered as a QR code by the client
 * @param message     Instructions
 */
public record TwoFactorSetupResponse(
        String secret,
        String otpauthUrl,
        String message
) {
}
