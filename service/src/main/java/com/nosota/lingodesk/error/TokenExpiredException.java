package com.nosota.lingodesk.error;

/**
 * A verification or reset token exists but is past its expiry.
 */
public class TokenExpiredException extends RuntimeException {
    public TokenExpiredException(String message) {
        super(message);
    }
}
