package com.nosota.lingodesk.error;

/**
 * Unique email or username already taken.
 */
public class DuplicateResourceException extends RuntimeException {
    public DuplicateResourceException(String message) {
        super(message);
    }
}
