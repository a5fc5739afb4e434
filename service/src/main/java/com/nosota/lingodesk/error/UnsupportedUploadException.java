package com.nosota.lingodesk.error;

/**
 * The uploaded file cannot be analysed (empty, unreadable archive, no supported entry).
 */
public class UnsupportedUploadException extends RuntimeException {
    public UnsupportedUploadException(String message) {
        super(message);
    }

    public UnsupportedUploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
