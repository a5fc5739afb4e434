package com.nosota.lingodesk.error;

/**
 * Thrown when a requested entity does not exist or is not visible to the caller's account.
 */
public class ResourceNotFoundException extends RuntimeException {
    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }
}
