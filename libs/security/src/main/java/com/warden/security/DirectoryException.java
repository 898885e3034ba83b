package com.warden.security;

/**
 * Failure reported by a {@link UserDirectory}.
 * <p>
 * Subclasses describe expected conditions (a missing user or token, a taken name);
 * a plain {@code DirectoryException} means the backing store failed.
 */
public class DirectoryException extends RuntimeException {

    public DirectoryException(String message) {
        super(message);
    }

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
