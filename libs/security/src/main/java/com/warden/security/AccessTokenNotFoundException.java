package com.warden.security;

/**
 * Thrown when no access token matches the presented value.
 */
public class AccessTokenNotFoundException extends DirectoryException {

    public AccessTokenNotFoundException() {
        super("access token does not exist");
    }
}
