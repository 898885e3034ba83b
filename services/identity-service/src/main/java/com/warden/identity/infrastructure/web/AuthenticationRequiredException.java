package com.warden.identity.infrastructure.web;

/**
 * Thrown by endpoints that need a signed-in user when the request resolved anonymously.
 */
public class AuthenticationRequiredException extends RuntimeException {

    public AuthenticationRequiredException() {
        super("Authentication required");
    }
}
