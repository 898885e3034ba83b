package com.warden.security;

import java.util.Optional;

/**
 * Outcome of resolving a request's identity.
 *
 * @param user   the resolved user, or null for anonymous requests
 * @param method mechanism that produced {@code user}; {@link AuthMethod#ANONYMOUS} when none did
 */
public record ResolutionResult(User user, AuthMethod method) {

    private static final ResolutionResult ANONYMOUS = new ResolutionResult(null, AuthMethod.ANONYMOUS);

    public ResolutionResult {
        if (method == null) {
            throw new IllegalArgumentException("method must not be null");
        }
        if ((user == null) != (method == AuthMethod.ANONYMOUS)) {
            throw new IllegalArgumentException("a user is required exactly when method is not ANONYMOUS");
        }
    }

    public static ResolutionResult anonymous() {
        return ANONYMOUS;
    }

    public static ResolutionResult of(User user, AuthMethod method) {
        return new ResolutionResult(user, method);
    }

    public Optional<User> userIfPresent() {
        return Optional.ofNullable(user);
    }

    public boolean isAuthenticated() {
        return user != null;
    }

    /**
     * True when the identity came from re-verified Basic credentials rather than
     * a trusted session, token or proxy header.
     */
    public boolean basicAuthUsed() {
        return method == AuthMethod.BASIC;
    }
}
