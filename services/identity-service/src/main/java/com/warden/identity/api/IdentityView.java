package com.warden.identity.api;

import com.warden.security.ResolutionResult;
import com.warden.security.User;

/**
 * JSON view of a request's resolved identity.
 *
 * @param signedIn whether a user was resolved
 * @param user the resolved user, or null
 * @param basicAuth whether the user was resolved from re-verified Basic credentials
 * @param method the resolution mechanism, e.g. {@code SESSION}
 */
public record IdentityView(boolean signedIn, User user, boolean basicAuth, String method) {

    public static IdentityView of(ResolutionResult result) {
        return new IdentityView(
                result.isAuthenticated(),
                result.user(),
                result.basicAuthUsed(),
                result.method().name());
    }
}
