package com.warden.identity.api;

import com.warden.identity.infrastructure.web.AuthenticationRequiredException;
import com.warden.identity.infrastructure.web.IdentityResolutionFilter;
import com.warden.security.ResolutionResult;
import com.warden.security.User;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * API endpoints for the authenticated caller. Accepts access tokens, sessions, reverse proxy
 * and Basic credentials.
 */
@RestController
@RequestMapping("/api/v1")
public class UserApiController {

    @GetMapping("/user")
    public User currentUser(
            @RequestAttribute(IdentityResolutionFilter.RESULT_ATTRIBUTE) ResolutionResult identity) {
        return identity.userIfPresent().orElseThrow(AuthenticationRequiredException::new);
    }
}
