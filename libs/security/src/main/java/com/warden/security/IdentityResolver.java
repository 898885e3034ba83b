package com.warden.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Resolves the user behind an incoming request.
 * <p>
 * Mechanisms are tried in a fixed order and the first definitive answer wins:
 * <ol>
 *   <li>API access token ({@code Authorization: token <sha>} on paths under the API prefix)</li>
 *   <li>signed-in user id stored in the session</li>
 *   <li>reverse proxy header (when enabled), with optional auto-registration</li>
 *   <li>HTTP Basic credentials</li>
 * </ol>
 * Authentication failures never raise: a missing user or token resolves to an anonymous
 * request silently, and any other directory failure is logged and resolves the same way.
 * <p>
 * Until the readiness supplier reports the backing store as initialized, every request
 * is anonymous, so the application can serve traffic while the directory boots.
 * <p>
 * Instances hold no mutable state and are safe to share between request threads.
 */
public final class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    /** Session key holding the signed-in user's numeric id. */
    public static final String SESSION_UID_KEY = "uid";

    /** Domain of the placeholder email given to auto-registered users. */
    static final String AUTO_REGISTER_EMAIL_DOMAIN = "@localhost";

    private final UserDirectory directory;
    private final BooleanSupplier ready;
    private final IdentityResolverSettings settings;

    /**
     * @param directory user and token lookups
     * @param ready     reports whether the directory's backing store has been initialized
     * @param settings  reverse proxy and API path switches
     */
    public IdentityResolver(UserDirectory directory, BooleanSupplier ready, IdentityResolverSettings settings) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        if (ready == null) {
            throw new IllegalArgumentException("ready must not be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.directory = directory;
        this.ready = ready;
        this.settings = settings;
    }

    /**
     * Returns the id of the signed-in user, or {@code 0} when the request is anonymous.
     * <p>
     * Only access tokens and the session are consulted; reverse proxy and Basic
     * credentials are handled by {@link #resolveUser}.
     *
     * @param request the incoming request
     * @param session the request's session store
     * @return a positive user id, or 0
     */
    public long resolveUserId(AuthRequest request, SessionStore session) {
        return signedIn(request, session).uid();
    }

    /**
     * Resolves the full user behind a request, falling back to reverse proxy and Basic
     * authentication when neither an access token nor the session identifies the caller.
     *
     * @param request the incoming request
     * @param session the request's session store
     * @return the resolution result; {@link ResolutionResult#anonymous()} when nobody was identified
     */
    public ResolutionResult resolveUser(AuthRequest request, SessionStore session) {
        if (!ready.getAsBoolean()) {
            return ResolutionResult.anonymous();
        }

        SignedIn signedIn = signedIn(request, session);
        if (signedIn.uid() > 0) {
            try {
                return ResolutionResult.of(directory.getUserById(signedIn.uid()), signedIn.method());
            } catch (RuntimeException e) {
                logFailure("getUserById", e);
                return ResolutionResult.anonymous();
            }
        }

        if (settings.enableReverseProxyAuth()) {
            String proxyUser = request.header(settings.reverseProxyAuthUser());
            if (proxyUser != null && !proxyUser.isEmpty()) {
                return resolveReverseProxyUser(proxyUser);
            }
        }

        return resolveBasicUser(request);
    }

    private SignedIn signedIn(AuthRequest request, SessionStore session) {
        if (!ready.getAsBoolean()) {
            return SignedIn.NONE;
        }

        if (isApiPath(request.path())) {
            Optional<AuthorizationHeader> header = AuthorizationHeader.from(request)
                    .filter(h -> h.isScheme(AuthorizationHeader.TOKEN_SCHEME));
            if (header.isPresent()) {
                return signedInByToken(header.get().credentials());
            }
        }

        return signedInBySession(session);
    }

    private SignedIn signedInByToken(String sha) {
        try {
            AccessToken token = directory.getAccessTokenBySha(sha);
            return new SignedIn(token.uid(), AuthMethod.ACCESS_TOKEN);
        } catch (AccessTokenNotFoundException e) {
            return SignedIn.NONE;
        } catch (RuntimeException e) {
            logFailure("getAccessTokenBySha", e);
            return SignedIn.NONE;
        }
    }

    private SignedIn signedInBySession(SessionStore session) {
        if (session == null) {
            return SignedIn.NONE;
        }
        Object value = session.get(SESSION_UID_KEY);
        long uid;
        if (value instanceof Long l) {
            uid = l;
        } else if (value instanceof Integer i) {
            uid = i;
        } else {
            return SignedIn.NONE;
        }
        if (uid <= 0) {
            return SignedIn.NONE;
        }

        try {
            directory.getUserById(uid);
            return new SignedIn(uid, AuthMethod.SESSION);
        } catch (UserNotFoundException e) {
            return SignedIn.NONE;
        } catch (RuntimeException e) {
            logFailure("getUserById", e);
            return SignedIn.NONE;
        }
    }

    /**
     * A non-empty proxy header is terminal: whatever happens here, Basic auth is not tried.
     */
    private ResolutionResult resolveReverseProxyUser(String name) {
        try {
            return ResolutionResult.of(directory.getUserByName(name), AuthMethod.REVERSE_PROXY);
        } catch (UserNotFoundException e) {
            if (!settings.enableReverseProxyAutoRegister()) {
                log.debug("Reverse proxy user is not registered and auto-registration is disabled");
                return ResolutionResult.anonymous();
            }
        } catch (RuntimeException e) {
            logFailure("getUserByName", e);
            return ResolutionResult.anonymous();
        }
        return autoRegister(name);
    }

    private ResolutionResult autoRegister(String name) {
        var newUser = new NewUser(name, UUID.randomUUID() + AUTO_REGISTER_EMAIL_DOMAIN, name, true);
        try {
            User created = directory.createUser(newUser);
            log.info("Auto-registered reverse proxy user id={}", created.id());
            return ResolutionResult.of(created, AuthMethod.REVERSE_PROXY);
        } catch (UserAlreadyExistsException e) {
            // Another request registered the same name first.
            try {
                return ResolutionResult.of(directory.getUserByName(name), AuthMethod.REVERSE_PROXY);
            } catch (RuntimeException lookup) {
                logFailure("getUserByName", lookup);
                return ResolutionResult.anonymous();
            }
        } catch (RuntimeException e) {
            logFailure("createUser", e);
            return ResolutionResult.anonymous();
        }
    }

    private ResolutionResult resolveBasicUser(AuthRequest request) {
        Optional<BasicCredentials> credentials = AuthorizationHeader.from(request)
                .filter(h -> h.isScheme(AuthorizationHeader.BASIC_SCHEME))
                .flatMap(h -> BasicCredentials.decode(h.credentials()));
        if (credentials.isEmpty()) {
            return ResolutionResult.anonymous();
        }

        User user;
        try {
            user = directory.getUserByName(credentials.get().username());
        } catch (UserNotFoundException e) {
            return ResolutionResult.anonymous();
        } catch (RuntimeException e) {
            logFailure("getUserByName", e);
            return ResolutionResult.anonymous();
        }

        try {
            if (directory.verifyPassword(user, credentials.get().password())) {
                return ResolutionResult.of(user, AuthMethod.BASIC);
            }
        } catch (RuntimeException e) {
            logFailure("verifyPassword", e);
        }
        return ResolutionResult.anonymous();
    }

    private boolean isApiPath(String path) {
        return path != null && path.startsWith(settings.apiPathPrefix());
    }

    private static void logFailure(String operation, RuntimeException e) {
        log.error("{}: {}", operation, e.getMessage(), e);
    }

    private record SignedIn(long uid, AuthMethod method) {
        static final SignedIn NONE = new SignedIn(0, AuthMethod.ANONYMOUS);
    }
}
