package com.warden.security;

/**
 * Switches that control which mechanisms {@link IdentityResolver} may use.
 *
 * @param apiPathPrefix                  paths starting with this prefix accept access tokens
 * @param enableReverseProxyAuth         trust the {@code reverseProxyAuthUser} header as the caller's user name
 * @param enableReverseProxyAutoRegister create unknown users asserted by the reverse proxy
 * @param reverseProxyAuthUser           name of the header set by the reverse proxy
 */
public record IdentityResolverSettings(
        String apiPathPrefix,
        boolean enableReverseProxyAuth,
        boolean enableReverseProxyAutoRegister,
        String reverseProxyAuthUser
) {

    public static final String DEFAULT_API_PATH_PREFIX = "/api/";

    public static final String DEFAULT_REVERSE_PROXY_AUTH_USER = "X-WEBAUTH-USER";

    /**
     * Compact constructor: applies defaults for blank values.
     */
    public IdentityResolverSettings {
        if (apiPathPrefix == null || apiPathPrefix.isBlank()) {
            apiPathPrefix = DEFAULT_API_PATH_PREFIX;
        }
        if (reverseProxyAuthUser == null || reverseProxyAuthUser.isBlank()) {
            reverseProxyAuthUser = DEFAULT_REVERSE_PROXY_AUTH_USER;
        }
    }

    /**
     * Settings with reverse proxy authentication disabled.
     */
    public static IdentityResolverSettings defaults() {
        return new IdentityResolverSettings(DEFAULT_API_PATH_PREFIX, false, false, DEFAULT_REVERSE_PROXY_AUTH_USER);
    }
}
