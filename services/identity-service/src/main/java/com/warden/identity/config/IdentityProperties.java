package com.warden.identity.config;

import com.warden.security.IdentityResolverSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of identity resolution, bound from {@code warden.auth.*}.
 *
 * <pre>
 * warden:
 *   auth:
 *     api-path-prefix: /api/
 *     enable-reverse-proxy-auth: true
 *     enable-reverse-proxy-auto-register: false
 *     reverse-proxy-auth-user: X-WEBAUTH-USER
 *     seed-users:
 *       - name: admin
 *         email: admin@example.com
 *         password: change-me
 * </pre>
 *
 * @param apiPathPrefix requests under this prefix may authenticate with access tokens
 * @param enableReverseProxyAuth trust the reverse proxy header as the caller's user name
 * @param enableReverseProxyAutoRegister create unknown users asserted by the reverse proxy
 * @param reverseProxyAuthUser name of the header set by the reverse proxy
 * @param seedUsers accounts created at startup, before requests are authenticated
 */
@ConfigurationProperties(prefix = "warden.auth")
@Validated
public record IdentityProperties(
        @Pattern(regexp = "/.*", message = "must start with '/'") String apiPathPrefix,
        boolean enableReverseProxyAuth,
        boolean enableReverseProxyAutoRegister,
        @NotBlank String reverseProxyAuthUser,
        @Valid List<SeedUser> seedUsers) {

    /**
     * Compact constructor: applies defaults for optional fields. Runs before Bean Validation, so
     * defaults satisfy constraints.
     */
    public IdentityProperties {
        if (apiPathPrefix == null || apiPathPrefix.isBlank()) {
            apiPathPrefix = IdentityResolverSettings.DEFAULT_API_PATH_PREFIX;
        }
        if (reverseProxyAuthUser == null || reverseProxyAuthUser.isBlank()) {
            reverseProxyAuthUser = IdentityResolverSettings.DEFAULT_REVERSE_PROXY_AUTH_USER;
        }
        seedUsers = seedUsers == null ? List.of() : List.copyOf(seedUsers);
    }

    public IdentityResolverSettings toSettings() {
        return new IdentityResolverSettings(
                apiPathPrefix,
                enableReverseProxyAuth,
                enableReverseProxyAutoRegister,
                reverseProxyAuthUser);
    }

    /**
     * An account created at startup.
     *
     * @param name login name
     * @param email email address
     * @param password initial password
     */
    public record SeedUser(@NotBlank String name, @NotBlank String email, @NotBlank String password) {

        @Override
        public String toString() {
            return "SeedUser[name=" + name + ", email=" + email + "]";
        }
    }
}
