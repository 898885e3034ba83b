package com.warden.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IdentityResolverSettings")
class IdentityResolverSettingsTest {

    @Test
    @DisplayName("defaults blank values")
    void defaultsBlankValues() {
        var settings = new IdentityResolverSettings(null, true, false, " ");

        assertThat(settings.apiPathPrefix()).isEqualTo("/api/");
        assertThat(settings.reverseProxyAuthUser()).isEqualTo("X-WEBAUTH-USER");
        assertThat(settings.enableReverseProxyAuth()).isTrue();
    }

    @Test
    @DisplayName("defaults() disables reverse proxy auth")
    void defaultsDisableProxy() {
        var settings = IdentityResolverSettings.defaults();

        assertThat(settings.enableReverseProxyAuth()).isFalse();
        assertThat(settings.enableReverseProxyAutoRegister()).isFalse();
    }
}
