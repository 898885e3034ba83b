package com.warden.identity.config;

import com.warden.forms.FormProjection;
import com.warden.security.IdentityResolver;
import com.warden.security.directory.InMemoryUserDirectory;
import org.springframework.context.MessageSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the identity resolver, its directory and the form projection.
 *
 * <p>The directory is in-memory; a persistent {@link com.warden.security.UserDirectory} replaces
 * this bean without touching the resolver or the web layer.
 */
@Configuration
public class IdentityConfig {

    @Bean
    public InMemoryUserDirectory userDirectory() {
        return new InMemoryUserDirectory();
    }

    @Bean
    public IdentityResolver identityResolver(InMemoryUserDirectory directory, IdentityProperties properties) {
        return new IdentityResolver(directory, directory::isReady, properties.toSettings());
    }

    @Bean
    public FormProjection formProjection(MessageSource messageSource) {
        return new FormProjection(messageSource);
    }
}
