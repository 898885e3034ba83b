package com.warden.identity.infrastructure.directory;

import com.warden.identity.config.IdentityProperties;
import com.warden.security.NewUser;
import com.warden.security.UserAlreadyExistsException;
import com.warden.security.directory.InMemoryUserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds the configured users and then marks the directory ready.
 *
 * <p>Until this runner completes, every request resolves anonymously.
 */
@Component
public class DirectoryBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DirectoryBootstrap.class);

    private final InMemoryUserDirectory directory;
    private final IdentityProperties properties;

    public DirectoryBootstrap(InMemoryUserDirectory directory, IdentityProperties properties) {
        this.directory = directory;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        for (IdentityProperties.SeedUser seed : properties.seedUsers()) {
            try {
                var user = directory.createUser(new NewUser(seed.name(), seed.email(), seed.password(), true));
                log.info("Seeded user id={} name={}", user.id(), user.name());
            } catch (UserAlreadyExistsException e) {
                log.warn("Skipping seed user: {}", e.getMessage());
            }
        }
        directory.markReady();
        log.info("User directory ready with {} user(s)", directory.userCount());
    }
}
