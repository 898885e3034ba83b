package com.warden.identity.infrastructure.directory;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.identity.config.IdentityProperties;
import com.warden.identity.config.IdentityProperties.SeedUser;
import com.warden.security.directory.InMemoryUserDirectory;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

@DisplayName("DirectoryBootstrap")
class DirectoryBootstrapTest {

    private final InMemoryUserDirectory directory = new InMemoryUserDirectory();

    private void run(List<SeedUser> seeds) {
        var properties = new IdentityProperties(null, false, false, null, seeds);
        new DirectoryBootstrap(directory, properties).run(new DefaultApplicationArguments());
    }

    @Test
    @DisplayName("seeds active users and marks the directory ready")
    void seedsUsers() {
        run(List.of(new SeedUser("alice", "alice@example.com", "wonderland")));

        var alice = directory.getUserByName("alice");
        assertThat(alice.active()).isTrue();
        assertThat(directory.verifyPassword(alice, "wonderland")).isTrue();
        assertThat(directory.isReady()).isTrue();
    }

    @Test
    @DisplayName("skips duplicate seed names and still becomes ready")
    void skipsDuplicates() {
        run(
                List.of(
                        new SeedUser("alice", "alice@example.com", "wonderland"),
                        new SeedUser("alice", "other@example.com", "other-pw")));

        assertThat(directory.userCount()).isEqualTo(1);
        assertThat(directory.getUserByName("alice").email()).isEqualTo("alice@example.com");
        assertThat(directory.isReady()).isTrue();
    }

    @Test
    @DisplayName("becomes ready with no seed users")
    void readyWithoutSeeds() {
        run(List.of());

        assertThat(directory.userCount()).isZero();
        assertThat(directory.isReady()).isTrue();
    }
}
