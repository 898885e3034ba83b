package com.warden.security.directory;

import com.warden.security.AccessToken;
import com.warden.security.AccessTokenNotFoundException;
import com.warden.security.NewUser;
import com.warden.security.User;
import com.warden.security.UserAlreadyExistsException;
import com.warden.security.UserDirectory;
import com.warden.security.UserNotFoundException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe {@link UserDirectory} held in memory.
 * <p>
 * Used for local runs and tests. Passwords are kept as supplied and compared in constant
 * time; there is no hashing and nothing survives a restart.
 * <p>
 * The directory starts out not ready; {@link #markReady()} is called once seeding is done.
 * <p>
 * A user becomes visible by name only after its id and password are stored. A creation
 * rejected for a taken name leaves nothing behind but still consumes an id, so ids can
 * have gaps.
 */
public class InMemoryUserDirectory implements UserDirectory {

    private static final int TOKEN_BYTES = 20;

    private final Map<Long, User> usersById = new ConcurrentHashMap<>();
    private final Map<String, User> usersByName = new ConcurrentHashMap<>();
    private final Map<Long, byte[]> passwords = new ConcurrentHashMap<>();
    private final Map<String, AccessToken> tokensBySha = new ConcurrentHashMap<>();
    private final AtomicLong userSequence = new AtomicLong();
    private final AtomicLong tokenSequence = new AtomicLong();
    private final AtomicBoolean ready = new AtomicBoolean();
    private final SecureRandom random = new SecureRandom();

    /**
     * Whether the directory has finished initializing.
     */
    public boolean isReady() {
        return ready.get();
    }

    public void markReady() {
        ready.set(true);
    }

    @Override
    public User getUserById(long id) {
        User user = usersById.get(id);
        if (user == null) {
            throw UserNotFoundException.forId(id);
        }
        return user;
    }

    @Override
    public User getUserByName(String name) {
        User user = name == null ? null : usersByName.get(name);
        if (user == null) {
            throw UserNotFoundException.forName(name);
        }
        return user;
    }

    @Override
    public AccessToken getAccessTokenBySha(String sha) {
        AccessToken token = sha == null ? null : tokensBySha.get(sha);
        if (token == null) {
            throw new AccessTokenNotFoundException();
        }
        return token;
    }

    @Override
    public User createUser(NewUser newUser) {
        if (newUser.name() == null || newUser.name().isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        long id = userSequence.incrementAndGet();
        var user = new User(id, newUser.name(), newUser.email(), newUser.active());
        // The user is complete by id before its name becomes visible.
        passwords.put(id, bytes(newUser.password()));
        usersById.put(id, user);
        if (usersByName.putIfAbsent(user.name(), user) != null) {
            usersById.remove(id);
            passwords.remove(id);
            throw new UserAlreadyExistsException(user.name());
        }
        return user;
    }

    @Override
    public AccessToken createAccessToken(long uid, String name) {
        getUserById(uid);
        byte[] raw = new byte[TOKEN_BYTES];
        random.nextBytes(raw);
        var token = new AccessToken(tokenSequence.incrementAndGet(), uid, name, HexFormat.of().formatHex(raw));
        tokensBySha.put(token.sha(), token);
        return token;
    }

    @Override
    public boolean verifyPassword(User user, String password) {
        byte[] stored = passwords.get(user.id());
        return stored != null && password != null && MessageDigest.isEqual(stored, bytes(password));
    }

    /**
     * Removes a user and its access tokens.
     */
    public void deleteUser(long id) {
        User removed = usersById.remove(id);
        if (removed == null) {
            throw UserNotFoundException.forId(id);
        }
        usersByName.remove(removed.name());
        passwords.remove(id);
        tokensBySha.values().removeIf(token -> token.uid() == id);
    }

    public int userCount() {
        return usersById.size();
    }

    private static byte[] bytes(String password) {
        return password == null ? new byte[0] : password.getBytes(StandardCharsets.UTF_8);
    }
}
