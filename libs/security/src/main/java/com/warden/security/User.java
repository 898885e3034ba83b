package com.warden.security;

/**
 * A user account as seen by identity resolution.
 * <p>
 * The password is not part of this record: it stays inside the {@link UserDirectory}
 * and can only be checked through {@link UserDirectory#verifyPassword(User, String)}.
 *
 * @param id     unique, positive user id
 * @param name   unique login name
 * @param email  email address
 * @param active whether the account has been activated
 */
public record User(
        long id,
        String name,
        String email,
        boolean active
) {
}
