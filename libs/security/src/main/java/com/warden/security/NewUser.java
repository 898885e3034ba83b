package com.warden.security;

/**
 * Request to create a user in the {@link UserDirectory}.
 *
 * @param name     unique login name
 * @param email    email address
 * @param password raw password; the directory decides how to store it
 * @param active   whether the account is active on creation
 */
public record NewUser(
        String name,
        String email,
        String password,
        boolean active
) {

    @Override
    public String toString() {
        return "NewUser[name=" + name + ", email=" + email + ", active=" + active + "]";
    }
}
