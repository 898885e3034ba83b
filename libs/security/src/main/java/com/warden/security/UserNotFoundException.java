package com.warden.security;

/**
 * Thrown when a user lookup finds no matching account.
 */
public class UserNotFoundException extends DirectoryException {

    public UserNotFoundException(String message) {
        super(message);
    }

    public static UserNotFoundException forId(long id) {
        return new UserNotFoundException("user does not exist: id=" + id);
    }

    public static UserNotFoundException forName(String name) {
        return new UserNotFoundException("user does not exist: name=" + name);
    }
}
