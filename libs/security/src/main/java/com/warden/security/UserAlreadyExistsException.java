package com.warden.security;

/**
 * Thrown when creating a user whose name is already taken.
 */
public class UserAlreadyExistsException extends DirectoryException {

    private final String name;

    public UserAlreadyExistsException(String name) {
        super("user already exists: name=%s".formatted(name));
        this.name = name;
    }

    public String name() {
        return name;
    }
}
