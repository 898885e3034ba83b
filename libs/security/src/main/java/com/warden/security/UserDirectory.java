package com.warden.security;

/**
 * User and access-token persistence as required by identity resolution.
 * <p>
 * Lookups signal absence with {@link UserNotFoundException} or
 * {@link AccessTokenNotFoundException}; any other {@link DirectoryException}
 * means the backing store itself failed.
 */
public interface UserDirectory {

    /**
     * @throws UserNotFoundException if no user has this id
     */
    User getUserById(long id);

    /**
     * @throws UserNotFoundException if no user has this name
     */
    User getUserByName(String name);

    /**
     * @throws AccessTokenNotFoundException if no token has this value
     */
    AccessToken getAccessTokenBySha(String sha);

    /**
     * Persists a new user and returns it with its assigned id.
     *
     * @throws UserAlreadyExistsException if the name is already taken
     */
    User createUser(NewUser user);

    /**
     * Issues a new access token for the given user.
     *
     * @throws UserNotFoundException if no user has this id
     */
    AccessToken createAccessToken(long uid, String name);

    /**
     * Checks a candidate password against the stored credentials of {@code user}.
     */
    boolean verifyPassword(User user, String password);
}
