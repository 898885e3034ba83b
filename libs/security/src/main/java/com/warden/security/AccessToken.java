package com.warden.security;

/**
 * Opaque bearer credential for non-interactive API callers.
 *
 * @param id   token id
 * @param uid  id of the user the token acts for
 * @param name display name chosen by the owner
 * @param sha  the opaque token value presented in {@code Authorization: token <sha>}
 */
public record AccessToken(
        long id,
        long uid,
        String name,
        String sha
) {

    @Override
    public String toString() {
        return "AccessToken[id=" + id + ", uid=" + uid + ", name=" + name + "]";
    }
}
