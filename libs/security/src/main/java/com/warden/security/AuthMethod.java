package com.warden.security;

/**
 * Mechanism that produced a request's identity.
 */
public enum AuthMethod {

    /** No mechanism produced an identity. */
    ANONYMOUS,

    /** {@code Authorization: token <sha>} on an API path. */
    ACCESS_TOKEN,

    /** Signed-in user id carried in the session. */
    SESSION,

    /** User name asserted by a trusted reverse proxy header. */
    REVERSE_PROXY,

    /** {@code Authorization: Basic ...} credentials checked against the directory. */
    BASIC
}
