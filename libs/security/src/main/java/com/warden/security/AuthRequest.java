package com.warden.security;

/**
 * The parts of an incoming HTTP request that identity resolution looks at.
 * Implemented by the web layer on top of whatever request type it uses.
 */
public interface AuthRequest {

    /**
     * Request path, without query string (e.g. {@code /api/v1/user}).
     */
    String path();

    /**
     * Value of the named header, or {@code null} when absent.
     */
    String header(String name);
}
