package com.warden.security;

/**
 * Per-connection key-value store carrying state across requests.
 * Storage and expiry are owned by the implementation.
 */
public interface SessionStore {

    /**
     * Returns the value stored under {@code key}, or {@code null} when absent.
     */
    Object get(String key);

    void set(String key, Object value);

    void delete(String key);
}
