package com.warden.security;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * User name and password carried by an HTTP Basic {@code Authorization} header.
 *
 * @param username part before the first colon
 * @param password part after the first colon (may itself contain colons)
 */
public record BasicCredentials(String username, String password) {

    /**
     * Decodes the base64 {@code username:password} payload of a Basic header.
     *
     * @param encoded base64 payload (may be null)
     * @return the credentials, or empty if the payload is not valid base64 or has no colon
     */
    public static Optional<BasicCredentials> decode(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return Optional.empty();
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return Optional.empty();
        }
        return Optional.of(new BasicCredentials(decoded.substring(0, colon), decoded.substring(colon + 1)));
    }

    /**
     * Encodes user name and password as a Basic payload.
     */
    public static String encode(String username, String password) {
        byte[] raw = (username + ":" + password).getBytes(StandardCharsets.UTF_8);
        return Base64.getEncoder().encodeToString(raw);
    }

    @Override
    public String toString() {
        return "BasicCredentials[username=" + username + "]";
    }
}
