package com.warden.security;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A parsed {@code Authorization} header of the form {@code <scheme> <credentials>}.
 * <p>
 * Only headers consisting of exactly two whitespace-separated fields are accepted. Any
 * Unicode white space separates fields, including the no-break space.
 * Scheme comparison is case-sensitive: {@code token} and {@code Basic} are matched literally.
 *
 * @param scheme      first field, e.g. {@code token} or {@code Basic}
 * @param credentials second field
 */
public record AuthorizationHeader(String scheme, String credentials) {

    /** Header name. */
    public static final String NAME = "Authorization";

    /** Scheme used by API access tokens. */
    public static final String TOKEN_SCHEME = "token";

    /** Scheme used by HTTP Basic credentials. */
    public static final String BASIC_SCHEME = "Basic";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Parses an {@code Authorization} header value.
     *
     * @param value the raw header value (may be null)
     * @return the parsed header, or empty if the value is missing or does not have exactly two fields
     */
    public static Optional<AuthorizationHeader> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String[] fields = WHITESPACE.splitAsStream(value)
                .filter(field -> !field.isEmpty())
                .toArray(String[]::new);
        if (fields.length != 2) {
            return Optional.empty();
        }
        return Optional.of(new AuthorizationHeader(fields[0], fields[1]));
    }

    /**
     * Reads and parses the {@code Authorization} header of a request.
     */
    public static Optional<AuthorizationHeader> from(AuthRequest request) {
        return parse(request.header(NAME));
    }

    public boolean isScheme(String expected) {
        return expected.equals(scheme);
    }

    @Override
    public String toString() {
        return "AuthorizationHeader[scheme=" + scheme + "]";
    }
}
