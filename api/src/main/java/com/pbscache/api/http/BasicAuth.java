package com.pbscache.api.http;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * HTTP basic authentication against a single configured account.
 * Credentials are compared in constant time.
 */
public class BasicAuth {
    private static final String SCHEME = "Basic ";

    private final byte[] user;
    private final byte[] password;

    public BasicAuth(String user, String password) {
        this.user = user.getBytes(StandardCharsets.UTF_8);
        this.password = password.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @param authorization value of the {@code Authorization} header, may be {@code null}
     */
    public boolean isAuthorized(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, SCHEME, 0, SCHEME.length())) {
            return false;
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(authorization.substring(SCHEME.length()).trim()),
                StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return false;
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return false;
        }
        boolean userMatches = MessageDigest.isEqual(
            decoded.substring(0, colon).getBytes(StandardCharsets.UTF_8), user);
        boolean passwordMatches = MessageDigest.isEqual(
            decoded.substring(colon + 1).getBytes(StandardCharsets.UTF_8), password);
        return userMatches & passwordMatches;
    }
}
