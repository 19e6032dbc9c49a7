package com.selfheal.remediator.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the {@code Authorization} header against the shared secret.
 * <p>
 * Comparison is constant-time. A blank secret rejects every request.
 * </p>
 */
public class BearerTokenAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(BearerTokenAuthenticator.class);

    private static final String SCHEME = "Bearer ";

    private final byte[] expected;

    public BearerTokenAuthenticator(String apiToken) {
        if (apiToken == null || apiToken.isBlank()) {
            log.warn("No API token configured, all remediation requests will be rejected");
            this.expected = null;
        } else {
            this.expected = (SCHEME + apiToken).getBytes(StandardCharsets.UTF_8);
        }
    }

    public boolean authenticate(String authorizationHeader) {
        if (expected == null || authorizationHeader == null) {
            return false;
        }
        return MessageDigest.isEqual(expected, authorizationHeader.getBytes(StandardCharsets.UTF_8));
    }
}
