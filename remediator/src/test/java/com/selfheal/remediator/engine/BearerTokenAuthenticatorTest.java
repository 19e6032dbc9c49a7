package com.selfheal.remediator.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BearerTokenAuthenticatorTest {

    @Test
    void testExactBearerTokenIsAccepted() {
        BearerTokenAuthenticator authenticator = new BearerTokenAuthenticator("s3cr3t");

        assertTrue(authenticator.authenticate("Bearer s3cr3t"));
        assertFalse(authenticator.authenticate("Bearer s3cr3"));
        assertFalse(authenticator.authenticate("bearer s3cr3t"));
        assertFalse(authenticator.authenticate("s3cr3t"));
        assertFalse(authenticator.authenticate(null));
    }

    @Test
    void testBlankSecretRejectsEverything() {
        BearerTokenAuthenticator authenticator = new BearerTokenAuthenticator(" ");

        assertFalse(authenticator.authenticate("Bearer  "));
        assertFalse(authenticator.authenticate("Bearer "));
        assertFalse(authenticator.authenticate(null));
    }
}
