package io.brokerguard.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdminTokenGuardTest {

    @Test
    void testBearerTokenMatches() {
        AdminTokenGuard guard = new AdminTokenGuard("s3cret-admin");

        assertTrue(guard.isAuthorized("Bearer s3cret-admin"));
        assertTrue(guard.isAuthorized("Bearer s3cret-admin "));
        assertFalse(guard.isAuthorized("Bearer s3cret-admin2"));
        assertFalse(guard.isAuthorized("bearer s3cret-admin"));
        assertFalse(guard.isAuthorized("Basic s3cret-admin"));
        assertFalse(guard.isAuthorized(null));
    }

    @Test
    void testBlankConfiguredTokenRejectsEverything() {
        assertFalse(new AdminTokenGuard("").isAuthorized("Bearer "));
        assertFalse(new AdminTokenGuard(null).isAuthorized("Bearer anything"));
    }
}
