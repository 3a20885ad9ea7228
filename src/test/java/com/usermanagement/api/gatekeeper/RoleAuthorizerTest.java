package com.usermanagement.api.gatekeeper;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RoleAuthorizerTest {

    private final RoleAuthorizer authorizer = new RoleAuthorizer();

    private static IdentityClaims withRole (String role) {
        return new IdentityClaims("user-1", null, role, Instant.now().plusSeconds(60));
    }

    @Test
    void onlyMembersOfTheAllowedSetPass () {
        assertTrue(authorizer.authorize(withRole("admin"), Set.of("admin")));
        assertTrue(authorizer.authorize(withRole("user"), Set.of("admin", "user")));
        assertFalse(authorizer.authorize(withRole("user"), Set.of("admin")));
        // Role names are compared exactly.
        assertFalse(authorizer.authorize(withRole("Admin"), Set.of("admin")));
    }

    @Test
    void missingClaimsNeverPass () {
        assertFalse(authorizer.authorize(null, Set.of("admin")));
    }

    @Test
    void emptyRoleSetIsAProgrammingError () {
        assertThrows(IllegalArgumentException.class, () -> authorizer.authorize(withRole("admin"), Set.of()));
    }

}
