package com.usermanagement.api.gatekeeper;

import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Decides whether an authenticated user may use a route, based only on the role in their verified claims.
 */
public class RoleAuthorizer {

    /**
     * @param allowedRoles must not be empty. A route that accepts any role should not declare a role requirement.
     * @return true if the claims are present and their role is one of the allowed roles.
     */
    public boolean authorize (IdentityClaims claims, Set<String> allowedRoles) {
        checkArgument(allowedRoles != null && !allowedRoles.isEmpty(), "At least one allowed role must be declared.");
        return claims != null && claims.role != null && allowedRoles.contains(claims.role);
    }

}
