package com.usermanagement.api.gatekeeper;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Outcome of verifying a token or authenticating a request: exactly one of claims and failure is non-null.
 */
public class AuthResult {

    public final IdentityClaims claims;

    public final AuthFailure failure;

    private AuthResult (IdentityClaims claims, AuthFailure failure) {
        this.claims = claims;
        this.failure = failure;
    }

    static AuthResult authenticated (IdentityClaims claims) {
        return new AuthResult(checkNotNull(claims), null);
    }

    static AuthResult failed (AuthFailure failure) {
        return new AuthResult(null, checkNotNull(failure));
    }

    public boolean isAuthenticated () {
        return claims != null;
    }

    @Override
    public String toString () {
        return isAuthenticated() ? "AuthResult{" + claims + "}" : "AuthResult{failure=" + failure + "}";
    }
}
