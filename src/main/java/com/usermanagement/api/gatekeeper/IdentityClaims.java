package com.usermanagement.api.gatekeeper;

import spark.Request;

import java.time.Instant;

/**
 * Groups together the identity attributes carried by a verified token: who the user is and which role they hold.
 * Instances are only created by TokenCodec after the token signature and expiry have been checked, which is why the
 * constructor is not public. Nothing read from an untrusted request can become an IdentityClaims by any other route.
 */
public class IdentityClaims {

    public final String subject;

    /** May be null if the token issuer did not include an email claim. */
    public final String email;

    public final String role;

    public final Instant expiresAt;

    IdentityClaims (String subject, String email, String role, Instant expiresAt) {
        this.subject = subject;
        this.email = email;
        this.role = role;
        this.expiresAt = expiresAt;
    }

    /**
     * From an HTTP request object, extract the strongly typed claims established by the gatekeeper for this request.
     * Use this instead of reading request attributes directly.
     * @return the claims, or null if the route does not authenticate its requests.
     */
    public static IdentityClaims from (Request req) {
        GateContext context = GateContext.from(req);
        return context == null ? null : context.claims();
    }

    @Override
    public String toString () {
        return "IdentityClaims{" +
                "subject='" + subject + '\'' +
                ", role='" + role + '\'' +
                ", expiresAt=" + expiresAt +
                '}';
    }
}
