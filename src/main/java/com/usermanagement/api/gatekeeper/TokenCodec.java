package com.usermanagement.api.gatekeeper;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.usermanagement.api.gatekeeper.AuthFailure.BAD_SIGNATURE;
import static com.usermanagement.api.gatekeeper.AuthFailure.EXPIRED;
import static com.usermanagement.api.gatekeeper.AuthFailure.MALFORMED;

/**
 * Encodes and verifies the signed identity tokens presented as bearer credentials. Tokens are compact JWS strings
 * signed with HMAC-SHA256 over a secret shared with the login service that issues them. Verification recomputes the
 * signature and compares it in constant time (inside jjwt) before looking at any claim.
 *
 * Instances hold no mutable state and may be shared by all HTTP handler threads.
 */
public class TokenCodec {

    /** HS256 requires a key of at least 256 bits. */
    public static final int MIN_SECRET_BYTES = 32;

    public static final String EMAIL_CLAIM = "email";
    public static final String ROLE_CLAIM = "role";

    private final SecretKey key;
    private final Clock clock;
    private final JwtParser parser;

    public TokenCodec (String secret) {
        this(secret, Clock.systemUTC());
    }

    public TokenCodec (String secret, Clock clock) {
        checkNotNull(secret, "Token signing secret must be supplied.");
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        checkArgument(secretBytes.length >= MIN_SECRET_BYTES,
                "Token signing secret must be at least %s bytes long.", MIN_SECRET_BYTES);
        this.key = Keys.hmacShaKeyFor(secretBytes);
        this.clock = checkNotNull(clock);
        this.parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Sign a token carrying the given identity. Tokens are normally issued by the external login flow; this is
     * provided so that flow (and tests) can produce tokens this codec accepts. Note that JWT timestamps have
     * one-second resolution, so the expiry is truncated to the second.
     */
    public String encode (String subject, String email, String role, Instant expiresAt) {
        checkArgument(subject != null && !subject.isBlank(), "Token subject must be supplied.");
        checkArgument(role != null && !role.isBlank(), "Token role must be supplied.");
        checkNotNull(expiresAt, "Token expiry must be supplied.");
        return Jwts.builder()
                .subject(subject)
                .claim(EMAIL_CLAIM, email)
                .claim(ROLE_CLAIM, role)
                .issuedAt(Date.from(clock.instant()))
                .expiration(Date.from(expiresAt))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Check the structure, signature and expiry of a token, in that order.
     * @return the verified claims, or a failure of kind MALFORMED, BAD_SIGNATURE or EXPIRED. Never throws.
     */
    public AuthResult verify (String token) {
        if (token == null || token.isBlank()) {
            return AuthResult.failed(MALFORMED);
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            // jjwt only reports expiry after the signature has been verified.
            return AuthResult.failed(EXPIRED);
        } catch (SignatureException e) {
            return AuthResult.failed(BAD_SIGNATURE);
        } catch (JwtException | IllegalArgumentException e) {
            return AuthResult.failed(MALFORMED);
        }
        String subject = claims.getSubject();
        Date expiration = claims.getExpiration();
        Object role = claims.get(ROLE_CLAIM);
        Object email = claims.get(EMAIL_CLAIM);
        if (subject == null || subject.isBlank() || expiration == null || !(role instanceof String)) {
            return AuthResult.failed(MALFORMED);
        }
        if (email != null && !(email instanceof String)) {
            return AuthResult.failed(MALFORMED);
        }
        Instant expiresAt = expiration.toInstant();
        // jjwt accepts a token whose expiry equals the current instant, but a token is no longer valid at its expiry.
        if (!clock.instant().isBefore(expiresAt)) {
            return AuthResult.failed(EXPIRED);
        }
        return AuthResult.authenticated(new IdentityClaims(subject, (String) email, (String) role, expiresAt));
    }

}
