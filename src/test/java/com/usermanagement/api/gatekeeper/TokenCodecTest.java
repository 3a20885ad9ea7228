package com.usermanagement.api.gatekeeper;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TokenCodecTest {

    private static final String SECRET = "first-secret-first-secret-first-secret";
    private static final String OTHER_SECRET = "second-secret-second-secret-second-secret";

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final TokenCodec codec = new TokenCodec(SECRET, clock);

    @Test
    void validTokenYieldsItsClaims () {
        String token = codec.encode("user-1", "ada@example.com", "admin", NOW.plusSeconds(3600));
        AuthResult result = codec.verify(token);
        assertTrue(result.isAuthenticated());
        assertNull(result.failure);
        assertEquals("user-1", result.claims.subject);
        assertEquals("ada@example.com", result.claims.email);
        assertEquals("admin", result.claims.role);
        assertEquals(NOW.plusSeconds(3600), result.claims.expiresAt);
    }

    @Test
    void emailIsOptional () {
        String token = codec.encode("user-1", null, "user", NOW.plusSeconds(60));
        AuthResult result = codec.verify(token);
        assertTrue(result.isAuthenticated());
        assertNull(result.claims.email);
    }

    @Test
    void tokenSignedWithAnotherSecretHasBadSignature () {
        String token = new TokenCodec(OTHER_SECRET, clock).encode("user-1", null, "admin", NOW.plusSeconds(3600));
        assertEquals(AuthFailure.BAD_SIGNATURE, codec.verify(token).failure);
    }

    @Test
    void signatureIsCheckedBeforeExpiry () {
        String token = new TokenCodec(OTHER_SECRET, clock).encode("user-1", null, "admin", NOW.minusSeconds(3600));
        assertEquals(AuthFailure.BAD_SIGNATURE, codec.verify(token).failure);
    }

    @Test
    void swappedPayloadHasBadSignature () {
        String userToken = codec.encode("user-1", null, "user", NOW.plusSeconds(3600));
        String adminToken = codec.encode("user-1", null, "admin", NOW.plusSeconds(3600));
        String[] userParts = userToken.split("\\.");
        String[] adminParts = adminToken.split("\\.");
        String forged = userParts[0] + "." + adminParts[1] + "." + userParts[2];
        assertEquals(AuthFailure.BAD_SIGNATURE, codec.verify(forged).failure);
    }

    @Test
    void pastExpiryIsExpired () {
        String token = codec.encode("user-1", null, "admin", NOW.minusSeconds(1));
        assertEquals(AuthFailure.EXPIRED, codec.verify(token).failure);
    }

    @Test
    void tokenIsExpiredAtItsExpiryInstant () {
        String token = codec.encode("user-1", null, "admin", NOW);
        assertEquals(AuthFailure.EXPIRED, codec.verify(token).failure);
    }

    @Test
    void tokenValidUntilItsExpiry () {
        String token = codec.encode("user-1", null, "admin", NOW.plusSeconds(1));
        assertTrue(codec.verify(token).isAuthenticated());
        TokenCodec later = new TokenCodec(SECRET, Clock.fixed(NOW.plusSeconds(1), ZoneOffset.UTC));
        assertEquals(AuthFailure.EXPIRED, later.verify(token).failure);
    }

    @Test
    void garbageIsMalformed () {
        assertEquals(AuthFailure.MALFORMED, codec.verify("").failure);
        assertEquals(AuthFailure.MALFORMED, codec.verify(null).failure);
        assertEquals(AuthFailure.MALFORMED, codec.verify("abc").failure);
        assertEquals(AuthFailure.MALFORMED, codec.verify("not.a.token").failure);
        assertEquals(AuthFailure.MALFORMED, codec.verify("a.b.c.d.e.f").failure);
    }

    @Test
    void unsignedTokenIsRejected () {
        String unsigned = Jwts.builder()
                .subject("user-1")
                .claim("role", "admin")
                .expiration(Date.from(NOW.plusSeconds(3600)))
                .compact();
        AuthResult result = codec.verify(unsigned);
        assertFalse(result.isAuthenticated());
        assertEquals(AuthFailure.MALFORMED, result.failure);
    }

    @Test
    void missingRequiredClaimsAreMalformed () {
        SecretKey key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
        String noRole = Jwts.builder()
                .subject("user-1")
                .expiration(Date.from(NOW.plusSeconds(3600)))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
        String noSubject = Jwts.builder()
                .claim("role", "admin")
                .expiration(Date.from(NOW.plusSeconds(3600)))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
        String noExpiry = Jwts.builder()
                .subject("user-1")
                .claim("role", "admin")
                .signWith(key, Jwts.SIG.HS256)
                .compact();
        assertEquals(AuthFailure.MALFORMED, codec.verify(noRole).failure);
        assertEquals(AuthFailure.MALFORMED, codec.verify(noSubject).failure);
        assertEquals(AuthFailure.MALFORMED, codec.verify(noExpiry).failure);
    }

    @Test
    void shortSecretIsRefused () {
        assertThrows(IllegalArgumentException.class, () -> new TokenCodec("too-short"));
    }

    @Test
    void verificationIsDeterministic () {
        String token = codec.encode("user-1", null, "user", NOW.plusSeconds(60));
        AuthResult first = codec.verify(token);
        AuthResult second = codec.verify(token);
        assertEquals(first.claims.subject, second.claims.subject);
        assertEquals(first.claims.expiresAt, second.claims.expiresAt);
    }

}
