package com.usermanagement.api.gatekeeper;

/**
 * A gatekeeper stage's refusal of a request. Stages return these instead of writing responses or throwing, so that
 * the route pipeline alone decides how a refusal reaches the client.
 */
public class Rejection {

    public static final String INVALID_TOKEN_MESSAGE = "Invalid or missing authorization token";

    public final int httpCode;

    /** Machine-readable error tag for the client, such as UNAUTHORIZED or FILE_TOO_LARGE. */
    public final String tag;

    /** Human-readable explanation for the client. */
    public final String message;

    /** Detail for the logs only, never sent to the client. */
    public final String reason;

    private Rejection (int httpCode, String tag, String message, String reason) {
        this.httpCode = httpCode;
        this.tag = tag;
        this.message = message;
        this.reason = reason;
    }

    /** All authentication failures look the same to the client, to avoid telling an attacker what went wrong. */
    public static Rejection unauthorized (AuthFailure failure) {
        return new Rejection(401, "UNAUTHORIZED", INVALID_TOKEN_MESSAGE, failure.name());
    }

    public static Rejection forbidden (String role) {
        return new Rejection(403, "FORBIDDEN", "Insufficient permissions", "role " + role + " not allowed");
    }

    public static Rejection rateLimited (String rateClass) {
        return new Rejection(429, "RATE_LIMIT_EXCEEDED", "Rate limit exceeded", "rate class " + rateClass);
    }

    public static Rejection upload (UploadFailure failure, String message) {
        return new Rejection(failure.httpCode, failure.tag, message, failure.name());
    }

    @Override
    public String toString () {
        return String.format("Rejection{%d %s: %s (%s)}", httpCode, tag, message, reason);
    }
}
