package com.usermanagement.api.gatekeeper;

/**
 * The internal reasons a request can fail authentication. These are kept for logging only: every one of them is
 * reported to the client as the same UNAUTHORIZED response, so that a caller probing with crafted tokens cannot tell
 * an expired token from a forged one.
 */
public enum AuthFailure {
    MISSING_HEADER,
    BAD_SCHEME,
    MALFORMED,
    BAD_SIGNATURE,
    EXPIRED
}
