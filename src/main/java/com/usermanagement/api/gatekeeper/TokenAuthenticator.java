package com.usermanagement.api.gatekeeper;

import spark.Request;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.usermanagement.api.gatekeeper.AuthFailure.BAD_SCHEME;
import static com.usermanagement.api.gatekeeper.AuthFailure.MISSING_HEADER;

/**
 * Simple bearer token authentication: the token travels in the Authorization header and is verified statelessly by a
 * TokenCodec, so no token cache or database lookup is needed on the request path.
 */
public class TokenAuthenticator {

    public static final String AUTHORIZATION_HEADER = "Authorization";

    /** Case-sensitive, exactly one space. */
    public static final String BEARER_PREFIX = "Bearer ";

    private final TokenCodec tokenCodec;

    public TokenAuthenticator (TokenCodec tokenCodec) {
        this.tokenCodec = checkNotNull(tokenCodec);
    }

    /**
     * Given an incoming HTTP request, determine who the user is from its bearer token.
     * Does not throw when the user cannot be authenticated, it returns the reason in the result instead.
     */
    public AuthResult authenticate (Request request) {
        return authenticate(request.headers(AUTHORIZATION_HEADER));
    }

    public AuthResult authenticate (String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isEmpty()) {
            return AuthResult.failed(MISSING_HEADER);
        }
        if (!authorizationHeader.startsWith(BEARER_PREFIX)) {
            return AuthResult.failed(BAD_SCHEME);
        }
        return tokenCodec.verify(authorizationHeader.substring(BEARER_PREFIX.length()));
    }

}
