package com.usermanagement.api.gatekeeper;

import com.google.common.collect.ImmutableSet;
import com.usermanagement.api.components.eventbus.GateRejectionEvent;
import com.usermanagement.api.models.ApiResponse;
import spark.Request;
import spark.Response;
import spark.Route;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * The fixed sequence of gatekeeper stages protecting one route. Stages run in the order rate limit, authenticate,
 * authorize, upload, however the route declared them: the cheapest check that needs no trust in the client comes
 * first and the expensive body parsing comes last. The first stage to refuse a request ends it, so later stages and the
 * route handler never see a refused request.
 */
public class RoutePipeline {

    public final String name;

    /** Null if the route is not rate limited. */
    public final RateLimiterRegistry rateLimiter;

    private final Gatekeeper gatekeeper;
    private final List<GateStage> stages;

    private RoutePipeline (String name, Gatekeeper gatekeeper, RateLimiterRegistry rateLimiter, List<GateStage> stages) {
        this.name = name;
        this.gatekeeper = gatekeeper;
        this.rateLimiter = rateLimiter;
        this.stages = stages;
    }

    /**
     * Wrap a route handler so it is only called for requests that pass every stage. Refused requests get a JSON
     * envelope carrying the rejection's status code, message and error tag.
     */
    public Route guard (Route handler) {
        checkNotNull(handler);
        return (Request req, Response res) -> {
            Rejection rejection = admit(req);
            if (rejection != null) {
                res.status(rejection.httpCode);
                res.type("application/json");
                return ApiResponse.failure(rejection.message, rejection.tag);
            }
            return handler.handle(req, res);
        };
    }

    /** Run every stage against the request. @return null if the request was admitted, otherwise the first refusal. */
    Rejection admit (Request req) {
        GateContext context = GateContext.attach(req, gatekeeper.clientKey(req), gatekeeper.deadline());
        for (GateStage stage : stages) {
            Rejection rejection = stage.check(req, context);
            if (rejection != null) {
                gatekeeper.eventBus.send(new GateRejectionEvent(name, req.pathInfo(), context.clientKey,
                        rejection.httpCode, rejection.tag, rejection.reason).forUser(context.claims()));
                return rejection;
            }
        }
        return null;
    }

    public static class Builder {

        private final Gatekeeper gatekeeper;
        private final String name;

        private RateLimit rateLimit;
        private boolean authenticate;
        private Set<String> allowedRoles;
        private UploadConstraints uploadConstraints;

        Builder (Gatekeeper gatekeeper, String name) {
            checkArgument(name != null && !name.isBlank(), "Route name must be supplied.");
            this.gatekeeper = gatekeeper;
            this.name = name;
        }

        public Builder rateLimit (RateLimit rateLimit) {
            checkState(this.rateLimit == null, "Route %s already declares a rate limit.", name);
            this.rateLimit = checkNotNull(rateLimit);
            return this;
        }

        public Builder authenticate () {
            this.authenticate = true;
            return this;
        }

        /** Allow only users holding one of the given roles. Implies authentication. */
        public Builder requireRole (String... roles) {
            checkArgument(roles.length > 0, "Route %s must allow at least one role.", name);
            checkState(allowedRoles == null, "Route %s already declares its allowed roles.", name);
            this.allowedRoles = ImmutableSet.copyOf(roles);
            this.authenticate = true;
            return this;
        }

        public Builder upload (UploadConstraints constraints) {
            checkState(uploadConstraints == null, "Route %s already declares upload constraints.", name);
            this.uploadConstraints = checkNotNull(constraints);
            return this;
        }

        public RoutePipeline build () {
            List<GateStage> stages = new ArrayList<>();
            RateLimiterRegistry registry = null;
            if (rateLimit != null) {
                final RateLimiterRegistry rateLimiter = gatekeeper.createRegistry(name, rateLimit);
                stages.add((req, context) -> rateLimiter.allow(context.clientKey)
                        ? null : Rejection.rateLimited(rateLimiter.rateLimit.name));
                registry = rateLimiter;
            }
            if (authenticate) {
                final TokenAuthenticator authenticator = gatekeeper.tokenAuthenticator;
                stages.add((req, context) -> {
                    AuthResult result = authenticator.authenticate(req);
                    if (!result.isAuthenticated()) {
                        return Rejection.unauthorized(result.failure);
                    }
                    context.setClaims(result.claims);
                    return null;
                });
            }
            if (allowedRoles != null) {
                final RoleAuthorizer authorizer = gatekeeper.roleAuthorizer;
                final Set<String> roles = allowedRoles;
                stages.add((req, context) -> {
                    IdentityClaims claims = context.claims();
                    if (authorizer.authorize(claims, roles)) {
                        return null;
                    }
                    return Rejection.forbidden(claims == null ? null : claims.role);
                });
            }
            if (uploadConstraints != null) {
                stages.add(new UploadStage(name, uploadConstraints, gatekeeper.uploadValidator, gatekeeper.eventBus));
            }
            return new RoutePipeline(name, gatekeeper, registry, List.copyOf(stages));
        }

        public Route guard (Route handler) {
            return build().guard(handler);
        }
    }

}
