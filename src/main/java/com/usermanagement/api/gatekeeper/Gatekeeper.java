package com.usermanagement.api.gatekeeper;

import com.google.common.base.Ticker;
import com.usermanagement.api.components.Component;
import com.usermanagement.api.components.TaskScheduler;
import com.usermanagement.api.components.eventbus.EventBus;
import com.usermanagement.api.util.HttpUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Request;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * This Component composes the checks applied to inbound requests (rate limiting, token authentication, role
 * authorization and upload validation) into one pipeline per route. Controllers declare what each route needs when
 * they register their endpoints:
 *
 * <pre>
 * gatekeeper.route("uploadImage").rateLimit(RateLimit.STRICT).authenticate().upload(UploadConstraints.IMAGE)
 *           .guard(this::uploadImage)
 * </pre>
 *
 * The Gatekeeper owns the rate limiter state of every route and stops sweeping it on shutdown.
 */
public class Gatekeeper implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(Gatekeeper.class);

    public interface Config {
        int requestTimeoutSeconds ();
        int rateLimitSweepSeconds ();
        boolean trustForwardedFor ();
    }

    final TokenAuthenticator tokenAuthenticator;
    final RoleAuthorizer roleAuthorizer;
    final UploadValidator uploadValidator;
    final EventBus eventBus;

    private final TaskScheduler taskScheduler;
    private final Config config;
    private final Ticker ticker;
    private final Clock clock;

    private final List<RateLimiterRegistry> registries = new CopyOnWriteArrayList<>();

    public Gatekeeper (
            TokenAuthenticator tokenAuthenticator,
            RoleAuthorizer roleAuthorizer,
            UploadValidator uploadValidator,
            TaskScheduler taskScheduler,
            EventBus eventBus,
            Config config
    ) {
        this(tokenAuthenticator, roleAuthorizer, uploadValidator, taskScheduler, eventBus, config,
                Ticker.systemTicker(), Clock.systemUTC());
    }

    /** The ticker drives all rate limiter buckets and the clock sets request deadlines. */
    public Gatekeeper (
            TokenAuthenticator tokenAuthenticator,
            RoleAuthorizer roleAuthorizer,
            UploadValidator uploadValidator,
            TaskScheduler taskScheduler,
            EventBus eventBus,
            Config config,
            Ticker ticker,
            Clock clock
    ) {
        this.tokenAuthenticator = checkNotNull(tokenAuthenticator);
        this.roleAuthorizer = checkNotNull(roleAuthorizer);
        this.uploadValidator = checkNotNull(uploadValidator);
        this.taskScheduler = checkNotNull(taskScheduler);
        this.eventBus = checkNotNull(eventBus);
        this.config = checkNotNull(config);
        this.ticker = checkNotNull(ticker);
        this.clock = checkNotNull(clock);
    }

    /** Begin declaring the pipeline of a route. The name identifies the route in logs and rate limiter names. */
    public RoutePipeline.Builder route (String name) {
        return new RoutePipeline.Builder(this, name);
    }

    /** Each rateLimit declaration gets its own registry, so routes never share a client's budget. */
    RateLimiterRegistry createRegistry (String routeName, RateLimit rateLimit) {
        RateLimiterRegistry registry = new RateLimiterRegistry(
                routeName + "/" + rateLimit.name, rateLimit, ticker, config.rateLimitSweepSeconds()
        );
        registry.startSweeping(taskScheduler);
        registries.add(registry);
        LOG.info("Route {} is rate limited at {}.", routeName, rateLimit);
        return registry;
    }

    String clientKey (Request req) {
        return HttpUtils.clientAddress(req, config.trustForwardedFor());
    }

    Instant deadline () {
        return clock.instant().plusSeconds(config.requestTimeoutSeconds());
    }

    public List<RateLimiterRegistry> registries () {
        return List.copyOf(registries);
    }

    /** Stop sweeping and discard the rate limiter state of every route. */
    public void shutDown () {
        for (RateLimiterRegistry registry : registries) {
            registry.close();
        }
    }

}
