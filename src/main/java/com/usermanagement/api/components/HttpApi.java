package com.usermanagement.api.components;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.usermanagement.api.ApiServerException;
import com.usermanagement.api.components.eventbus.ErrorEvent;
import com.usermanagement.api.components.eventbus.EventBus;
import com.usermanagement.api.components.eventbus.HttpApiEvent;
import com.usermanagement.api.controllers.HttpController;
import com.usermanagement.api.gatekeeper.IdentityClaims;
import com.usermanagement.api.models.ApiResponse;
import com.usermanagement.api.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Request;
import spark.Response;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * This Component is a web server that serves up our HTTP API endpoints.
 * It must be supplied with a list of HttpController instances implementing the endpoints. Access control is not
 * applied here: each controller wraps its handlers in the route pipelines composed by the Gatekeeper.
 */
public class HttpApi implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(HttpApi.class);

    // These "attributes" are attached to an incoming HTTP request with String keys, making them available in handlers
    private static final String REQUEST_START_TIME_ATTRIBUTE = "requestStartTime";

    private static final int MIN_HTTP_THREADS = 8;

    public interface Config {
        int serverPort ();
        String allowOrigin ();
        int maxHttpThreads ();
        int requestTimeoutSeconds ();
    }

    private final EventBus eventBus;
    private final Config config;

    private final spark.Service sparkService;

    public HttpApi (EventBus eventBus, Config config, List<HttpController> httpControllers) {
        this.eventBus = eventBus;
        this.config = config;

        sparkService = configureSparkService();
        for (HttpController httpController : httpControllers) {
            httpController.registerEndpoints(sparkService);
        }
        // Routes are matched in the order they were registered, so the catch-all preflight handler goes last.
        registerPreflightHandler();
        sparkService.awaitInitialization();
        LOG.info("HTTP API is ready on port {} with {} controllers.", sparkService.port(), httpControllers.size());
    }

    private spark.Service configureSparkService () {
        // Set up Spark, the HTTP framework wrapping Jetty, including the port on which it will listen for connections.
        LOG.info("User management server will listen for HTTP connections on port {}.", config.serverPort());
        spark.Service sparkService = spark.Service.ignite();
        sparkService.port(config.serverPort());
        sparkService.threadPool(
                config.maxHttpThreads(),
                Math.min(MIN_HTTP_THREADS, config.maxHttpThreads()),
                config.requestTimeoutSeconds() * 1000
        );

        // Specify actions to take before the main logic of handling each HTTP request.
        sparkService.before((req, res) -> {
            // Record when the request started, so we can measure elapsed response time.
            req.attribute(REQUEST_START_TIME_ATTRIBUTE, Instant.now());

            // Set CORS headers to allow requests to this API server from a frontend hosted on a different domain.
            res.header("Access-Control-Allow-Origin", config.allowOrigin());
            // For caching, signal to the browser that responses may be different based on origin.
            res.header("Vary", "Origin");

            // The default MIME type is JSON. This will be overridden by any controller that does not return JSON.
            res.type("application/json");
        });

        // Unlike after(), afterAfter() also runs for requests that ended in an exception.
        sparkService.afterAfter((req, res) -> {
            Instant requestStartTime = req.attribute(REQUEST_START_TIME_ATTRIBUTE);
            long elapsedMsec = requestStartTime == null ? 0 :
                    Duration.between(requestStartTime, Instant.now()).toMillis();
            eventBus.send(new HttpApiEvent(req.requestMethod(), res.status(), req.pathInfo(), elapsedMsec)
                    .forUser(IdentityClaims.from(req)));
        });

        sparkService.notFound((req, res) -> {
            res.type("application/json");
            return JsonUtil.toJsonString(ApiResponse.failure("Route not found", "NOT_FOUND"));
        });

        sparkService.exception(ApiServerException.class, (e, request, response) -> {
            respondToException(e, request, response, e.type.name(), e.message, e.httpCode, e.fieldErrors);
        });

        sparkService.exception(JsonProcessingException.class, (e, request, response) -> {
            respondToException(e, request, response, ApiServerException.Type.JSON_PARSING.name(),
                    "Invalid request body", 400, null);
        });

        sparkService.exception(IllegalArgumentException.class, (e, request, response) -> {
            respondToException(e, request, response, ApiServerException.Type.BAD_REQUEST.name(),
                    e.getMessage(), 400, null);
        });

        sparkService.exception(Exception.class, (e, request, response) -> {
            respondToException(e, request, response, ApiServerException.Type.INTERNAL_ERROR.name(),
                    "Internal server error", 500, null);
        });

        return sparkService;
    }

    /** Handle CORS preflight requests (which are OPTIONS requests). */
    private void registerPreflightHandler () {
        sparkService.options("/*", (req, res) -> {
            // Cache the preflight response for up to one day (the maximum allowed by browsers)
            res.header("Access-Control-Max-Age", "86400");
            res.header("Access-Control-Allow-Methods", "GET,PUT,POST,DELETE,OPTIONS");
            // Allowing credentials is necessary to send an Authorization header
            res.header("Access-Control-Allow-Credentials", "true");
            res.header("Access-Control-Allow-Headers", "Accept,Authorization,Content-Type,Origin," +
                    "X-Requested-With,Content-Length"
            );
            return "OK";
        });
    }

    private void respondToException (Exception e, Request request, Response response,
                                     String type, String message, int code, Object data) {
        // Only server-side failures are reported as errors. Client mistakes are already visible in the request log.
        if (code >= 500) {
            ErrorEvent errorEvent = new ErrorEvent(e, request.pathInfo(), type);
            eventBus.send(errorEvent.forUser(IdentityClaims.from(request)));
        }
        // Never include stack traces: they leak information about the server to people scanning it for weaknesses.
        response.status(code);
        response.type("application/json");
        response.body(JsonUtil.toJsonString(ApiResponse.failure(message, type, data)));
    }

    public int port () {
        return sparkService.port();
    }

    public void shutDown () {
        sparkService.stop();
        sparkService.awaitStop();
    }

}
