package com.usermanagement.api;

import com.google.common.testing.FakeTicker;
import com.usermanagement.api.components.Components;
import com.usermanagement.api.components.HttpApi;
import com.usermanagement.api.components.TaskScheduler;
import com.usermanagement.api.components.eventbus.ErrorLogger;
import com.usermanagement.api.components.eventbus.EventBus;
import com.usermanagement.api.components.eventbus.GateEventLogger;
import com.usermanagement.api.gatekeeper.Gatekeeper;
import com.usermanagement.api.gatekeeper.RoleAuthorizer;
import com.usermanagement.api.gatekeeper.TokenAuthenticator;
import com.usermanagement.api.gatekeeper.TokenCodec;
import com.usermanagement.api.gatekeeper.UploadValidator;
import com.usermanagement.api.persistence.InMemoryUserStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import static com.usermanagement.api.components.LocalComponents.standardHttpControllers;

/**
 * Components for HTTP-level tests: a real server on a fixed port, uploads under a temporary directory, and rate
 * limiters driven by a ticker that never advances on its own, so a client's budget only refills when a test says so.
 * Requests are keyed on X-Forwarded-For, letting each test act as a distinct client with its own rate limit budget.
 */
public class TestComponents extends Components {

    public static final int PORT = 7181;

    public static final String JWT_SECRET = "test-secret-test-secret-test-secret-0123";

    private static TestComponents instance;

    private static final AtomicInteger clientCounter = new AtomicInteger();

    public final Path uploadRoot;

    public final FakeTicker ticker = new FakeTicker();

    private TestComponents () {
        try {
            uploadRoot = Files.createTempDirectory("uploads");
            uploadRoot.toFile().deleteOnExit();
            config = ServerConfig.fromProperties(testProperties(uploadRoot));
            taskScheduler = new TaskScheduler(config);
            eventBus = new EventBus(taskScheduler);
            eventBus.addHandlers(new ErrorLogger(), new GateEventLogger());
            tokenCodec = new TokenCodec(config.jwtSecret());
            gatekeeper = new Gatekeeper(
                    new TokenAuthenticator(tokenCodec),
                    new RoleAuthorizer(),
                    new UploadValidator(uploadRoot),
                    taskScheduler,
                    eventBus,
                    config,
                    ticker,
                    Clock.systemUTC()
            );
            userStore = new InMemoryUserStore();
            httpApi = new HttpApi(eventBus, config, standardHttpControllers(this));
        } catch (Exception ex) {
            throw new RuntimeException("Failed to wire up test components.", ex);
        }
    }

    /** Start the test server the first time this is called, and return the same components on later calls. */
    public static synchronized TestComponents start () {
        if (instance == null) {
            instance = new TestComponents();
        }
        return instance;
    }

    public static Properties testProperties (Path uploadRoot) {
        Properties properties = new Properties();
        properties.setProperty("server-port", Integer.toString(PORT));
        properties.setProperty("allow-origin", "http://localhost:3000");
        properties.setProperty("jwt-secret", JWT_SECRET);
        properties.setProperty("upload-root", uploadRoot.toString());
        properties.setProperty("request-timeout-seconds", "30");
        properties.setProperty("rate-limit-sweep-seconds", "300");
        properties.setProperty("trust-forwarded-for", "true");
        properties.setProperty("light-threads", "2");
        properties.setProperty("max-http-threads", "16");
        return properties;
    }

    /** A client address not used by any other test, for use in X-Forwarded-For. */
    public static String newClientAddress () {
        int n = clientCounter.incrementAndGet();
        return String.format("10.%d.%d.%d", (n >> 16) & 0xFF, (n >> 8) & 0xFF, n & 0xFF);
    }

    /** An Authorization header value carrying a valid token for the given user, expiring in one hour. */
    public String bearer (String subject, String role) {
        return "Bearer " + tokenCodec.encode(subject, subject + "@example.com", role, Instant.now().plusSeconds(3600));
    }

}
