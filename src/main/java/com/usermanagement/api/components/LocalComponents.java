package com.usermanagement.api.components;

import com.usermanagement.api.ServerConfig;
import com.usermanagement.api.components.eventbus.ErrorLogger;
import com.usermanagement.api.components.eventbus.EventBus;
import com.usermanagement.api.components.eventbus.GateEventLogger;
import com.usermanagement.api.controllers.FileController;
import com.usermanagement.api.controllers.HealthController;
import com.usermanagement.api.controllers.HttpController;
import com.usermanagement.api.controllers.UserController;
import com.usermanagement.api.gatekeeper.Gatekeeper;
import com.usermanagement.api.gatekeeper.RoleAuthorizer;
import com.usermanagement.api.gatekeeper.TokenAuthenticator;
import com.usermanagement.api.gatekeeper.TokenCodec;
import com.usermanagement.api.gatekeeper.UploadValidator;
import com.usermanagement.api.persistence.InMemoryUserStore;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Wires up the components for a single standalone server instance.
 */
public class LocalComponents extends Components {

    public LocalComponents () {
        this(ServerConfig.fromDefaultFile());
    }

    public LocalComponents (ServerConfig config) {
        this.config = config;
        taskScheduler = new TaskScheduler(config);
        eventBus = new EventBus(taskScheduler);
        eventBus.addHandlers(new ErrorLogger(), new GateEventLogger());
        tokenCodec = new TokenCodec(config.jwtSecret());
        gatekeeper = new Gatekeeper(
                new TokenAuthenticator(tokenCodec),
                new RoleAuthorizer(),
                new UploadValidator(Path.of(config.uploadRoot())),
                taskScheduler,
                eventBus,
                config
        );
        userStore = new InMemoryUserStore();
        // Instantiate the HttpControllers last, when all the components except the HttpApi are already created.
        httpApi = new HttpApi(eventBus, config, standardHttpControllers(this));
    }

    /**
     * Create the standard list of HttpControllers.
     * The Components parameter should already be initialized with all components except the HttpApi.
     * We pass these controllers into the HttpApi (rather than constructing them in the HttpApi constructor) to allow
     * injecting custom controllers in other deployment environments. This also avoids bulk-passing the entire set
     * of components into the HttpApi constructor, ensuring clear declaration of each component's dependencies.
     * Such bulk-passing of components should only occur in this wiring-up code, not in component code.
     */
    public static List<HttpController> standardHttpControllers (Components components) {
        return Arrays.asList(
                new HealthController(),
                new UserController(components.gatekeeper, components.userStore),
                new FileController(components.gatekeeper)
        );
    }

}
