package com.usermanagement.api.components;

import com.usermanagement.api.ServerConfig;
import com.usermanagement.api.components.eventbus.EventBus;
import com.usermanagement.api.gatekeeper.Gatekeeper;
import com.usermanagement.api.gatekeeper.TokenCodec;
import com.usermanagement.api.persistence.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * We are adopting a lightweight dependency injection approach, where we manually wire up our components instead of
 * relying on a framework. For our simple case the approach is almost identical but we have to manage the order in
 * which the components are instantiated. This amounts to a manual depth-first traversal of the dependency graph which
 * is not prohibitive for a limited number of components.
 *
 * This class keeps references to all components of the system in one place. Making the components instances (rather
 * than classes grouping together static fields and methods) allows them to be replaced with other implementations,
 * e.g. a user store backed by a database, or a gatekeeper driven by a fake clock in tests.
 *
 * Outside code should never reference these component fields, and this class should be essentially unused after
 * application construction. Each component should hold final references to all the other components it needs, and
 * those references should be passed into the component's constructor by the wiring-up code in a subclass.
 */
public abstract class Components {

    private static final Logger LOG = LoggerFactory.getLogger(Components.class);

    public ServerConfig config;
    public TaskScheduler taskScheduler;
    public EventBus eventBus;
    /** Verification of the identity tokens presented by users. */
    public TokenCodec tokenCodec;
    /** Rate limiting, authentication, authorization and upload checks for every route. */
    public Gatekeeper gatekeeper;
    public UserStore userStore;
    public HttpApi httpApi;

    /** Stop accepting requests, then stop the background work those requests may have started. */
    public void shutDown () {
        LOG.info("Shutting down components.");
        if (httpApi != null) httpApi.shutDown();
        if (gatekeeper != null) gatekeeper.shutDown();
        if (taskScheduler != null) taskScheduler.shutDown();
    }

}
