package com.usermanagement.api;

import com.usermanagement.api.components.Components;
import com.usermanagement.api.components.LocalComponents;
import com.usermanagement.api.util.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is the main entry point for starting the user management server.
 */
public abstract class ServerMain {

    private static final Logger LOG = LoggerFactory.getLogger(ServerMain.class);

    public static void main (String... args) {
        // Jetty threads keep the JVM alive if the main thread crashes after the HTTP server has started.
        // If initialization fails, we need to catch the exception or error and force JVM shutdown.
        try {
            LOG.info("Starting user management server.");
            final Components components = new LocalComponents();
            Runtime.getRuntime().addShutdownHook(new Thread(components::shutDown, "shutdown"));
            LOG.info("User management server is ready.");
        } catch (Throwable throwable) {
            LOG.error("Exception while starting up server, shutting down JVM.\n{}",
                    ExceptionUtils.stackTraceString(throwable));
            System.exit(1);
        }
    }

}
