package com.usermanagement.api;

import com.usermanagement.api.components.HttpApi;
import com.usermanagement.api.components.TaskScheduler;
import com.usermanagement.api.gatekeeper.Gatekeeper;

import java.util.Properties;

/** Loads config information for the user management server and exposes it to the Components. */
public class ServerConfig extends ConfigBase implements
        TaskScheduler.Config,
        HttpApi.Config,
        Gatekeeper.Config
{

    // CONSTANTS AND STATIC FIELDS

    public static final String SERVER_CONFIG_FILE = "server.properties";

    // INSTANCE FIELDS

    private final int serverPort;
    private final String allowOrigin;
    private final String jwtSecret;
    private final String uploadRoot;
    private final int requestTimeoutSeconds;
    private final int rateLimitSweepSeconds;
    private final boolean trustForwardedFor;
    private final int lightThreads;
    private final int maxHttpThreads;

    // CONSTRUCTORS

    private ServerConfig (String filename) {
        this(propsFromFile(filename));
    }

    protected ServerConfig (Properties properties) {
        super(properties);
        // We intentionally don't supply any defaults here.
        // Any 'defaults' should be shipped in an example config file.
        serverPort = positiveIntProp("server-port");
        allowOrigin = strProp("allow-origin");
        jwtSecret = strProp("jwt-secret");
        uploadRoot = strProp("upload-root");
        requestTimeoutSeconds = positiveIntProp("request-timeout-seconds");
        rateLimitSweepSeconds = positiveIntProp("rate-limit-sweep-seconds");
        trustForwardedFor = boolProp("trust-forwarded-for");
        lightThreads = positiveIntProp("light-threads");
        maxHttpThreads = positiveIntProp("max-http-threads");
        throwIfErrors();
    }

    // INTERFACE IMPLEMENTATIONS
    // Methods implementing Component Config interfaces.
    // Note that one method can implement several Config interfaces at once.

    @Override public int     serverPort()            { return serverPort; }
    @Override public String  allowOrigin()           { return allowOrigin; }
    @Override public int     requestTimeoutSeconds() { return requestTimeoutSeconds; }
    @Override public int     rateLimitSweepSeconds() { return rateLimitSweepSeconds; }
    @Override public boolean trustForwardedFor()     { return trustForwardedFor; }
    @Override public int     lightThreads()          { return lightThreads; }
    @Override public int     maxHttpThreads()        { return maxHttpThreads; }

    public String jwtSecret () {
        return jwtSecret;
    }

    public String uploadRoot () {
        return uploadRoot;
    }

    // STATIC FACTORY METHODS
    // Always use these to construct ServerConfig objects for readability.

    public static ServerConfig fromDefaultFile () {
        return new ServerConfig(SERVER_CONFIG_FILE);
    }

    public static ServerConfig fromProperties (Properties properties) {
        return new ServerConfig(properties);
    }

}
