package com.usermanagement.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.Reader;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for classes that load properties containing configuration information and expose these options
 * via the Config interfaces of Components.
 *
 * Some validation may be performed here, but any interpretation or conditional logic should be provided in Components
 * themselves.
 *
 * An example config file is shipped in the repo, so it's easy to see an exhaustive list of all parameters. All
 * configuration parameters are therefore required to avoid any confusion due to merging layers of defaults.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String PROPERTY_PREFIX = "usermgmt-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    // Sorted so the error message lists missing keys in a stable order.
    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system properties.
     * In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or dots as
     * separators. System properties can be set on the JVM command line with -D options. The usual config file keys
     * must be prefixed with "usermgmt", e.g. USERMGMT_SERVER_PORT=8080 or java -Dusermgmt.server.port=8080.
     * Precedence of configuration sources is: system properties > environment variables > config file.
     */
    protected ConfigBase (Properties properties) {
        this.properties = properties;
        // Overwrite properties from config file with environment variables and system properties.
        // By manually overwriting items we are able to log these potentially confusing changes to configuration.
        setPropertiesFromMap(System.getenv(), "environment variable");
        setPropertiesFromMap(System.getProperties(), "system properties");
    }

    /** Static convenience method to uniformly load files into properties and catch errors. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (Exception e) {
            throw new RuntimeException("Could not load configuration properties from " + filename, e);
        }
    }

    // Always use the following *Prop methods to read properties. This will catch and log missing keys or parse
    // exceptions, allowing config loading to continue and reporting as many problems as possible at once.

    // Catches and records missing values,
    // so methods that wrap this and parse into non-String types can just ignore null values.
    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
            return null;
        }
        return value.trim();
    }

    protected int intProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    /** Like intProp, but the value must also be at least one. */
    protected int positiveIntProp (String key) {
        int val = intProp(key);
        if (val < 1 && !keysWithErrors.contains(key)) {
            LOG.error("Value of configuration option '{}' must be a positive integer: {}", key, val);
            keysWithErrors.add(key);
        }
        return val;
    }

    protected boolean boolProp (String key) {
        String val = strProp(key);
        if (val != null) {
            // Boolean.parseBoolean will return false for any string other than "true".
            // We want to be more strict.
            if ("true".equalsIgnoreCase(val) || "yes".equalsIgnoreCase(val)) {
                return true;
            } else if ("false".equalsIgnoreCase(val) || "no".equalsIgnoreCase(val)) {
                return false;
            } else {
                LOG.error("Value of configuration option '{}' could not be parsed as a boolean: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return false;
    }

    /**
     * Call this after reading all properties to enforce the presence of all configuration options.
     * The startup code in ServerMain reports the exception and exits.
     */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw new IllegalStateException(
                    "You must provide valid values for these configuration properties: " +
                    String.join(", ", keysWithErrors)
            );
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties
     * (e.g. supplied on the JVM command line). Case and separators are normalized to conform to both properties and
     * environment variable conventions. Properties are Object-Object Maps so key and value are cast to String.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = ((String)entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = ((String)entry.getValue());
            if (key.startsWith(PROPERTY_PREFIX)) {
                // Strip off prefix to get the key that would be used in our config file.
                key = key.substring(PROPERTY_PREFIX.length());
                // Secrets must not end up in the logs.
                String loggedValue = key.contains("secret") ? "********" : value;
                String existingKey = properties.getProperty(key);
                if (existingKey != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, loggedValue, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, loggedValue, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
