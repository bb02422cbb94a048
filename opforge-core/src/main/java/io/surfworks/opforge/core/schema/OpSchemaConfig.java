package io.surfworks.opforge.core.schema;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;

/**
 * Settings of the schema engine, read from system properties.
 *
 * <ul>
 *   <li>{@code -Dopforge.schema.autoload=false} skips {@link OpSchemaProvider}
 *       discovery on first registry access (default true)</li>
 *   <li>{@code -Dopforge.schema.verify.log=WARNING} sets the level at which
 *       {@link OpSchema#verify} reports failing rules (default FINE, OFF to silence)</li>
 * </ul>
 *
 * @param autoloadProviders whether to run service-loaded providers
 * @param verifyLogLevel    level for verification failure messages
 */
public record OpSchemaConfig(boolean autoloadProviders, Level verifyLogLevel) {

    static final String AUTOLOAD_PROP = "opforge.schema.autoload";
    static final String VERIFY_LOG_PROP = "opforge.schema.verify.log";

    public OpSchemaConfig {
        Objects.requireNonNull(verifyLogLevel, "verifyLogLevel cannot be null");
    }

    public static OpSchemaConfig defaults() {
        return new OpSchemaConfig(true, Level.FINE);
    }

    /**
     * Reads the configuration from the current system properties, falling back
     * to {@link #defaults()} for anything unset.
     *
     * @throws IllegalArgumentException if the verify log level is not a valid level name
     */
    public static OpSchemaConfig fromSystemProperties() {
        OpSchemaConfig defaults = defaults();

        String autoload = System.getProperty(AUTOLOAD_PROP, "").trim();
        boolean autoloadProviders = autoload.isEmpty()
            ? defaults.autoloadProviders()
            : Boolean.parseBoolean(autoload);

        String level = System.getProperty(VERIFY_LOG_PROP, "").trim();
        Level verifyLogLevel = level.isEmpty()
            ? defaults.verifyLogLevel()
            : Level.parse(level.toUpperCase(Locale.ROOT));

        return new OpSchemaConfig(autoloadProviders, verifyLogLevel);
    }
}
