package io.surfworks.opforge.core.schema;

import io.surfworks.opforge.core.proto.OperatorDef;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide registry of operator schemas, keyed by operator type name.
 *
 * <p>Lifecycle is two-phase. During initialization each operator type calls
 * {@link #newSchema} (or {@link #register}) exactly once and configures the
 * returned schema. Afterwards the registry is only read: lookups never lock
 * and return read-only views.
 *
 * <p>{@link OpSchemaProvider}s on the class path are run once, the first time
 * the registry is queried, unless {@code -Dopforge.schema.autoload=false}.
 * If a provider throws, every lookup rethrows that same failure.
 */
public final class OpSchemaRegistry {

    private static final Logger LOGGER = Logger.getLogger(OpSchemaRegistry.class.getName());

    private static final Map<String, OpSchema> SCHEMAS = new ConcurrentHashMap<>();
    private static final OpSchemaConfig CONFIG = OpSchemaConfig.fromSystemProperties();

    private OpSchemaRegistry() {} // Utility class

    /**
     * Runs the service-loaded providers when first touched. Class
     * initialization guarantees this happens exactly once.
     */
    private static final class Providers {
        static final ProviderLoad LOAD = CONFIG.autoloadProviders()
            ? ProviderLoad.run(ServiceLoader.load(OpSchemaProvider.class))
            : ProviderLoad.SKIPPED;
    }

    /**
     * Outcome of running the providers. Loading stops at the first provider
     * that throws, and that failure is rethrown by every later lookup.
     */
    static final class ProviderLoad {

        static final ProviderLoad SKIPPED = new ProviderLoad(null);

        private final Throwable failure;

        private ProviderLoad(Throwable failure) {
            this.failure = failure;
        }

        static ProviderLoad run(Iterable<OpSchemaProvider> providers) {
            try {
                for (OpSchemaProvider provider : providers) {
                    LOGGER.fine(() -> "Loading operator schemas from " + provider.getClass().getName());
                    provider.registerSchemas();
                }
                return new ProviderLoad(null);
            } catch (RuntimeException | Error e) {
                LOGGER.log(Level.SEVERE, "Operator schema provider failed", e);
                return new ProviderLoad(e);
            }
        }

        Throwable failure() {
            return failure;
        }

        void rethrowIfFailed() {
            if (failure instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (failure instanceof Error error) {
                throw error;
            }
        }
    }

    static OpSchemaConfig config() {
        return CONFIG;
    }

    /**
     * Create and register the schema for {@code name}.
     *
     * @param name operator type name
     * @param file source file performing the registration
     * @param line source line performing the registration
     * @return the new schema, to be configured by the caller
     * @throws DuplicateSchemaError if {@code name} is already registered
     */
    public static OpSchema newSchema(String name, String file, int line) {
        OpSchema schema = new OpSchema(name, file, line, CONFIG.verifyLogLevel());
        OpSchema existing = SCHEMAS.putIfAbsent(name, schema);
        if (existing != null) {
            DuplicateSchemaError error =
                new DuplicateSchemaError(name, file, line, existing.file(), existing.line());
            LOGGER.log(Level.SEVERE, error.getMessage());
            throw error;
        }
        LOGGER.fine(() -> "Registered schema " + name + " from " + file + ":" + line);
        return schema;
    }

    /**
     * Create and register the schema for {@code name}, recording the calling
     * class's source file and line as the registration site.
     *
     * @throws DuplicateSchemaError if {@code name} is already registered
     */
    public static OpSchema register(String name) {
        StackWalker.StackFrame caller = StackWalker.getInstance()
            .walk(frames -> frames
                .filter(f -> !f.getClassName().equals(OpSchemaRegistry.class.getName()))
                .findFirst())
            .orElse(null);
        String file = caller == null || caller.getFileName() == null ? "unknown" : caller.getFileName();
        int line = caller == null ? 0 : Math.max(caller.getLineNumber(), 0);
        return newSchema(name, file, line);
    }

    /**
     * Look up the schema for an operator type.
     *
     * @param name operator type name
     * @return the schema, or empty if none is registered
     */
    public static Optional<OpSchema> schema(String name) {
        ensureProvidersLoaded();
        return Optional.ofNullable(SCHEMAS.get(name));
    }

    /**
     * Check if a schema is registered under {@code name}.
     */
    public static boolean isRegistered(String name) {
        return schema(name).isPresent();
    }

    /**
     * Sorted names of all registered schemas.
     */
    public static List<String> keys() {
        ensureProvidersLoaded();
        return SCHEMAS.keySet().stream().sorted().toList();
    }

    /**
     * Read-only view of the registry.
     */
    public static Map<String, OpSchema> schemas() {
        ensureProvidersLoaded();
        return Collections.unmodifiableMap(SCHEMAS);
    }

    /**
     * Infer the device of each input and output of {@code def} using the
     * schema of its operator type.
     *
     * @throws SchemaNotFoundException if no schema is registered for {@code def.type()}
     */
    public static DevicePlacement inferOpInputOutputDevice(OperatorDef def) {
        OpSchema schema = schema(def.type())
            .orElseThrow(() -> new SchemaNotFoundException(def.type(), "Device inference"));
        return schema.inferDevice(def);
    }

    private static void ensureProvidersLoaded() {
        Providers.LOAD.rethrowIfFailed();
    }
}
