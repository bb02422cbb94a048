package io.surfworks.opforge.core.schema;

/**
 * Source of schema registrations, discovered with {@link java.util.ServiceLoader}.
 *
 * <p>Implementations are listed in
 * {@code META-INF/services/io.surfworks.opforge.core.schema.OpSchemaProvider}
 * and run once, the first time the registry is queried. Each provider
 * registers its operators through {@link OpSchemaRegistry#newSchema} or
 * {@link OpSchemaRegistry#register}.
 */
public interface OpSchemaProvider {

    /**
     * Registers this provider's schemas. Called at most once per process.
     */
    void registerSchemas();
}
