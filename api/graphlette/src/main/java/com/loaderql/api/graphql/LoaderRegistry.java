package com.loaderql.api.graphql;

import com.loaderql.core.LoaderOptions;
import graphql.schema.FieldCoordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loader declarations keyed by field coordinates. Later declarations for the same field
 * replace earlier ones; re-declaring an identical loader is a no-op.
 */
public class LoaderRegistry {
    private static final Logger logger = LoggerFactory.getLogger(LoaderRegistry.class);
    private final Map<FieldCoordinates, LoaderDeclaration> declarations = new ConcurrentHashMap<>();

    /**
     * @return {@code true} if the table changed
     */
    public synchronized boolean register(String typeName, String fieldName, BatchFunction batchFunction, LoaderOptions options) {
        FieldCoordinates coordinates = FieldCoordinates.coordinates(typeName, fieldName);
        LoaderDeclaration declaration = new LoaderDeclaration(
                coordinates,
                batchFunction,
                options == null ? LoaderOptions.defaults() : options
        );

        LoaderDeclaration previous = declarations.put(coordinates, declaration);
        if (declaration.equals(previous)) {
            logger.trace("Loader for {} already registered", declaration.name());
            return false;
        }

        logger.debug("{} loader for {} (cache={})",
                previous == null ? "Registered" : "Replaced",
                declaration.name(),
                declaration.options().cache()
        );
        return true;
    }

    public boolean register(String typeName, String fieldName, LoaderDefinition definition) {
        return register(typeName, fieldName, definition.loader(), definition.opts());
    }

    public Optional<LoaderDeclaration> get(String typeName, String fieldName) {
        return Optional.ofNullable(declarations.get(FieldCoordinates.coordinates(typeName, fieldName)));
    }

    public Collection<LoaderDeclaration> declarations() {
        return List.copyOf(declarations.values());
    }

    public int size() {
        return declarations.size();
    }
}
