package com.loaderql.core.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine options for one graphlette.
 * <p>
 * {@code cache} and {@code jit} are deliberately untyped: they usually come out of a
 * parsed config file and are checked by {@link ConfigValidator}.
 */
public record GraphletteConfig(
        String schema,
        Object cache,
        Object jit,
        boolean onlyPersisted,
        Map<String, String> persistedQueries
) {
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String schema;
        private Object cache;
        private Object jit;
        private boolean onlyPersisted;
        private final Map<String, String> persistedQueries = new LinkedHashMap<>();

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder cache(Object cache) {
            this.cache = cache;
            return this;
        }

        public Builder jit(Object jit) {
            this.jit = jit;
            return this;
        }

        public Builder onlyPersisted(boolean onlyPersisted) {
            this.onlyPersisted = onlyPersisted;
            return this;
        }

        public Builder persistedQueries(Map<String, String> persistedQueries) {
            this.persistedQueries.putAll(persistedQueries);
            return this;
        }

        public Builder persistedQuery(String id, String query) {
            this.persistedQueries.put(id, query);
            return this;
        }

        public GraphletteConfig build() {
            return new GraphletteConfig(schema, cache, jit, onlyPersisted, Map.copyOf(persistedQueries));
        }
    }
}
