package com.loaderql.core.config;

import com.loaderql.core.ConfigurationException;

public final class ConfigValidator {
    public static final int DEFAULT_CACHE_SIZE = 1024;

    private ConfigValidator() {
    }

    public static void validate(GraphletteConfig config) {
        if (config.schema() == null || config.schema().isBlank()) {
            throw new ConfigurationException("a schema must be provided");
        }
        cacheSize(config.cache());
        jitThreshold(config.jit());
        if (config.onlyPersisted() && (config.persistedQueries() == null || config.persistedQueries().isEmpty())) {
            throw new ConfigurationException("onlyPersisted is true but there are no persistedQueries");
        }
    }

    /**
     * @return the document cache size, {@code 0} when caching is disabled
     */
    public static int cacheSize(Object cache) {
        if (cache == null) {
            return DEFAULT_CACHE_SIZE;
        }
        if (Boolean.FALSE.equals(cache)) {
            return 0;
        }
        if (cache instanceof Number) {
            double size = ((Number) cache).doubleValue();
            if (size >= 0 && size <= Integer.MAX_VALUE && size == Math.rint(size)) {
                return (int) size;
            }
        }
        throw new ConfigurationException("Cache type is not supported");
    }

    public static int jitThreshold(Object jit) {
        if (jit == null) {
            return 0;
        }
        if (!(jit instanceof Number)) {
            throw new ConfigurationException("the jit option must be a number");
        }
        return Math.max(0, ((Number) jit).intValue());
    }
}
