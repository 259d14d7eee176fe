package com.loaderql.core;

/**
 * Per-loader options.
 *
 * @param cache        deduplicate and memoize requests within one operation
 * @param keyFunction  how a request's dedup key is derived; ignored when {@code cache} is off
 * @param maxBatchSize upper bound on entries per batch call, {@code 0} for unbounded
 */
public record LoaderOptions(
        boolean cache,
        DedupKeyFunction keyFunction,
        int maxBatchSize
) {
    private static final LoaderOptions DEFAULTS = builder().build();

    public LoaderOptions {
        if (keyFunction == null) {
            keyFunction = DedupKeys.structural();
        }
        if (maxBatchSize < 0) {
            throw new ConfigurationException("maxBatchSize must not be negative");
        }
    }

    public static LoaderOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean cache = true;
        private DedupKeyFunction keyFunction = DedupKeys.structural();
        private int maxBatchSize;

        public Builder cache(boolean cache) {
            this.cache = cache;
            return this;
        }

        public Builder keyFunction(DedupKeyFunction keyFunction) {
            this.keyFunction = keyFunction;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public LoaderOptions build() {
            return new LoaderOptions(cache, keyFunction, maxBatchSize);
        }
    }
}
