package com.loaderql.api.graphql;

import com.loaderql.core.LoaderOptions;

/**
 * A batch function together with its options, as supplied at registration time.
 */
public record LoaderDefinition(
        BatchFunction loader,
        LoaderOptions opts
) {
    public LoaderDefinition {
        if (loader == null) {
            throw new IllegalArgumentException("loader must not be null");
        }
        if (opts == null) {
            opts = LoaderOptions.defaults();
        }
    }

    public static LoaderDefinition of(BatchFunction loader) {
        return new LoaderDefinition(loader, LoaderOptions.defaults());
    }

    public static LoaderDefinition of(BatchFunction loader, LoaderOptions opts) {
        return new LoaderDefinition(loader, opts);
    }
}
