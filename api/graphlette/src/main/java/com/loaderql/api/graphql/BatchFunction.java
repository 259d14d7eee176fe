package com.loaderql.api.graphql;

import com.loaderql.core.LoaderQuery;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Resolves many pending requests for one field in a single call.
 * <p>
 * The returned list must have the same length and order as {@code queries}. An
 * element that is a {@link Throwable} fails only the request at that position.
 */
@FunctionalInterface
public interface BatchFunction {
    CompletionStage<? extends List<?>> load(
            List<LoaderQuery> queries,
            OperationContext context
    );
}
