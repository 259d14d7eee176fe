package com.loaderql.api.graphql;

import com.loaderql.core.LoaderQuery;
import org.dataloader.BatchLoader;
import org.dataloader.DataLoader;
import org.dataloader.DataLoaderOptions;
import org.dataloader.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.IntFunction;
import java.util.stream.IntStream;

/**
 * Factory for the per-operation DataLoaders that queue a loader's waves.
 * <p>
 * DataLoader caching is always off here: deduplication is done by the
 * {@link DedupCache} before an entry is queued, so every queued entry reaches the batch
 * function.
 */
public class DataLoaderFactory {
    private static final Logger logger = LoggerFactory.getLogger(DataLoaderFactory.class);

    /**
     * Creates the DataLoader that feeds {@code declaration}'s batch function for one operation.
     *
     * @param declaration The loader declaration
     * @param context The operation the loader is scoped to, passed through to the batch function
     * @return DataLoader instance for batching requests
     */
    public static DataLoader<LoaderQuery, Object> createLoader(
            LoaderDeclaration declaration,
            OperationContext context
    ) {
        String name = declaration.name();

        BatchLoader<LoaderQuery, Try<Object>> batchLoader = queries -> {
            logger.debug("Batch loader invoked with {} queries for {} in operation {}",
                    queries.size(), name, context.getOperationId());

            List<LoaderQuery> input = Collections.unmodifiableList(new ArrayList<>(queries));
            CompletionStage<? extends List<?>> pending;
            try {
                pending = declaration.batchFunction().load(input, context);
            } catch (RuntimeException e) {
                logger.error("Batch loader for {} threw", name, e);
                return CompletableFuture.completedFuture(
                        failAll(input.size(), i -> new BatchLoadException(name, i, messageOf(e), e))
                );
            }

            if (pending == null) {
                logger.error("Batch loader for {} returned no result", name);
                return CompletableFuture.completedFuture(
                        failAll(input.size(), i -> new BatchLoadException(name, i, "batch loader for " + name + " returned no result"))
                );
            }

            return pending.handle((results, error) -> settle(name, input.size(), results, error));
        };

        DataLoaderOptions options = DataLoaderOptions.newOptions().setCachingEnabled(false);
        if (declaration.options().maxBatchSize() > 0) {
            options = options.setMaxBatchSize(declaration.options().maxBatchSize());
        }

        return DataLoader.newDataLoaderWithTry(batchLoader, options);
    }

    private static List<Try<Object>> settle(String name, int expected, List<?> results, Throwable error) {
        if (error != null) {
            Throwable cause = unwrap(error);
            logger.error("Batch loader for {} failed: {}", name, messageOf(cause));
            return failAll(expected, i -> new BatchLoadException(name, i, messageOf(cause), cause));
        }

        if (results == null || results.size() != expected) {
            String message = String.format("batch loader for %s returned %d results for %d queries",
                    name, results == null ? 0 : results.size(), expected);
            logger.error(message);
            return failAll(expected, i -> new BatchLoadException(name, i, message));
        }

        // Results map back strictly by position
        List<Try<Object>> settled = new ArrayList<>(expected);
        for (int i = 0; i < expected; i++) {
            Object result = results.get(i);
            if (result instanceof Throwable) {
                Throwable failure = (Throwable) result;
                settled.add(Try.failed(new BatchLoadException(name, i, messageOf(failure), failure)));
            } else {
                settled.add(Try.succeeded(result));
            }
        }
        return settled;
    }

    private static List<Try<Object>> failAll(int size, IntFunction<BatchLoadException> failure) {
        return IntStream.range(0, size)
                .mapToObj(i -> Try.<Object>failed(failure.apply(i)))
                .toList();
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
