package com.loaderql.api.graphql;

import com.loaderql.core.LoaderQuery;
import org.dataloader.DataLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Turns single-object resolution requests into batched ones.
 * <p>
 * {@link #load} only registers: the entry is attached to an existing dedup cell or
 * queued on the operation's DataLoader for the field. Nothing reaches the batch function
 * until the operation dispatches, which graphql-java does once the current execution
 * level has been fetched. Everything registered in between forms one wave and results
 * in a single batch call (or one per {@code maxBatchSize} chunk).
 */
public class BatchScheduler {
    private static final Logger logger = LoggerFactory.getLogger(BatchScheduler.class);

    public CompletableFuture<Object> load(LoaderDeclaration declaration, LoaderQuery query, OperationContext context) {
        DataLoader<LoaderQuery, Object> wave = waveFor(declaration, context);

        if (!declaration.options().cache()) {
            return wave.load(query);
        }

        Object key = declaration.options().keyFunction().keyOf(query);
        CompletableFuture<Object> cell = new CompletableFuture<>();
        CompletableFuture<Object> existing = context.cache().putIfAbsent(declaration.coordinates(), key, cell);
        if (existing != null) {
            logger.trace("{} attached to cached entry {}", declaration.name(), key);
            return existing;
        }

        wave.load(query).whenComplete((value, error) -> {
            if (error != null) {
                cell.completeExceptionally(DataLoaderFactory.unwrap(error));
            } else {
                cell.complete(value);
            }
        });
        return cell;
    }

    private DataLoader<LoaderQuery, Object> waveFor(LoaderDeclaration declaration, OperationContext context) {
        return context.getDataLoaderRegistry().computeIfAbsent(
                declaration.name(),
                name -> DataLoaderFactory.createLoader(declaration, context)
        );
    }
}
