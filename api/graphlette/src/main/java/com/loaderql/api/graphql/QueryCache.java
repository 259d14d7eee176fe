package com.loaderql.api.graphql;

import graphql.ExecutionInput;
import graphql.execution.preparsed.PreparsedDocumentEntry;
import graphql.execution.preparsed.PreparsedDocumentProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * LRU cache of parsed and validated documents keyed by query text.
 * <p>
 * A query is only cached once it has been parsed more than {@code jitThreshold} times,
 * so one-off queries don't push hot ones out. Documents with validation errors are
 * never cached.
 */
public class QueryCache implements PreparsedDocumentProvider {
    private static final Logger logger = LoggerFactory.getLogger(QueryCache.class);

    private final int jitThreshold;
    private final Map<String, PreparsedDocumentEntry> documents;
    private final Map<String, Integer> parses;

    public QueryCache(int maxSize, int jitThreshold) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.jitThreshold = jitThreshold;
        this.documents = lru(maxSize);
        this.parses = lru(maxSize);
    }

    @Override
    public CompletableFuture<PreparsedDocumentEntry> getDocumentAsync(
            ExecutionInput executionInput,
            Function<ExecutionInput, PreparsedDocumentEntry> parseAndValidateFunction
    ) {
        return CompletableFuture.completedFuture(getDocument(executionInput, parseAndValidateFunction));
    }

    public PreparsedDocumentEntry getDocument(
            ExecutionInput executionInput,
            Function<ExecutionInput, PreparsedDocumentEntry> parseAndValidateFunction
    ) {
        String query = executionInput.getQuery();

        PreparsedDocumentEntry cached;
        synchronized (this) {
            cached = documents.get(query);
        }
        if (cached != null) {
            return cached;
        }

        PreparsedDocumentEntry entry = parseAndValidateFunction.apply(executionInput);
        if (entry.hasErrors()) {
            return entry;
        }

        synchronized (this) {
            int seen = parses.merge(query, 1, Integer::sum);
            if (seen > jitThreshold) {
                parses.remove(query);
                documents.put(query, entry);
                logger.trace("Cached document after {} parses", seen);
            }
        }
        return entry;
    }

    public synchronized int size() {
        return documents.size();
    }

    private static <V> Map<String, V> lru(int maxSize) {
        return new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, V> eldest) {
                return size() > maxSize;
            }
        };
    }
}
