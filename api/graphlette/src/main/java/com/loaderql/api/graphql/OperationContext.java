package com.loaderql.api.graphql;

import graphql.GraphQLContext;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.dataloader.DataLoaderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Scope of one top-level operation. Owns the operation's dedup cache and data loaders,
 * and is the context handed to every batch function. Never shared between operations.
 */
public class OperationContext implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(OperationContext.class);

    private final String operationId = UUID.randomUUID().toString();
    private final Graphlette app;
    private final HttpServletRequest request;
    private final HttpServletResponse response;
    private final DataLoaderRegistry dataLoaderRegistry = new DataLoaderRegistry();
    private final DedupCache cache = new DedupCache();

    public OperationContext(Graphlette app, HttpServletRequest request, HttpServletResponse response) {
        this.app = app;
        this.request = request;
        this.response = response;
        logger.trace("Operation {} started", operationId);
    }

    public static OperationContext from(GraphQLContext graphQLContext) {
        if (graphQLContext == null) {
            return null;
        }
        return graphQLContext.get(OperationContext.class);
    }

    public String getOperationId() {
        return operationId;
    }

    public Graphlette getApp() {
        return app;
    }

    /**
     * @return the servlet request, or {@code null} for an internal execution
     */
    public HttpServletRequest getRequest() {
        return request;
    }

    public HttpServletResponse getResponse() {
        return response;
    }

    public DataLoaderRegistry getDataLoaderRegistry() {
        return dataLoaderRegistry;
    }

    DedupCache cache() {
        return cache;
    }

    /**
     * Flushes every pending wave. graphql-java does this itself between execution
     * levels; call it when driving the {@link BatchScheduler} directly.
     */
    public void dispatch() {
        dataLoaderRegistry.dispatchAll();
    }

    @Override
    public void close() {
        logger.trace("Operation {} finished with {} cached entries", operationId, cache.size());
        cache.close();
    }
}
