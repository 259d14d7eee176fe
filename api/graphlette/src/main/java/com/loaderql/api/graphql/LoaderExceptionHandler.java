package com.loaderql.api.graphql;

import graphql.ErrorType;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.execution.DataFetcherExceptionHandler;
import graphql.execution.DataFetcherExceptionHandlerParameters;
import graphql.execution.DataFetcherExceptionHandlerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Reports a failed field under its own path with the exception's message, so per-entry
 * batch failures stay distinguishable in the response.
 */
public class LoaderExceptionHandler implements DataFetcherExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(LoaderExceptionHandler.class);

    @Override
    public CompletableFuture<DataFetcherExceptionHandlerResult> handleException(DataFetcherExceptionHandlerParameters handlerParameters) {
        Throwable exception = DataLoaderFactory.unwrap(handlerParameters.getException());
        String message = exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();

        logger.debug("Field {} failed: {}", handlerParameters.getPath(), message);

        GraphQLError error = GraphqlErrorBuilder.newError()
                .message(message)
                .path(handlerParameters.getPath())
                .location(handlerParameters.getSourceLocation())
                .errorType(ErrorType.DataFetchingException)
                .build();

        return CompletableFuture.completedFuture(DataFetcherExceptionHandlerResult.newResult(error).build());
    }
}
