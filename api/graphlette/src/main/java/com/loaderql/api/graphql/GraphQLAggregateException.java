package com.loaderql.api.graphql;

import graphql.GraphQLError;

import java.util.List;

/**
 * Raised by {@link Graphlette#evaluate} when execution produced errors, since that entry
 * point has no response to attach them to. Carries every field error and whatever
 * partial data was resolved.
 */
public class GraphQLAggregateException extends RuntimeException {
    public static final String BAD_REQUEST = "Bad Request";
    public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";

    private final List<GraphQLError> errors;
    private final Object data;

    public GraphQLAggregateException(String message, List<GraphQLError> errors, Object data) {
        super(message);
        this.errors = List.copyOf(errors);
        this.data = data;
    }

    public List<GraphQLError> getErrors() {
        return errors;
    }

    public <T> T getData() {
        @SuppressWarnings("unchecked")
        T partial = (T) data;
        return partial;
    }

    public int getStatusCode() {
        return BAD_REQUEST.equals(getMessage()) ? 400 : 500;
    }
}
