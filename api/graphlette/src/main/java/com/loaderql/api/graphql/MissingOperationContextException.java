package com.loaderql.api.graphql;

/**
 * Raised for a loader-backed field resolved outside {@link Graphlette#executeRequest}.
 */
public class MissingOperationContextException extends RuntimeException {
    public static final String MESSAGE = "loaders only work via Graphlette.executeRequest()";

    private final String field;

    public MissingOperationContextException(String field) {
        super(MESSAGE);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
