package com.loaderql.api.graphql;

public class SchemaReferenceException extends RuntimeException {
    public SchemaReferenceException(String message) {
        super(message);
    }
}
