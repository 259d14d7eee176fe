package com.loaderql.core;

import java.util.Map;

/**
 * One pending resolution request handed to a batch loader: the object the field
 * is being resolved on and the arguments the field was called with.
 */
public record LoaderQuery(
        Object source,
        Map<String, Object> arguments
) {
    public LoaderQuery {
        arguments = arguments == null ? Map.of() : arguments;
    }
}
