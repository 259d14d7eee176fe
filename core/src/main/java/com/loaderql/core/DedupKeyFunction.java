package com.loaderql.core;

/**
 * Derives the value used to decide whether two {@link LoaderQuery}s are the same request.
 * Returned keys are compared with {@code equals}/{@code hashCode}.
 */
@FunctionalInterface
public interface DedupKeyFunction {
    Object keyOf(LoaderQuery query);
}
