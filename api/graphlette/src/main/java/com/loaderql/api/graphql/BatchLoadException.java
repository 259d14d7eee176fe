package com.loaderql.api.graphql;

/**
 * Failure of a single entry of a batch. Every entry of a failed batch gets its own
 * instance carrying its position in the batch input.
 */
public class BatchLoadException extends RuntimeException {
    private final String loader;
    private final int position;

    public BatchLoadException(String loader, int position, String message) {
        super(message);
        this.loader = loader;
        this.position = position;
    }

    public BatchLoadException(String loader, int position, String message, Throwable cause) {
        super(message, cause);
        this.loader = loader;
        this.position = position;
    }

    public String getLoader() {
        return loader;
    }

    public int getPosition() {
        return position;
    }
}
