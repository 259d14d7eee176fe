package com.loaderql.api.graphql;

import graphql.schema.FieldCoordinates;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-operation cache from {@code (type, field, dedupKey)} to a result cell.
 * <p>
 * A cell is a {@link CompletableFuture}: pending until the batch that owns it settles
 * it with a value or an error, and terminal from then on. Failed cells are not evicted,
 * so every request sharing a key observes the same outcome for the whole operation.
 */
public class DedupCache {
    private final Map<CellKey, CompletableFuture<Object>> cells = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private boolean closed;

    /**
     * Installs {@code cell} unless a cell already exists for the key.
     *
     * @return the existing cell, or {@code null} if {@code cell} was installed
     */
    public CompletableFuture<Object> putIfAbsent(FieldCoordinates coordinates, Object key, CompletableFuture<Object> cell) {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("operation already finished");
            }
            return cells.putIfAbsent(new CellKey(coordinates, key), cell);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return cells.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every cell. Pending cells are left to complete but nothing can reach them.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            cells.clear();
        } finally {
            lock.unlock();
        }
    }

    private record CellKey(FieldCoordinates coordinates, Object key) {
    }
}
