package com.loaderql.api.graphql;

import graphql.schema.FieldCoordinates;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class DedupCacheTest {
    private static final FieldCoordinates OWNER = FieldCoordinates.coordinates("Dog", "owner");
    private static final FieldCoordinates BREED = FieldCoordinates.coordinates("Dog", "breed");

    @Test
    void firstCellForAKeyWins() {
        DedupCache cache = new DedupCache();
        CompletableFuture<Object> first = new CompletableFuture<>();
        CompletableFuture<Object> second = new CompletableFuture<>();

        assertNull(cache.putIfAbsent(OWNER, "Max", first));
        assertSame(first, cache.putIfAbsent(OWNER, "Max", second));
        assertEquals(1, cache.size());
    }

    @Test
    void keysAreScopedByField() {
        DedupCache cache = new DedupCache();

        assertNull(cache.putIfAbsent(OWNER, "Max", new CompletableFuture<>()));
        assertNull(cache.putIfAbsent(BREED, "Max", new CompletableFuture<>()));
        assertEquals(2, cache.size());
    }

    @Test
    void settledCellsAreTerminal() {
        DedupCache cache = new DedupCache();
        CompletableFuture<Object> cell = new CompletableFuture<>();
        cache.putIfAbsent(OWNER, "Max", cell);

        cell.complete("Jennifer");
        cell.complete("Sarah");
        cell.completeExceptionally(new IllegalStateException("late"));

        assertEquals("Jennifer", cache.putIfAbsent(OWNER, "Max", new CompletableFuture<>()).join());
    }

    @Test
    void closingDropsCellsAndRefusesNewOnes() {
        DedupCache cache = new DedupCache();
        cache.putIfAbsent(OWNER, "Max", new CompletableFuture<>());

        cache.close();

        assertTrue(cache.isClosed());
        assertEquals(0, cache.size());
        assertThrows(IllegalStateException.class, () -> cache.putIfAbsent(OWNER, "Max", new CompletableFuture<>()));
    }
}
