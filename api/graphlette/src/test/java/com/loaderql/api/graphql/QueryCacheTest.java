package com.loaderql.api.graphql;

import graphql.ExecutionInput;
import graphql.GraphqlErrorBuilder;
import graphql.execution.preparsed.PreparsedDocumentEntry;
import graphql.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class QueryCacheTest {
    private final AtomicInteger parses = new AtomicInteger();
    private final Function<ExecutionInput, PreparsedDocumentEntry> parser = input -> {
        parses.incrementAndGet();
        return new PreparsedDocumentEntry(Parser.parse(input.getQuery()));
    };

    private static ExecutionInput input(String query) {
        return ExecutionInput.newExecutionInput().query(query).build();
    }

    @Test
    void cachesOnFirstUseWithZeroThreshold() {
        QueryCache cache = new QueryCache(10, 0);

        PreparsedDocumentEntry first = cache.getDocumentAsync(input("{ dogs { name } }"), parser).join();
        PreparsedDocumentEntry second = cache.getDocumentAsync(input("{ dogs { name } }"), parser).join();

        assertEquals(1, parses.get());
        assertSame(first, second);
        assertEquals(1, cache.size());
    }

    @Test
    void jitThresholdDelaysCaching() {
        QueryCache cache = new QueryCache(10, 1);

        cache.getDocumentAsync(input("{ dogs { name } }"), parser).join();
        assertEquals(0, cache.size());

        cache.getDocumentAsync(input("{ dogs { name } }"), parser).join();
        cache.getDocumentAsync(input("{ dogs { name } }"), parser).join();

        assertEquals(2, parses.get());
        assertEquals(1, cache.size());
    }

    @Test
    void leastRecentlyUsedDocumentIsEvicted() {
        QueryCache cache = new QueryCache(2, 0);

        cache.getDocumentAsync(input("{ a }"), parser).join();
        cache.getDocumentAsync(input("{ b }"), parser).join();
        cache.getDocumentAsync(input("{ a }"), parser).join();
        cache.getDocumentAsync(input("{ c }"), parser).join();
        assertEquals(3, parses.get());

        cache.getDocumentAsync(input("{ a }"), parser).join();
        assertEquals(3, parses.get());

        cache.getDocumentAsync(input("{ b }"), parser).join();
        assertEquals(4, parses.get());
    }

    @Test
    void invalidDocumentsAreNotCached() {
        QueryCache cache = new QueryCache(10, 0);
        Function<ExecutionInput, PreparsedDocumentEntry> invalid = input -> {
            parses.incrementAndGet();
            return new PreparsedDocumentEntry(List.of(GraphqlErrorBuilder.newError().message("invalid").build()));
        };

        cache.getDocumentAsync(input("{ nope }"), invalid).join();
        cache.getDocumentAsync(input("{ nope }"), invalid).join();

        assertEquals(2, parses.get());
        assertEquals(0, cache.size());
    }

    @Test
    void sizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new QueryCache(0, 0));
    }
}
