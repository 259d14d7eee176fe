package com.loaderql.api.graphql;

import com.loaderql.core.LoaderOptions;
import org.junit.jupiter.api.Test;

import static com.loaderql.api.graphql.TestUtils.ownersOf;
import static org.junit.jupiter.api.Assertions.*;

class LoaderRegistryTest {
    private final BatchFunction owners = (queries, context) -> ownersOf(queries);

    @Test
    void registeringTheSameDeclarationTwiceIsANoOp() {
        LoaderRegistry registry = new LoaderRegistry();

        assertTrue(registry.register("Dog", "owner", owners, LoaderOptions.defaults()));
        assertFalse(registry.register("Dog", "owner", owners, LoaderOptions.defaults()));
        assertFalse(registry.register("Dog", "owner", LoaderDefinition.of(owners)));
        assertEquals(1, registry.size());
    }

    @Test
    void laterDeclarationReplacesEarlier() {
        LoaderRegistry registry = new LoaderRegistry();
        BatchFunction other = (queries, context) -> ownersOf(queries);

        registry.register("Dog", "owner", owners, LoaderOptions.defaults());
        assertTrue(registry.register("Dog", "owner", other, LoaderOptions.defaults()));

        assertSame(other, registry.get("Dog", "owner").orElseThrow().batchFunction());
        assertEquals(1, registry.size());
    }

    @Test
    void changingOptionsReplacesTheDeclaration() {
        LoaderRegistry registry = new LoaderRegistry();

        registry.register("Dog", "owner", owners, LoaderOptions.defaults());
        assertTrue(registry.register("Dog", "owner", owners, LoaderOptions.builder().cache(false).build()));

        assertFalse(registry.get("Dog", "owner").orElseThrow().options().cache());
    }

    @Test
    void nullOptionsMeanDefaults() {
        LoaderRegistry registry = new LoaderRegistry();

        registry.register("Dog", "owner", owners, null);

        assertEquals(LoaderOptions.defaults(), registry.get("Dog", "owner").orElseThrow().options());
        assertEquals("Dog.owner", registry.get("Dog", "owner").orElseThrow().name());
    }

    @Test
    void unknownFieldIsEmpty() {
        assertTrue(new LoaderRegistry().get("Dog", "owner").isEmpty());
    }
}
