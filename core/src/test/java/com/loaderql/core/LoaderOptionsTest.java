package com.loaderql.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoaderOptionsTest {

    @Test
    void defaultsCacheWithStructuralKeys() {
        LoaderOptions options = LoaderOptions.defaults();

        assertTrue(options.cache());
        assertSame(DedupKeys.structural(), options.keyFunction());
        assertEquals(0, options.maxBatchSize());
    }

    @Test
    void equalOptionsAreEqual() {
        assertEquals(LoaderOptions.defaults(), LoaderOptions.builder().build());
        assertNotEquals(LoaderOptions.defaults(), LoaderOptions.builder().cache(false).build());
    }

    @Test
    void negativeBatchSizeIsRejected() {
        assertThrows(ConfigurationException.class, () -> LoaderOptions.builder().maxBatchSize(-1).build());
    }
}
