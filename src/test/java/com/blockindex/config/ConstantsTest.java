package com.blockindex.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testConstantValues() {
        assertEquals(10_000, Constants.DEFAULT_BLOCK_CAPACITY);
        assertEquals(1_000, Constants.DEFAULT_BLOCK_SHARD_CAPACITY);
        assertEquals(10_000, Constants.DEFAULT_INDEX_SHARD_CAPACITY);

        assertEquals("blocks", Constants.BLOCKS_DIR_NAME);
        assertEquals("index", Constants.INDEX_DIR_NAME);
        assertEquals("block-", Constants.BLOCK_DIR_PREFIX);
        assertEquals("shard-", Constants.SHARD_FILE_PREFIX);
    }

    @Test
    void testPunctuationSet() {
        assertEquals(10, Constants.PUNCTUATION.size());
        for (String symbol : new String[] {".", "!", "?", ":", ";", ",", "(", ")", "—", "·"}) {
            assertTrue(Constants.PUNCTUATION.contains(symbol), "缺少标点: " + symbol);
        }
    }

    @Test
    void testPrivateConstructorReachableByReflection() throws Exception {
        Constructor<Constants> constructor = Constants.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        Constants constantsInstance = constructor.newInstance();
        assertNotNull(constantsInstance);
    }
}
