/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheResultTest {

    @Test
    void testStates() {
        CacheResult<String> found = CacheResult.found("r");

        assertTrue(found.isFound());
        assertEquals("r", found.asOptional().orElseThrow());
        assertTrue(CacheResult.<String>negative().isNegative());
        assertTrue(CacheResult.<String>absent().isAbsent());
        assertNotEquals(CacheResult.absent(), CacheResult.negative());
    }

    @Test
    void testOnlyFoundCarriesValue() {
        assertThrows(IllegalArgumentException.class, () -> new CacheResult<>(CacheResult.State.NEGATIVE, "x"));
        assertThrows(IllegalArgumentException.class, () -> new CacheResult<>(CacheResult.State.FOUND, null));
        assertThrows(NullPointerException.class, () -> CacheResult.found(null));
    }

    @Test
    void testIndexTupleCopiesAndValidates() {
        assertEquals(2, IndexTuple.of("eu", "a@b.com").size());
        assertThrows(IllegalArgumentException.class, IndexTuple::of);
        assertThrows(NullPointerException.class, () -> IndexTuple.of("a", null));
    }
}
