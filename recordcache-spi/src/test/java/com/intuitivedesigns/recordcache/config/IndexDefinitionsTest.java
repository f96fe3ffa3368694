/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.config;

import com.intuitivedesigns.recordcache.errors.CacheConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IndexDefinitionsTest {

    private static final String PATH = "cache.indexes";

    private static CacheConfigurationException rejected(String json) {
        return assertThrows(CacheConfigurationException.class, () -> IndexDefinitions.parse(json, PATH));
    }

    @Test
    void testSingleFieldStringIsNormalizedToList() {
        List<IndexDefinition> defs = IndexDefinitions.parse(
                "[{\"name\":\"by_email\",\"fields\":\"email\"},{\"name\":\"by_name\",\"fields\":[\"last\",\"first\"]}]", PATH);

        assertEquals(List.of(
                new IndexDefinition("by_email", List.of("email")),
                new IndexDefinition("by_name", List.of("last", "first"))), defs);
    }

    @Test
    void testAbsentOrBlankMeansNoIndexes() {
        assertEquals(List.of(), IndexDefinitions.parse((String) null, PATH));
        assertEquals(List.of(), IndexDefinitions.parse("  ", PATH));
        assertEquals(List.of(), IndexDefinitions.parse("[]", PATH));
    }

    @Test
    void testListMustBeAnArray() {
        assertEquals(PATH, rejected("{\"name\":\"by_email\",\"fields\":\"email\"}").field());
    }

    @Test
    void testEntriesMustBeObjects() {
        assertEquals("cache.indexes[1]", rejected("[{\"name\":\"a\",\"fields\":\"x\"}, \"b\"]").field());
    }

    @Test
    void testNameAndFieldsAreRequired() {
        CacheConfigurationException e = rejected("[{\"fields\":\"email\"}]");

        assertEquals("cache.indexes[0]", e.field());
        assertTrue(e.getMessage().contains("name"));
        assertTrue(rejected("[{\"name\":\"by_email\"}]").getMessage().contains("fields"));
    }

    @Test
    void testFieldsMustBeStringOrStringList() {
        assertEquals("cache.indexes[0].fields", rejected("[{\"name\":\"a\",\"fields\":42}]").field());
        assertEquals("cache.indexes[0].fields", rejected("[{\"name\":\"a\",\"fields\":[]}]").field());
        assertEquals("cache.indexes[0].fields", rejected("[{\"name\":\"a\",\"fields\":[\"x\",1]}]").field());
        assertEquals("cache.indexes[1].fields", rejected("[{\"name\":\"a\",\"fields\":\"x\"},{\"name\":\"b\",\"fields\":\" \"}]").field());
    }

    @Test
    void testNameMustBeText() {
        assertEquals("cache.indexes[0].name", rejected("[{\"name\":7,\"fields\":\"x\"}]").field());
    }

    @Test
    void testMalformedJson() {
        assertEquals(PATH, rejected("[{").field());
    }
}
