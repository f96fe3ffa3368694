/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.connection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IndirectGetScriptTest {

    @Test
    void testSha1MatchesServerDigest() {
        // SCRIPT LOAD of the same source returns this digest
        assertEquals("1a4375d0d805a9e26a91c93e4ae17f3ba69802cb", IndirectGetScript.SHA1);
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", IndirectGetScript.sha1Hex("abc"));
    }

    @Test
    void testScriptGuardsMissingIndexEntry() {
        assertTrue(IndirectGetScript.SOURCE.contains("if not primary then"));
        assertTrue(IndirectGetScript.SOURCE.startsWith("local primary = redis.call('GET', KEYS[1])"));
    }
}
