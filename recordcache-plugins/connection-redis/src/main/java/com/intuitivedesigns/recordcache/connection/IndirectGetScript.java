/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.connection;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Lua script that follows an index entry to its primary entry in one atomic server call.
 * KEYS[1] is the index key; its value is the primary key to read.
 */
final class IndirectGetScript {

    static final String SOURCE = String.join("\n",
            "local primary = redis.call('GET', KEYS[1])",
            "if not primary then",
            "  return false",
            "end",
            "return redis.call('GET', primary)");

    /** SHA1 digest Redis uses to address the script in EVALSHA. */
    static final String SHA1 = sha1Hex(SOURCE);

    private IndirectGetScript() {}

    static String sha1Hex(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
