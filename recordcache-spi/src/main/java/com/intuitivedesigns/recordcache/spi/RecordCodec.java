/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.spi;

import java.util.Map;

/**
 * Converts records to and from their stored string form.
 *
 * <p>An encoded record must never equal the negative marker ({@code "0"}); the cache rejects
 * records that do.</p>
 *
 * @param <R> record type
 */
public interface RecordCodec<R> {

    String encode(R record);

    /**
     * @throws com.intuitivedesigns.recordcache.errors.RecordDecodingException on malformed input
     */
    R decode(String encoded);

    /**
     * Top-level fields of the record, used to build secondary index keys.
     */
    Map<String, Object> fields(R record);
}
