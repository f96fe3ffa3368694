/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.errors;

public class RecordDecodingException extends RecordCacheException {

    public RecordDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
