/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.errors;

public class UnknownIndexException extends RecordCacheException {

    private final String index;

    public UnknownIndexException(String index) {
        super("No such index \"" + index + "\"");
        this.index = index;
    }

    public String index() {
        return index;
    }
}
