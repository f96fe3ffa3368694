/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a cache lookup.
 *
 * <ul>
 *   <li>{@link State#ABSENT}: nothing cached for the key, the caller should consult the source of truth.</li>
 *   <li>{@link State#NEGATIVE}: the key was looked up before and is known to be missing.</li>
 *   <li>{@link State#FOUND}: the decoded record is in {@link #value()}.</li>
 * </ul>
 *
 * @param state classification of the raw entry
 * @param value the record, only set when {@code state == FOUND}
 */
public record CacheResult<R>(State state, R value) {

    public enum State { ABSENT, NEGATIVE, FOUND }

    private static final CacheResult<?> ABSENT = new CacheResult<>(State.ABSENT, null);
    private static final CacheResult<?> NEGATIVE = new CacheResult<>(State.NEGATIVE, null);

    public CacheResult {
        Objects.requireNonNull(state, "state");
        if ((state == State.FOUND) != (value != null)) {
            throw new IllegalArgumentException("Only FOUND results carry a value (state=" + state + ")");
        }
    }

    @SuppressWarnings("unchecked")
    public static <R> CacheResult<R> absent() {
        return (CacheResult<R>) ABSENT;
    }

    @SuppressWarnings("unchecked")
    public static <R> CacheResult<R> negative() {
        return (CacheResult<R>) NEGATIVE;
    }

    public static <R> CacheResult<R> found(R value) {
        return new CacheResult<>(State.FOUND, Objects.requireNonNull(value, "value"));
    }

    public boolean isAbsent() {
        return state == State.ABSENT;
    }

    public boolean isNegative() {
        return state == State.NEGATIVE;
    }

    public boolean isFound() {
        return state == State.FOUND;
    }

    public Optional<R> asOptional() {
        return Optional.ofNullable(value);
    }
}
