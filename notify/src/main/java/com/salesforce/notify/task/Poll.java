/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify.task;

import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * The outcome of polling a {@link PollableFuture}: either the ready value, or pending.
 */
public final class Poll<T> {
    private static final Poll<?> PENDING = new Poll<>(null);

    public static <T> Poll<T> ready(T value) {
        return new Poll<>(Objects.requireNonNull(value, "ready value"));
    }

    @SuppressWarnings("unchecked")
    public static <T> Poll<T> pending() {
        return (Poll<T>) PENDING;
    }

    private final T value;

    private Poll(T value) {
        this.value = value;
    }

    public T get() {
        if (value == null) {
            throw new IllegalStateException("Poll is pending");
        }
        return value;
    }

    public boolean isPending() {
        return value == null;
    }

    public boolean isReady() {
        return value != null;
    }

    @Override
    public String toString() {
        return isPending() ? "Poll[pending]" : MoreObjects.toStringHelper("Poll").add("ready", value).toString();
    }
}
