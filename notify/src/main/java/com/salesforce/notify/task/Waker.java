/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify.task;

/**
 * A resumption token for a suspended {@link PollableFuture}. Invoking {@link #wake()} asks whoever is driving the
 * future to poll it again. Wakers may be invoked from any thread, any number of times.
 */
public interface Waker {

    void wake();

    /**
     * Answer true if waking the receiver would resume the same task as waking the other waker. Only used to skip
     * redundant re-registration, so a conservative false is always correct.
     */
    default boolean willWake(Waker other) {
        return this == other;
    }
}
