/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify;

import com.google.common.base.MoreObjects;
import com.salesforce.notify.task.Poll;
import com.salesforce.notify.task.PollableFuture;
import com.salesforce.notify.task.Waker;

/**
 * A settable single shot future with no cancellation signal. The same object is completed by the producer and
 * polled by exactly one task; use {@link Notify} when the producer should learn that nobody is waiting any more.
 *
 * @param <T> the type of the delivered value
 */
public final class NotifyFuture<T> implements PollableFuture<T> {
    private final CompletionState<T> state = new CompletionState<>();

    /**
     * Deliver the value, waking the polling task. Only the first completion has any effect.
     *
     * @return true if this call delivered the value
     */
    public boolean complete(T value) {
        return state.complete(value);
    }

    public boolean isCompleted() {
        return state.isCompleted();
    }

    /**
     * @throws AwaitedTwiceException if the value was already taken, i.e. the future was awaited by more than one
     *                               task
     */
    @Override
    public Poll<T> poll(Waker waker) {
        return state.poll(waker, "NotifyFuture");
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("state", state).toString();
    }
}
