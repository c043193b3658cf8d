/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify;

import java.lang.ref.Cleaner;
import java.lang.ref.Cleaner.Cleanable;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import com.google.common.base.MoreObjects;
import com.salesforce.notify.task.Blocking;
import com.salesforce.notify.task.Poll;
import com.salesforce.notify.task.PollableFuture;
import com.salesforce.notify.task.Waker;

/**
 * The consuming end of a {@link Notify} handoff. Resolves exactly once to the delivered value.
 * <p>
 * Closing the waiter before a value arrives cancels the handoff, which the producer observes through
 * {@link Notify#isCanceled()}. Use try-with-resources; a waiter that becomes unreachable without being closed is
 * canceled when it is collected.
 *
 * @param <T> the type of the delivered value
 */
public final class NotifyWaiter<T> implements PollableFuture<T>, AutoCloseable {
    private static final Cleaner CLEANER = Cleaner.create();

    private final Cleanable          cancellation;
    private volatile boolean         closed;
    private final CompletionState<T> state;

    NotifyWaiter(CompletionState<T> state) {
        this.state = state;
        // must not capture this
        this.cancellation = CLEANER.register(this, state::markCanceledIfIncomplete);
    }

    /**
     * Block the calling thread until the value is delivered.
     *
     * @throws AwaitedTwiceException if the value was already taken
     */
    public T await() throws InterruptedException {
        return Blocking.blockOn(this);
    }

    /**
     * Block the calling thread until the value is delivered or the timeout elapses. The waiter stays open on
     * timeout.
     *
     * @throws AwaitedTwiceException if the value was already taken
     */
    public T await(Duration timeout) throws InterruptedException, TimeoutException {
        return Blocking.blockOn(this, timeout);
    }

    /**
     * Dispose of the waiter. If no value was delivered yet, the handoff is canceled. Idempotent.
     */
    @Override
    public void close() {
        closed = true;
        cancellation.clean();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * @throws AwaitedTwiceException if the value was already taken
     * @throws IllegalStateException if the waiter was closed
     */
    @Override
    public Poll<T> poll(Waker waker) {
        if (closed) {
            throw new IllegalStateException("NotifyWaiter is closed");
        }
        return state.poll(waker, "NotifyWaiter");
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("state", state).toString();
    }
}
