/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.salesforce.notify.task.Poll;
import com.salesforce.notify.task.Waker;

/**
 * The state shared by the two ends of a one shot handoff. All fields are guarded by a single lock; wakers are only
 * ever invoked outside of it, as a waker may synchronously poll again.
 * <p>
 * The state moves from empty to either completed or canceled, and never back.
 */
final class CompletionState<T> {
    private static final Logger log = LoggerFactory.getLogger(CompletionState.class);

    private boolean    canceled;
    private boolean    completed;
    private final Lock lock = new ReentrantLock();
    private T          value;
    private Waker      waker;

    /**
     * Deliver the value. First write wins: completing a completed or canceled state does nothing.
     *
     * @return true if this call delivered the value
     */
    boolean complete(T value) {
        Objects.requireNonNull(value, "value");
        final var completion = locked(() -> {
            if (completed || canceled) {
                return Transition.IGNORED;
            }
            this.value = value;
            completed = true;
            return new Transition(true, takeWaker());
        });
        if (!completion.applied()) {
            log.trace("Ignoring late completion with: {} of: {}", value, this);
            return false;
        }
        completion.wake();
        return true;
    }

    boolean isCanceled() {
        return locked(() -> canceled);
    }

    boolean isCompleted() {
        return locked(() -> completed);
    }

    /**
     * Abandon the exchange: unless a value was already delivered the state becomes canceled. A waker left by a
     * suspended poll is woken, so that poll runs again and observes the disposal rather than staying suspended.
     *
     * @return true if this call canceled the state
     */
    boolean markCanceledIfIncomplete() {
        final var cancellation = locked(() -> {
            var pending = takeWaker();
            if (completed || canceled) {
                return new Transition(false, pending);
            }
            canceled = true;
            return new Transition(true, pending);
        });
        if (cancellation.applied()) {
            log.trace("Canceled: {}", this);
        }
        cancellation.wake();
        return cancellation.applied();
    }

    /**
     * Take the delivered value if there is one, otherwise register the waker and answer pending.
     *
     * @throws AwaitedTwiceException if the value was already taken
     */
    Poll<T> poll(Waker waker, String owner) {
        Objects.requireNonNull(waker, "waker");
        return locked(() -> {
            if (completed) {
                if (value == null) {
                    throw new AwaitedTwiceException(owner + " was awaited more than once");
                }
                var taken = value;
                value = null;
                return Poll.ready(taken);
            }
            registerWaker(waker);
            return Poll.pending();
        });
    }

    @Override
    public String toString() {
        return locked(() -> MoreObjects.toStringHelper(this)
                                       .add("completed", completed)
                                       .add("canceled", canceled)
                                       .add("waiting", waker != null)
                                       .toString());
    }

    private <R> R locked(Supplier<R> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private Waker takeWaker() {
        var pending = waker;
        waker = null;
        return pending;
    }

    /**
     * Caller holds the lock. A stored waker that already wakes the same task is kept, any other is replaced; only
     * the most recent task is ever woken.
     */
    private void registerWaker(Waker waker) {
        if (this.waker == null || !this.waker.willWake(waker)) {
            this.waker = waker;
        }
    }

    /**
     * Outcome of a transition made under the lock: whether it took effect, and the waker to invoke once the lock is
     * released.
     */
    private record Transition(boolean applied, Waker waker) {
        static final Transition IGNORED = new Transition(false, null);

        void wake() {
            if (waker != null) {
                waker.wake();
            }
        }
    }
}
