/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify;

import com.google.common.base.MoreObjects;

/**
 * The producing end of a one shot, cancel aware handoff.
 * <p>
 * {@link #create()} answers a producer and its single consumer, a {@link NotifyWaiter}. The producer delivers one
 * value with {@link #complete(Object)}; if the waiter is closed first, the producer can observe this through
 * {@link #isCanceled()} and stop producing.
 *
 * <pre>
 * var pair = Notify.&lt;Integer&gt;create();
 * executor.execute(() -&gt; {
 *     if (!pair.notifier().isCanceled()) {
 *         pair.notifier().complete(compute());
 *     }
 * });
 * try (var waiter = pair.waiter()) {
 *     return waiter.await();
 * }
 * </pre>
 *
 * @param <T> the type of the delivered value
 */
public final class Notify<T> {

    public record Pair<T>(Notify<T> notifier, NotifyWaiter<T> waiter) {
    }

    public static <T> Pair<T> create() {
        var state = new CompletionState<T>();
        return new Pair<>(new Notify<>(state), new NotifyWaiter<>(state));
    }

    private final CompletionState<T> state;

    private Notify(CompletionState<T> state) {
        this.state = state;
    }

    /**
     * Deliver the value to the waiter, waking it if it is suspended. Only the first completion has any effect;
     * completing after the waiter was closed does nothing.
     *
     * @return true if this call delivered the value, false if the handoff was already completed or canceled
     */
    public boolean complete(T value) {
        return state.complete(value);
    }

    /**
     * Answer true if the waiter was closed before a value was delivered. Advisory: the waiter may be closed right
     * after this answers false, in which case a following {@link #complete(Object)} is simply ignored.
     */
    public boolean isCanceled() {
        return state.isCanceled();
    }

    public boolean isCompleted() {
        return state.isCompleted();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("state", state).toString();
    }
}
