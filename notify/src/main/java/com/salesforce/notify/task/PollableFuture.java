/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify.task;

/**
 * A value that becomes available at some later point, driven by repeated polling rather than by blocking.
 * <p>
 * When {@link #poll(Waker)} answers {@link Poll#pending()}, the future has arranged for the supplied waker (or one
 * supplied by a later poll) to be woken once polling again can make progress.
 *
 * @param <T> the type of the resolved value
 */
@FunctionalInterface
public interface PollableFuture<T> {

    Poll<T> poll(Waker waker);
}
