/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify.task;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link PollableFuture} to completion on the calling thread.
 */
public final class Blocking {
    private static final Logger log = LoggerFactory.getLogger(Blocking.class);

    public static <T> T blockOn(PollableFuture<T> future) throws InterruptedException {
        final var waker = ParkingWaker.current();
        while (true) {
            Poll<T> poll = future.poll(waker);
            if (poll.isReady()) {
                return poll.get();
            }
            waker.park();
        }
    }

    /**
     * Drive the future on the calling thread, giving up once the timeout has elapsed. The future is left as is on
     * timeout; the caller decides whether to keep polling it or to dispose of it.
     */
    public static <T> T blockOn(PollableFuture<T> future, Duration timeout) throws InterruptedException,
                                                                            TimeoutException {
        final var waker = ParkingWaker.current();
        // saturates rather than overflowing for very long timeouts
        final long deadline = System.nanoTime() + TimeUnit.NANOSECONDS.convert(timeout);
        while (true) {
            Poll<T> poll = future.poll(waker);
            if (poll.isReady()) {
                return poll.get();
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0 || !waker.parkNanos(remaining)) {
                log.trace("Timed out after: {} blocking on: {}", timeout, future);
                throw new TimeoutException("Not ready after " + timeout);
            }
        }
    }

    private Blocking() {
    }
}
