/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify.task;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;

/**
 * A waker that resumes one thread blocked in {@link #park()}. A wake that arrives before the thread parks is
 * remembered, so it is never lost. There is one waker per thread, so a waker left registered by an earlier blocking
 * call still resumes a later one on the same thread.
 */
public final class ParkingWaker implements Waker {
    private static final ThreadLocal<ParkingWaker> CURRENT = ThreadLocal.withInitial(() -> new ParkingWaker(
                                                                                                Thread.currentThread()));

    public static ParkingWaker current() {
        return CURRENT.get();
    }

    private final AtomicBoolean notified = new AtomicBoolean();
    private final Thread        thread;

    private ParkingWaker(Thread thread) {
        this.thread = thread;
    }

    /**
     * Park the bound thread until woken.
     */
    public void park() throws InterruptedException {
        checkCaller();
        while (!notified.getAndSet(false)) {
            LockSupport.park(this);
            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
        }
    }

    /**
     * Park the bound thread until woken or until the timeout elapses.
     *
     * @return true if woken, false if the timeout elapsed first
     */
    public boolean parkNanos(long nanos) throws InterruptedException {
        checkCaller();
        final long deadline = System.nanoTime() + nanos;
        while (!notified.getAndSet(false)) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            LockSupport.parkNanos(this, remaining);
            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "ParkingWaker[" + thread.getName() + "]";
    }

    @Override
    public void wake() {
        if (notified.compareAndSet(false, true)) {
            LockSupport.unpark(thread);
        }
    }

    private void checkCaller() {
        if (Thread.currentThread() != thread) {
            throw new IllegalStateException("Only " + thread.getName() + " may park on this waker");
        }
    }
}
