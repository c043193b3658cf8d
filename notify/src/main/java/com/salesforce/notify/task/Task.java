/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify.task;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;

/**
 * A future spawned on an executor. The task is polled on the executor each time its waker fires; the result is
 * published through a {@link ListenableFuture}.
 */
final class Task<T> implements Runnable {
    private static final int    AWOKEN  = 2;
    private static final Logger log     = LoggerFactory.getLogger(Task.class);
    private static final int    POLLING = 1;
    private static final int    WAITING = 0;

    private final AtomicBoolean     complete = new AtomicBoolean();
    private final Executor          executor;
    private final PollableFuture<T> future;
    private final String            label;
    private final SettableFuture<T> result   = SettableFuture.create();
    private final AtomicInteger     state    = new AtomicInteger(AWOKEN);
    private final Waker             waker;

    Task(String label, PollableFuture<T> future, Executor executor) {
        this.label = label;
        this.future = future;
        this.executor = executor;
        this.waker = new Waker() {
            @Override
            public String toString() {
                return "TaskWaker[" + label + "]";
            }

            @Override
            public void wake() {
                // only schedule if nobody else will; a wake during a poll is picked up when that poll finishes
                if (state.getAndSet(AWOKEN) == WAITING) {
                    schedule();
                }
            }
        };
        result.addListener(() -> {
            if (result.isCancelled()) {
                log.trace("Task: {} cancelled", label);
                finish();
            }
        }, MoreExecutors.directExecutor());
    }

    /**
     * Drop the task: its result is cancelled and its future released, whether or not a poll is queued.
     */
    public void cancel() {
        result.cancel(false);
    }

    public ListenableFuture<T> result() {
        return result;
    }

    @Override
    public void run() {
        if (complete.get()) {
            return;
        }
        state.set(POLLING);
        Poll<T> poll;
        try {
            poll = future.poll(waker);
        } catch (Throwable t) {
            if (finish()) {
                log.error("Task: {} failed", label, t);
            } else {
                log.trace("Task: {} failed after completion", label, t);
            }
            result.setException(t);
            return;
        }
        if (poll.isReady()) {
            finish();
            result.set(poll.get());
            return;
        }
        if (!state.compareAndSet(POLLING, WAITING)) {
            // woken while polling
            schedule();
        }
    }

    @Override
    public String toString() {
        return "Task[" + label + "]";
    }

    void schedule() {
        if (complete.get()) {
            return;
        }
        try {
            executor.execute(this);
        } catch (RejectedExecutionException e) {
            log.debug("Task: {} rejected by executor", label);
            finish();
            result.setException(e);
        }
    }

    /**
     * Mark the task complete, releasing the future. Dropping a task drops its future, so a closeable future is
     * closed here.
     *
     * @return true if this call completed the task
     */
    private boolean finish() {
        if (!complete.compareAndSet(false, true)) {
            return false;
        }
        if (future instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing future of task: {}", label, e);
            }
        }
        return true;
    }
}
