/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify.task;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TaskExecutorTest {

    private static class CloseableFuture implements PollableFuture<String>, AutoCloseable {
        private final AtomicInteger closed = new AtomicInteger();
        private final boolean       ready;

        CloseableFuture() {
            this(true);
        }

        CloseableFuture(boolean ready) {
            this.ready = ready;
        }

        @Override
        public void close() {
            closed.incrementAndGet();
        }

        @Override
        public Poll<String> poll(Waker waker) {
            return ready ? Poll.ready("closeable") : Poll.pending();
        }
    }

    private TaskExecutor executor;

    @AfterEach
    public void after() {
        executor.close();
    }

    @BeforeEach
    public void before() {
        executor = new TaskExecutor(TaskExecutor.Parameters.newBuilder().setLabel("task-test").setWorkers(3).build());
    }

    @Test
    public void closeableFutureIsClosedOnCompletion() throws Exception {
        var future = new CloseableFuture();
        assertThat(executor.spawn(future).get(5, TimeUnit.SECONDS), is(equalTo("closeable")));
        assertThat(future.closed.get(), is(equalTo(1)));
    }

    @Test
    public void closeCancelsLiveTasks() throws Exception {
        var waiting = new CloseableFuture(false);
        var suspended = executor.spawn(waiting);
        // let the first poll run, leaving the task waiting for a wake that never comes
        Thread.sleep(50);

        var single = new TaskExecutor(TaskExecutor.Parameters.newBuilder().setLabel("single").setWorkers(1).build());
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        single.spawn(waker -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Poll.pending();
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        var queued = new CloseableFuture(false);
        var neverPolled = single.spawn(queued);

        single.close();
        executor.close();

        assertTrue(neverPolled.isCancelled());
        assertThat(queued.closed.get(), is(equalTo(1)));
        assertTrue(suspended.isCancelled());
        assertThat(waiting.closed.get(), is(equalTo(1)));
        release.countDown();
    }

    @Test
    public void closedExecutorRejects() {
        executor.close();
        assertTrue(executor.isClosed());
        var result = executor.spawn(waker -> Poll.ready(1));
        var e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertThat(e.getCause(), instanceOf(RejectedExecutionException.class));
    }

    @Test
    public void failingFutureFailsResult() {
        var result = executor.spawn(waker -> {
            throw new IllegalArgumentException("bad");
        });
        var e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertThat(e.getCause(), instanceOf(IllegalArgumentException.class));
    }

    @Test
    public void invalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> TaskExecutor.Parameters.newBuilder().setWorkers(0));
    }

    @Test
    public void wakeDuringPollIsNotLost() throws Exception {
        var polls = new AtomicInteger();
        // wakes itself while still being polled, so every wake races the end of a poll
        var result = executor.spawn(waker -> {
            if (polls.incrementAndGet() < 100) {
                waker.wake();
                return Poll.pending();
            }
            return Poll.ready(polls.get());
        });
        assertThat(result.get(5, TimeUnit.SECONDS), is(equalTo(100)));
    }

    @Test
    public void pollsAreNotConcurrent() throws Exception {
        var polling = new AtomicBoolean();
        var overlapped = new AtomicBoolean();
        var polls = new AtomicInteger();
        var waking = new CountDownLatch(1);
        var result = executor.spawn(waker -> {
            if (!polling.compareAndSet(false, true)) {
                overlapped.set(true);
            }
            try {
                if (polls.incrementAndGet() == 1) {
                    // hammer the waker from another thread while polls run
                    new Thread(() -> {
                        for (int i = 0; i < 1000; i++) {
                            waker.wake();
                        }
                        waking.countDown();
                        waker.wake();
                    }, "hammer").start();
                }
                if (waking.getCount() > 0 || polls.get() < 2) {
                    return Poll.pending();
                }
                return Poll.ready(true);
            } finally {
                polling.set(false);
            }
        });
        waking.await(5, TimeUnit.SECONDS);
        assertTrue(result.get(5, TimeUnit.SECONDS));
        assertThat(overlapped.get(), is(false));
    }
}
