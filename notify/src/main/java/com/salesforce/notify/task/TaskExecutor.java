/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.notify.task;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * A small host for {@link PollableFuture}s: spawned futures are polled on a pool of worker threads whenever they are
 * woken.
 */
public class TaskExecutor implements AutoCloseable {

    public record Parameters(String label, int workers, boolean daemon) {

        public static Builder newBuilder() {
            return new Builder();
        }

        public static class Builder {
            /**
             * Run worker threads as daemons
             */
            private boolean daemon  = true;
            /**
             * Prefix of worker thread names
             */
            private String  label   = "notify";
            /**
             * Number of worker threads
             */
            private int     workers = Runtime.getRuntime().availableProcessors();

            public Parameters build() {
                return new Parameters(label, workers, daemon);
            }

            public String getLabel() {
                return label;
            }

            public int getWorkers() {
                return workers;
            }

            public boolean isDaemon() {
                return daemon;
            }

            public Builder setDaemon(boolean daemon) {
                this.daemon = daemon;
                return this;
            }

            public Builder setLabel(String label) {
                this.label = Objects.requireNonNull(label);
                return this;
            }

            public Builder setWorkers(int workers) {
                if (workers < 1) {
                    throw new IllegalArgumentException("Workers must be positive: " + workers);
                }
                this.workers = workers;
                return this;
            }
        }
    }

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final Set<Task<?>>             live    = ConcurrentHashMap.newKeySet();
    private final Parameters               parameters;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong               spawned = new AtomicLong();

    public TaskExecutor() {
        this(Parameters.newBuilder().build());
    }

    public TaskExecutor(Parameters parameters) {
        this.parameters = parameters;
        var threads = new ThreadFactoryBuilder().setNameFormat(parameters.label() + "-%d")
                                                .setDaemon(parameters.daemon())
                                                .setUncaughtExceptionHandler((t, e) -> log.error("Uncaught exception on: {}",
                                                                                                 t.getName(), e))
                                                .build();
        var pool = new ScheduledThreadPoolExecutor(parameters.workers(), threads);
        pool.setRemoveOnCancelPolicy(true);
        this.scheduler = pool;
        log.debug("Started: {} with: {} workers", parameters.label(), parameters.workers());
    }

    /**
     * Stop the workers. Every task still running is cancelled, releasing its future; queued polls are discarded.
     */
    @Override
    public void close() {
        if (scheduler.isShutdown()) {
            return;
        }
        var pending = scheduler.shutdownNow();
        var dropped = live.size();
        live.forEach(Task::cancel);
        log.debug("Stopped: {}, cancelled: {} tasks, dropped: {} pending polls", parameters.label(), dropped,
                  pending.size());
    }

    public boolean isClosed() {
        return scheduler.isShutdown();
    }

    /**
     * Run a plain action once the delay has elapsed.
     */
    public ScheduledFuture<?> schedule(Runnable action, Duration delay) {
        return scheduler.schedule(action, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Spawn the future. Cancelling the answered future, or closing this executor, stops polling and closes the
     * spawned future if it is {@link AutoCloseable}.
     */
    public <T> ListenableFuture<T> spawn(PollableFuture<T> future) {
        Objects.requireNonNull(future, "future");
        var task = new Task<>(parameters.label() + ":" + spawned.incrementAndGet(), future, scheduler);
        live.add(task);
        task.result().addListener(() -> live.remove(task), MoreExecutors.directExecutor());
        task.schedule();
        return task.result();
    }
}
