/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalyinsight.parkservices.executor;

import static com.amazon.anomalyinsight.CommonUtils.checkArgument;
import static com.amazon.anomalyinsight.CommonUtils.checkNotNull;
import static com.amazon.anomalyinsight.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A bounded queue drained by a single scheduled worker. Every submitted item is
 * handed to the handler exactly once and its future is completed with the
 * result, or exceptionally with what the handler threw. {@link #shutdown()}
 * stops accepting items and processes everything already queued before it
 * returns.
 *
 * @param <T> item type
 * @param <R> result type
 */
public class ProcessingQueue<T, R> {

    private static final Logger logger = LogManager.getLogger(ProcessingQueue.class);

    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 10;

    public static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ArrayBlockingQueue<PendingItem<T, R>> queue;

    private final int batchSize;

    private final long pollIntervalMillis;

    private final Function<T, R> handler;

    private final Object submitLock = new Object();

    private ScheduledExecutorService worker;

    private boolean accepting;

    public ProcessingQueue(int capacity, int batchSize, Function<T, R> handler) {
        this(capacity, batchSize, DEFAULT_POLL_INTERVAL_MILLIS, handler);
    }

    public ProcessingQueue(int capacity, int batchSize, long pollIntervalMillis, Function<T, R> handler) {
        checkArgument(capacity > 0, "capacity must be greater than 0");
        checkArgument(batchSize > 0, "batchSize must be greater than 0");
        checkArgument(pollIntervalMillis > 0, "pollIntervalMillis must be greater than 0");
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.batchSize = batchSize;
        this.pollIntervalMillis = pollIntervalMillis;
        this.handler = checkNotNull(handler, "handler must not be null");
    }

    public void start() {
        synchronized (submitLock) {
            checkState(worker == null, "queue already started");
            worker = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "anomaly-processing-queue");
                thread.setDaemon(true);
                return thread;
            });
            worker.scheduleWithFixedDelay(this::drainSafely, pollIntervalMillis, pollIntervalMillis,
                    TimeUnit.MILLISECONDS);
            accepting = true;
        }
    }

    /**
     * @param item the item to process
     * @return a future completed once the worker has processed the item
     * @throws RejectedExecutionException if the queue is full or shut down
     */
    public CompletableFuture<R> submit(T item) {
        checkNotNull(item, "item must not be null");
        PendingItem<T, R> pending = new PendingItem<>(item);
        synchronized (submitLock) {
            if (!accepting) {
                throw new RejectedExecutionException("Processing queue is not accepting items");
            }
            if (!queue.offer(pending)) {
                throw new RejectedExecutionException("Processing queue is full");
            }
        }
        return pending.future;
    }

    public int size() {
        return queue.size();
    }

    /**
     * Stops accepting items, waits for the worker and processes what is left on
     * the calling thread.
     */
    public void shutdown() {
        ScheduledExecutorService current;
        synchronized (submitLock) {
            accepting = false;
            current = worker;
            worker = null;
        }
        if (current != null) {
            current.shutdown();
            try {
                if (!current.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("Processing queue worker did not stop within {} seconds", SHUTDOWN_TIMEOUT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for the processing queue worker", e);
            }
        }
        int drained = 0;
        while (!queue.isEmpty()) {
            drained += drain();
        }
        if (drained > 0) {
            logger.info("Processed {} queued items during shutdown", drained);
        }
    }

    private void drainSafely() {
        try {
            drain();
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            logger.error("Processing queue worker failed", e);
        }
    }

    /**
     * @return the number of items processed
     */
    synchronized int drain() {
        List<PendingItem<T, R>> batch = new ArrayList<>(batchSize);
        queue.drainTo(batch, batchSize);
        for (PendingItem<T, R> pending : batch) {
            try {
                pending.future.complete(handler.apply(pending.item));
            } catch (RuntimeException e) {
                pending.future.completeExceptionally(e);
            }
        }
        return batch.size();
    }

    private static class PendingItem<T, R> {

        private final T item;

        private final CompletableFuture<R> future = new CompletableFuture<>();

        PendingItem(T item) {
            this.item = item;
        }
    }
}
