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
import static com.amazon.anomalyinsight.CommonUtils.checkState;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Processes the items of a batch on a private fork-join pool. The pool is not
 * recreated once the executor was shut down.
 */
public class ParallelBatchExecutor extends AbstractBatchExecutor {

    private ForkJoinPool forkJoinPool;

    private final int threadPoolSize;

    public ParallelBatchExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public <T, R> List<R> execute(List<T> items, Function<T, R> task) {
        return submitAndJoin(() -> items.parallelStream().map(task).collect(Collectors.toList()));
    }

    @Override
    public synchronized void shutdown() {
        if (forkJoinPool != null) {
            forkJoinPool.shutdown();
            forkJoinPool = null;
        }
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public synchronized boolean isShutdown() {
        return forkJoinPool == null;
    }

    private synchronized ForkJoinPool pool() {
        checkState(forkJoinPool != null, "executor has been shut down");
        return forkJoinPool;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return pool().submit(callable).join();
    }
}
