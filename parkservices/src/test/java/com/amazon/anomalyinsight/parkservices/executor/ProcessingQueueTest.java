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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class ProcessingQueueTest {

    private ProcessingQueue<Integer, Integer> queue;

    @AfterEach
    public void tearDown() {
        if (queue != null) {
            queue.shutdown();
        }
    }

    @Test
    public void testItemsAreProcessedInOrder() throws Exception {
        List<Integer> seen = new ArrayList<>();
        queue = new ProcessingQueue<>(100, 8, 1, item -> {
            seen.add(item);
            return item * 2;
        });
        queue.start();

        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            futures.add(queue.submit(i));
        }
        for (int i = 0; i < 50; i++) {
            assertEquals(2 * i, futures.get(i).get(5, TimeUnit.SECONDS));
        }
        for (int i = 0; i < 50; i++) {
            assertEquals(i, seen.get(i));
        }
    }

    @Test
    public void testFullQueueRejects() {
        queue = new ProcessingQueue<>(2, 2, 60_000, item -> item);
        queue.start();
        queue.submit(1);
        queue.submit(2);

        assertThrows(RejectedExecutionException.class, () -> queue.submit(3));
        assertEquals(2, queue.size());
    }

    @Test
    public void testSubmitBeforeStartRejects() {
        queue = new ProcessingQueue<>(2, 2, item -> item);
        assertThrows(RejectedExecutionException.class, () -> queue.submit(1));
    }

    @Test
    public void testShutdownCompletesQueuedItems() throws Exception {
        queue = new ProcessingQueue<>(100, 3, 60_000, item -> item + 1);
        queue.start();
        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            futures.add(queue.submit(i));
        }

        queue.shutdown();

        for (int i = 0; i < 10; i++) {
            assertTrue(futures.get(i).isDone());
            assertEquals(i + 1, futures.get(i).get());
        }
        assertEquals(0, queue.size());
        assertThrows(RejectedExecutionException.class, () -> queue.submit(11));
    }

    @Test
    public void testHandlerFailureCompletesExceptionally() {
        queue = new ProcessingQueue<>(10, 10, 60_000, item -> {
            if (item < 0) {
                throw new IllegalArgumentException("negative");
            }
            return item;
        });
        queue.start();
        CompletableFuture<Integer> bad = queue.submit(-1);
        CompletableFuture<Integer> good = queue.submit(1);

        assertEquals(2, queue.drain());

        ExecutionException exception = assertThrows(ExecutionException.class, bad::get);
        assertTrue(exception.getCause() instanceof IllegalArgumentException);
        assertEquals(1, good.join());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ProcessingQueue<Integer, Integer>(0, 1, i -> i));
        assertThrows(IllegalArgumentException.class, () -> new ProcessingQueue<Integer, Integer>(1, 0, i -> i));
        assertThrows(NullPointerException.class, () -> new ProcessingQueue<Integer, Integer>(1, 1, null));
    }
}
