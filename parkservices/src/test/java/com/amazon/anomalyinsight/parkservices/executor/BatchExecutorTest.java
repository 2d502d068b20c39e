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
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class BatchExecutorTest {

    static Stream<AbstractBatchExecutor> executors() {
        return Stream.of(new SequentialBatchExecutor(), new ParallelBatchExecutor(4));
    }

    @ParameterizedTest
    @MethodSource("executors")
    public void testResultsKeepItemOrder(AbstractBatchExecutor executor) {
        List<Integer> items = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            items.add(i);
        }
        List<String> results = executor.execute(items, i -> "item-" + i);

        assertEquals(items.size(), results.size());
        for (int i = 0; i < items.size(); i++) {
            assertEquals("item-" + i, results.get(i));
        }
        executor.shutdown();
    }

    @ParameterizedTest
    @MethodSource("executors")
    public void testEmptyBatch(AbstractBatchExecutor executor) {
        assertEquals(Collections.emptyList(), executor.execute(Collections.<Integer>emptyList(), i -> i));
        executor.shutdown();
    }

    @Test
    public void testParallelExecutorRejectsWorkAfterShutdown() {
        ParallelBatchExecutor executor = new ParallelBatchExecutor(2);
        assertEquals(Collections.singletonList(4), executor.execute(Collections.singletonList(2), i -> i * i));
        executor.shutdown();
        executor.shutdown();

        assertTrue(executor.isShutdown());
        assertThrows(IllegalStateException.class,
                () -> executor.execute(Collections.singletonList(2), i -> i * i));
        assertEquals(2, executor.getThreadPoolSize());
    }

    @Test
    public void testInvalidPoolSize() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelBatchExecutor(0));
    }
}
