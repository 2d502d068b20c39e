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

import java.util.List;
import java.util.function.Function;

/**
 * Applies a task to every item of a batch. Implementations differ in how the
 * work is scheduled but always return the results in the order of the items.
 */
public abstract class AbstractBatchExecutor {

    /**
     * @param items the batch
     * @param task  the work for one item
     * @param <T>   item type
     * @param <R>   result type
     * @return one result per item, in item order
     */
    public abstract <T, R> List<R> execute(List<T> items, Function<T, R> task);

    /**
     * Releases any threads held by the executor.
     */
    public void shutdown() {
    }
}
