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

package com.amazon.spikesort.executor;

import static com.amazon.spikesort.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Processes electrodes in parallel in a private thread pool. Parallel streams
 * started by a task, such as energy or bootstrap computations, run in the same
 * pool.
 */
public class ParallelElectrodeExecutor extends AbstractElectrodeExecutor {

    private final ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelElectrodeExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public <I, R> List<R> map(List<I> inputs, Function<I, R> task) {
        return submitAndJoin(() -> inputs.parallelStream().map(task).collect(Collectors.toList()));
    }

    @Override
    public boolean isParallel() {
        return true;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return forkJoinPool.submit(callable).join();
    }
}
