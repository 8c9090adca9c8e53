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

import java.util.List;
import java.util.function.Function;

/**
 * Applies a per-electrode task to a list of electrodes. Electrodes share no
 * mutable state, so the order in which tasks run does not matter; results are
 * always returned in input order.
 */
public abstract class AbstractElectrodeExecutor {

    /**
     * @param inputs one input per electrode
     * @param task   the work for one electrode
     * @param <I>    the input type
     * @param <R>    the result type
     * @return one result per input, in input order
     */
    public abstract <I, R> List<R> map(List<I> inputs, Function<I, R> task);

    /**
     * @return whether tasks run concurrently
     */
    public abstract boolean isParallel();
}
