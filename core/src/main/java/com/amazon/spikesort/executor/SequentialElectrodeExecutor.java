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
import java.util.stream.Collectors;

/**
 * Processes electrodes one after another on the calling thread.
 */
public class SequentialElectrodeExecutor extends AbstractElectrodeExecutor {

    @Override
    public <I, R> List<R> map(List<I> inputs, Function<I, R> task) {
        return inputs.stream().map(task).collect(Collectors.toList());
    }

    @Override
    public boolean isParallel() {
        return false;
    }
}
