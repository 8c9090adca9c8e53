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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

public class ElectrodeExecutorTest {

    @Test
    public void testSequentialKeepsOrder() {
        SequentialElectrodeExecutor executor = new SequentialElectrodeExecutor();
        assertFalse(executor.isParallel());
        assertEquals(Arrays.asList(2, 4, 6), executor.map(Arrays.asList(1, 2, 3), x -> 2 * x));
    }

    @Test
    public void testParallelKeepsOrder() {
        ParallelElectrodeExecutor executor = new ParallelElectrodeExecutor(3);
        assertTrue(executor.isParallel());
        assertEquals(3, executor.getThreadPoolSize());

        List<Integer> inputs = IntStream.range(0, 100).boxed().collect(Collectors.toList());
        List<Integer> results = executor.map(inputs, x -> x * x);
        assertEquals(inputs.stream().map(x -> x * x).collect(Collectors.toList()), results);
    }

    @Test
    public void testInvalidPoolSize() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelElectrodeExecutor(0));
    }
}
