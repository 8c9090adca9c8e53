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

package com.amazon.spikesort.energy;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Two disjoint, aligned sets of packed cells of a {@link TriangularMatrix}:
 * {@code survivor[m]} is cell {@code (low, others[m])} and {@code absorbed[m]}
 * is cell {@code (high, others[m])}.
 */
@Getter
@AllArgsConstructor
public class MergeIndexSets {

    private final int low;
    private final int high;
    private final int[] others;
    private final int[] survivor;
    private final int[] absorbed;

    public int size() {
        return others.length;
    }
}
