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

package com.amazon.spikesort.cluster;

import static com.amazon.spikesort.CommonUtils.checkArgument;
import static com.amazon.spikesort.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;

/**
 * The over-segmented clustering of one electrode. Cluster ids are dense,
 * {@code 0 .. numberOfClusters - 1}, and every cluster has at least one spike.
 */
@Getter
public class InitialClustering {

    private final int[] assignment;
    private final int[] sizes;
    private final double scale;

    public InitialClustering(int[] assignment, int[] sizes, double scale) {
        checkNotNull(assignment, "assignment must not be null");
        checkNotNull(sizes, "sizes must not be null");
        checkArgument(scale > 0 && Double.isFinite(scale), "scale must be positive and finite");
        int[] counts = new int[sizes.length];
        for (int cluster : assignment) {
            checkArgument(cluster >= 0 && cluster < sizes.length, "cluster id out of range");
            counts[cluster]++;
        }
        checkArgument(Arrays.equals(counts, sizes), "sizes do not match the assignment");
        this.assignment = assignment.clone();
        this.sizes = sizes.clone();
        this.scale = scale;
    }

    public int getNumberOfClusters() {
        return sizes.length;
    }

    public int getNumberOfSpikes() {
        return assignment.length;
    }
}
