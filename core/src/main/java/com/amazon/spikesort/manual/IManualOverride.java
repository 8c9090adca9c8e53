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

package com.amazon.spikesort.manual;

import java.util.Optional;

import com.amazon.spikesort.config.ResetMode;
import com.amazon.spikesort.merge.ClusterPair;

/**
 * Commands a human reviewer can apply to the clusters of one electrode. Each
 * command is applied atomically and returns the resulting state.
 */
public interface IManualOverride {

    MergeSnapshot reset(ResetMode mode);

    /**
     * Replays automated merging from the initial clusters up to a new cutoff.
     *
     * @param cutoff a connection strength in [0, 1]
     * @return the resulting state
     */
    MergeSnapshot setCutoff(double cutoff);

    MergeSnapshot merge(int a, int b);

    MergeSnapshot merge(long revision, int a, int b);

    MergeSnapshot reject(int a);

    MergeSnapshot reject(long revision, int a);

    MergeSnapshot current();

    /**
     * @return the live pair automated merging would take next
     */
    Optional<ClusterPair> suggest();

    /**
     * @param selected a live cluster
     * @return the live cluster most strongly connected to {@code selected}
     */
    Optional<ClusterPair> suggest(int selected);

    /**
     * Freezes the session until the next reset or cutoff change and renumbers
     * the surviving clusters.
     *
     * @return the final clustering
     */
    FinalClustering finalizeClusters();
}
