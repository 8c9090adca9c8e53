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

package com.amazon.spikesort.merge;

import static com.amazon.spikesort.CommonUtils.checkArgument;
import static com.amazon.spikesort.CommonUtils.checkNotNull;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy agglomeration of clusters by connection strength. Each step merges
 * the live pair with the strongest connection, as long as that strength is at
 * least the cutoff. Among equally strong pairs the lowest {@code (low, high)}
 * in lexicographic order wins.
 */
public class MergeEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MergeEngine.class);

    private MergeEngine() {
    }

    /**
     * @param state the working state
     * @return the strongest live pair, empty when fewer than two clusters are
     *         live
     */
    public static Optional<ClusterPair> strongestPair(MergeState state) {
        checkNotNull(state, "state must not be null");
        int[] live = state.getLiveClusters();
        ClusterPair best = null;
        for (int a = 0; a < live.length; a++) {
            for (int b = a + 1; b < live.length; b++) {
                double value = state.strength(live[a], live[b]);
                if (best == null || value > best.getStrength()) {
                    best = new ClusterPair(live[a], live[b], value);
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * @param state    the working state
     * @param selected a live cluster
     * @return the live cluster most strongly connected to {@code selected}, empty
     *         when it is the only live cluster
     * @throws StaleReferenceException if {@code selected} is not live
     */
    public static Optional<ClusterPair> strongestPartner(MergeState state, int selected) {
        checkNotNull(state, "state must not be null");
        if (!state.isLive(selected)) {
            throw new StaleReferenceException("cluster " + selected + " is not live");
        }
        ClusterPair best = null;
        for (int other : state.getLiveClusters()) {
            if (other == selected) {
                continue;
            }
            double value = state.strength(selected, other);
            if (best == null || value > best.getStrength()) {
                best = new ClusterPair(Math.min(selected, other), Math.max(selected, other), value);
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Applies at most one merge.
     *
     * @param state  the working state, updated in place
     * @param cutoff the smallest strength that is still merged
     * @return {@link MergeStatus#ACTIVE} if a merge was applied
     */
    public static MergeStatus step(MergeState state, double cutoff) {
        Optional<ClusterPair> best = strongestPair(state);
        if (!best.isPresent() || best.get().getStrength() < cutoff) {
            return MergeStatus.TERMINATED;
        }
        ClusterPair pair = best.get();
        state.merge(pair.getLow(), pair.getHigh());
        LOG.debug("merged cluster {} into {} at strength {}", pair.getHigh(), pair.getLow(), pair.getStrength());
        return MergeStatus.ACTIVE;
    }

    /**
     * Merges until no live pair reaches the cutoff. Runs at most one step fewer
     * than there are cluster ids.
     *
     * @param state  the working state, updated in place
     * @param cutoff the smallest strength that is still merged
     * @return the number of merges applied
     */
    public static int run(MergeState state, double cutoff) {
        checkNotNull(state, "state must not be null");
        checkArgument(!Double.isNaN(cutoff), "cutoff must be a number");
        int bound = state.getNumberOfClusters() - 1;
        int merges = 0;
        while (merges < bound && step(state, cutoff) == MergeStatus.ACTIVE) {
            merges++;
        }
        return merges;
    }
}
