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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazon.spikesort.cutoff.CutoffEstimate;
import com.amazon.spikesort.merge.MergeRecord;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * The frozen result of manual merging. Final cluster ids run from 1 to
 * {@code K} in ascending order of waveform RMS; id 0 marks rejected spikes.
 */
@Getter
public class FinalClustering {

    @Getter(AccessLevel.NONE)
    private final int[] idMap;
    @Getter(AccessLevel.NONE)
    private final int[] assignment;
    private final List<ClusterSummary> clusters;
    private final CutoffEstimate cutoff;
    private final List<MergeRecord> history;
    private final List<Integer> rejected;

    public FinalClustering(int[] idMap, int[] assignment, List<ClusterSummary> clusters, CutoffEstimate cutoff,
            List<MergeRecord> history, List<Integer> rejected) {
        this.idMap = idMap.clone();
        this.assignment = assignment.clone();
        this.clusters = Collections.unmodifiableList(new ArrayList<>(clusters));
        this.cutoff = cutoff;
        this.history = Collections.unmodifiableList(new ArrayList<>(history));
        this.rejected = Collections.unmodifiableList(new ArrayList<>(rejected));
    }

    /**
     * @return the final id of every initial cluster id; merged-away clusters map
     *         to the final id of their survivor
     */
    public int[] getIdMap() {
        return idMap.clone();
    }

    /**
     * @return the final id of every spike
     */
    public int[] getAssignment() {
        return assignment.clone();
    }

    public int getNumberOfClusters() {
        return clusters.size();
    }
}
