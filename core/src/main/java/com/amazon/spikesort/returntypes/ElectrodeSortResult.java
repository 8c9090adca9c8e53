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

package com.amazon.spikesort.returntypes;

import static com.amazon.spikesort.CommonUtils.checkArgument;
import static com.amazon.spikesort.CommonUtils.checkNotNull;

import java.util.List;

import com.amazon.spikesort.cluster.InitialClustering;
import com.amazon.spikesort.cutoff.CutoffEstimate;
import com.amazon.spikesort.energy.TriangularMatrix;
import com.amazon.spikesort.merge.MergeRecord;
import com.amazon.spikesort.merge.MergeState;

import lombok.Getter;

/**
 * Automated sorting of one electrode: the initial clusters, the cutoff, and
 * the clusters left after merging everything connected at least as strongly
 * as the cutoff. Cluster ids of both clusterings index the initial clusters.
 */
public class ElectrodeSortResult {

    @Getter
    private final int electrodeId;
    @Getter
    private final double scale;
    @Getter
    private final CutoffEstimate cutoff;
    private final MergeState initialState;
    private final MergeState automatedState;

    public ElectrodeSortResult(int electrodeId, double scale, CutoffEstimate cutoff, MergeState initialState,
            MergeState automatedState) {
        checkNotNull(cutoff, "cutoff must not be null");
        checkNotNull(initialState, "initial state must not be null");
        checkNotNull(automatedState, "automated state must not be null");
        checkArgument(initialState.getNumberOfClusters() == automatedState.getNumberOfClusters(),
                "states must have the same clusters");
        this.electrodeId = electrodeId;
        this.scale = scale;
        this.cutoff = cutoff;
        this.initialState = initialState.copy();
        this.automatedState = automatedState.copy();
    }

    public ElectrodeSortResult(int electrodeId, InitialClustering clustering, CutoffEstimate cutoff,
            MergeState initialState, MergeState automatedState) {
        this(electrodeId, clustering.getScale(), cutoff, initialState, automatedState);
    }

    /**
     * @return a copy of the state before merging
     */
    public MergeState getInitialState() {
        return initialState.copy();
    }

    /**
     * @return a copy of the state after automated merging
     */
    public MergeState getAutomatedState() {
        return automatedState.copy();
    }

    public int getNumberOfInitialClusters() {
        return initialState.getNumberOfClusters();
    }

    public int getNumberOfClusters() {
        return automatedState.getLiveCount();
    }

    public TriangularMatrix getInitialEnergy() {
        return initialState.getEnergy();
    }

    public TriangularMatrix getEnergy() {
        return automatedState.getEnergy();
    }

    public int[] getInitialAssignment() {
        return initialState.getAssignment();
    }

    public int[] getAssignment() {
        return automatedState.getAssignment();
    }

    public int[] getInitialSizes() {
        return initialState.getSizes();
    }

    public int[] getSizes() {
        return automatedState.getSizes();
    }

    public List<MergeRecord> getHistory() {
        return automatedState.getHistory();
    }
}
