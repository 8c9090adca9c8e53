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

import java.util.List;

import com.amazon.spikesort.cutoff.CutoffEstimate;
import com.amazon.spikesort.energy.TriangularMatrix;
import com.amazon.spikesort.merge.MergeRecord;
import com.amazon.spikesort.merge.MergeState;

import lombok.Getter;

/**
 * Read-only view of a manual merging session after a command. The
 * {@code revision} identifies the view: commands issued with it are refused
 * once the session has moved on.
 */
@Getter
public class MergeSnapshot {

    private final long revision;
    private final TriangularMatrix energy;
    private final TriangularMatrix strength;
    private final int[] sizes;
    private final int[] assignment;
    private final int[] liveClusters;
    private final List<MergeRecord> history;
    private final List<Integer> rejected;
    private final CutoffEstimate cutoff;
    private final boolean finalized;

    MergeSnapshot(long revision, MergeState state, CutoffEstimate cutoff, boolean finalized) {
        this.revision = revision;
        this.energy = state.getEnergy();
        this.strength = state.getStrength();
        this.sizes = state.getSizes();
        this.assignment = state.getAssignment();
        this.liveClusters = state.getLiveClusters();
        this.history = state.getHistory();
        this.rejected = state.getRejected();
        this.cutoff = cutoff;
        this.finalized = finalized;
    }

    public int getLiveCount() {
        return liveClusters.length;
    }
}
