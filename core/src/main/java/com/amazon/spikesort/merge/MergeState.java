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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazon.spikesort.connection.ConnectionStrengthNormalizer;
import com.amazon.spikesort.energy.TriangularMatrix;

/**
 * The working state of cluster merging on one electrode: raw interface energy,
 * connection strength, cluster sizes, the cluster of every spike and the merge
 * history. Cluster ids are fixed at creation. A cluster is live while it has
 * spikes; merged-away and rejected clusters keep their id with a zero size and
 * nulled matrix rows.
 *
 * Every mutation checks its arguments before touching anything and increments
 * the revision. The class is not thread safe.
 */
public class MergeState {

    /**
     * Cluster id of the spikes of a rejected cluster.
     */
    public static final int REJECTED = -1;

    private final TriangularMatrix energy;
    private final TriangularMatrix strength;
    private final int[] sizes;
    private final int[] assignment;
    private final List<MergeRecord> history;
    private final List<Integer> rejected;
    private long revision;
    private int liveCount;

    private MergeState(TriangularMatrix energy, TriangularMatrix strength, int[] sizes, int[] assignment,
            List<MergeRecord> history, List<Integer> rejected, long revision) {
        this.energy = energy;
        this.strength = strength;
        this.sizes = sizes;
        this.assignment = assignment;
        this.history = history;
        this.rejected = rejected;
        this.revision = revision;
        for (int size : sizes) {
            if (size > 0) {
                liveCount++;
            }
        }
    }

    /**
     * Creates the state of an unmerged clustering and computes its connection
     * strengths.
     *
     * @param energy     raw interface energy, copied
     * @param sizes      spikes per cluster, copied
     * @param assignment cluster id of every spike, copied
     * @return the initial state
     */
    public static MergeState initial(TriangularMatrix energy, int[] sizes, int[] assignment) {
        checkNotNull(energy, "energy must not be null");
        checkNotNull(sizes, "sizes must not be null");
        checkNotNull(assignment, "assignment must not be null");
        checkArgument(energy.size() == sizes.length, "one size is needed per cluster");
        int[] counts = new int[sizes.length];
        for (int cluster : assignment) {
            checkArgument(cluster == REJECTED || (cluster >= 0 && cluster < sizes.length), "cluster id out of range");
            if (cluster >= 0) {
                counts[cluster]++;
            }
        }
        for (int c = 0; c < sizes.length; c++) {
            checkArgument(counts[c] == sizes[c], "sizes do not match the assignment");
        }
        TriangularMatrix e = new TriangularMatrix(energy);
        int[] n = sizes.clone();
        return new MergeState(e, ConnectionStrengthNormalizer.compute(e, n), n, assignment.clone(),
                new ArrayList<>(), new ArrayList<>(), 0);
    }

    /**
     * @return an independent copy, revision included
     */
    public MergeState copy() {
        return new MergeState(new TriangularMatrix(energy), new TriangularMatrix(strength), sizes.clone(),
                assignment.clone(), new ArrayList<>(history), new ArrayList<>(rejected), revision);
    }

    /**
     * Merges two live clusters. The larger id is absorbed into the smaller one;
     * its energy row is added to the survivor's and then nulled, and only the
     * survivor's row of connection strength is recomputed.
     *
     * @param a a live cluster
     * @param b another live cluster
     * @return the record of the merge
     * @throws StaleReferenceException if either cluster is not live
     */
    public MergeRecord merge(int a, int b) {
        checkArgument(a != b, "a cluster cannot be merged with itself");
        checkLive(a);
        checkLive(b);
        int low = Math.min(a, b);
        int high = Math.max(a, b);

        sizes[low] += sizes[high];
        energy.add(low, low, energy.get(high, high) + energy.get(low, high));
        energy.accumulate(energy.mergeIndexSets(low, high));
        energy.fillRowAndColumn(high, 0, 0);
        strength.fillRowAndColumn(high, 0, 1);
        sizes[high] = 0;
        ConnectionStrengthNormalizer.refresh(strength, energy, sizes, low);

        MergeRecord record = new MergeRecord(low, high);
        history.add(record);
        for (int s = 0; s < assignment.length; s++) {
            if (assignment[s] == high) {
                assignment[s] = low;
            }
        }
        liveCount--;
        revision++;
        return record;
    }

    /**
     * Removes a live cluster: its rows are nulled so it can never be merged
     * again, and its spikes get the id {@link #REJECTED}.
     *
     * @param a a live cluster
     * @throws StaleReferenceException if the cluster is not live
     */
    public void reject(int a) {
        checkLive(a);
        energy.fillRowAndColumn(a, 0, 0);
        strength.fillRowAndColumn(a, 0, 1);
        sizes[a] = 0;
        for (int s = 0; s < assignment.length; s++) {
            if (assignment[s] == a) {
                assignment[s] = REJECTED;
            }
        }
        rejected.add(a);
        liveCount--;
        revision++;
    }

    public boolean isLive(int cluster) {
        return cluster >= 0 && cluster < sizes.length && sizes[cluster] > 0;
    }

    private void checkLive(int cluster) {
        if (!isLive(cluster)) {
            throw new StaleReferenceException("cluster " + cluster + " is not live");
        }
    }

    public int getNumberOfClusters() {
        return sizes.length;
    }

    public int getLiveCount() {
        return liveCount;
    }

    public long getRevision() {
        return revision;
    }

    public int getSize(int cluster) {
        return sizes[cluster];
    }

    /**
     * @return the live cluster ids, ascending
     */
    public int[] getLiveClusters() {
        int[] live = new int[liveCount];
        int p = 0;
        for (int c = 0; c < sizes.length; c++) {
            if (sizes[c] > 0) {
                live[p++] = c;
            }
        }
        return live;
    }

    public int[] getSizes() {
        return sizes.clone();
    }

    public int[] getAssignment() {
        return assignment.clone();
    }

    public TriangularMatrix getEnergy() {
        return new TriangularMatrix(energy);
    }

    public TriangularMatrix getStrength() {
        return new TriangularMatrix(strength);
    }

    public List<MergeRecord> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public List<Integer> getRejected() {
        return Collections.unmodifiableList(new ArrayList<>(rejected));
    }

    // read without copying, for the merge search
    double strength(int i, int j) {
        return strength.get(i, j);
    }
}
