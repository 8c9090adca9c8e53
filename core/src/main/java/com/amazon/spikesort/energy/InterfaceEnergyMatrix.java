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

import static com.amazon.spikesort.CommonUtils.checkArgument;
import static com.amazon.spikesort.CommonUtils.checkNotNull;
import static com.amazon.spikesort.CommonUtils.euclideanDistance;

import java.util.stream.IntStream;

/**
 * Raw interface energy between spike clusters (Fee et al. 1996). The energy of
 * two distinct clusters is the sum, over every pair of spikes taken one from
 * each, of {@code exp(-distance / scale)}. The self energy of a cluster sums the
 * same kernel over its unordered pairs of distinct spikes, which equals the sum
 * over all ordered pairs minus the {@code n} zero-distance terms, halved.
 *
 * Energies are kept raw, not normalized, because raw energies of a merged
 * cluster are sums of the energies of its parts.
 */
public class InterfaceEnergyMatrix {

    private InterfaceEnergyMatrix() {
    }

    /**
     * Computes the energy matrix of a clustering. Spikes with a negative cluster
     * id are ignored, and clusters without spikes get zero rows.
     *
     * @param features   spike-major feature matrix
     * @param assignment cluster id of every spike
     * @param clusters   number of cluster ids
     * @param scale      the kernel scale
     * @param parallel   whether cluster pairs are evaluated in parallel
     * @return the energy matrix
     */
    public static TriangularMatrix compute(double[][] features, int[] assignment, int clusters, double scale,
            boolean parallel) {
        checkNotNull(features, "features must not be null");
        checkNotNull(assignment, "assignment must not be null");
        checkArgument(features.length == assignment.length, "one cluster id is needed per spike");
        checkArgument(clusters > 0, "clusters must be greater than 0");
        checkArgument(scale > 0, "scale must be positive");

        double[][][] groups = group(features, assignment, clusters);
        int cells = TriangularMatrix.cells(clusters);
        int[] rows = new int[cells];
        int[] cols = new int[cells];
        int p = 0;
        for (int i = 0; i < clusters; i++) {
            for (int j = i; j < clusters; j++) {
                rows[p] = i;
                cols[p] = j;
                p++;
            }
        }

        double[] values = new double[cells];
        IntStream pairs = IntStream.range(0, cells);
        if (parallel) {
            pairs = pairs.parallel();
        }
        // each task writes only its own cell
        pairs.forEach(k -> values[k] = (rows[k] == cols[k]) ? selfEnergy(groups[rows[k]], scale)
                : energy(groups[rows[k]], groups[cols[k]], scale));
        return new TriangularMatrix(clusters, values);
    }

    /**
     * Sum of the kernel over all pairs of spikes taken one from each group.
     */
    public static double energy(double[][] first, double[][] second, double scale) {
        double sum = 0;
        for (double[] a : first) {
            for (double[] b : second) {
                sum += Math.exp(-euclideanDistance(a, b) / scale);
            }
        }
        return sum;
    }

    /**
     * Sum of the kernel over the unordered pairs of distinct spikes of a group.
     */
    public static double selfEnergy(double[][] group, double scale) {
        double sum = 0;
        for (int a = 0; a < group.length; a++) {
            for (int b = a + 1; b < group.length; b++) {
                sum += Math.exp(-euclideanDistance(group[a], group[b]) / scale);
            }
        }
        return sum;
    }

    static double[][][] group(double[][] features, int[] assignment, int clusters) {
        int[] counts = new int[clusters];
        for (int cluster : assignment) {
            checkArgument(cluster < clusters, "cluster id out of range");
            if (cluster >= 0) {
                counts[cluster]++;
            }
        }
        double[][][] groups = new double[clusters][][];
        for (int c = 0; c < clusters; c++) {
            groups[c] = new double[counts[c]][];
        }
        int[] filled = new int[clusters];
        for (int s = 0; s < assignment.length; s++) {
            int cluster = assignment[s];
            if (cluster >= 0) {
                groups[cluster][filled[cluster]++] = features[s];
            }
        }
        return groups;
    }
}
