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

package com.amazon.spikesort.connection;

import static com.amazon.spikesort.CommonUtils.checkArgument;
import static com.amazon.spikesort.CommonUtils.checkNotNull;

import com.amazon.spikesort.energy.TriangularMatrix;

/**
 * Converts raw interface energy into connection strength. Energies are first
 * normalized by the number of spike pairs they sum over ({@code n_i * n_j}
 * between clusters, {@code (n_i^2 - n_i) / 2} within one), then the energy
 * between two clusters is compared with the mean of their normalized self
 * energies:
 *
 * <pre>
 * J(i, j) = 2 En(i, j) / (En(i, i) + En(j, j))
 * </pre>
 *
 * A cluster is live while its size is positive. Substitutions keep every value
 * finite: the diagonal of a cluster without self energy is 1, a between-cluster
 * value that is not finite is 0, and the row of a dead cluster is 0 with 1 on
 * the diagonal.
 */
public class ConnectionStrengthNormalizer {

    private ConnectionStrengthNormalizer() {
    }

    /**
     * Computes the full connection-strength matrix.
     *
     * @param energy raw interface energy
     * @param sizes  spikes per cluster, zero for dead clusters
     * @return the connection strengths
     */
    public static TriangularMatrix compute(TriangularMatrix energy, int[] sizes) {
        checkConsistent(energy, sizes);
        int clusters = sizes.length;
        double[] self = new double[clusters];
        for (int i = 0; i < clusters; i++) {
            self[i] = normalizedSelfEnergy(energy, sizes, i);
        }
        TriangularMatrix strength = new TriangularMatrix(clusters);
        for (int i = 0; i < clusters; i++) {
            strength.set(i, i, diagonal(energy, sizes, i));
            for (int j = i + 1; j < clusters; j++) {
                strength.set(i, j, offDiagonal(energy, sizes, self, i, j));
            }
        }
        return strength;
    }

    /**
     * Recomputes row and column {@code cluster} of {@code strength} in place. This
     * is all that changes when another cluster has been merged into
     * {@code cluster}, since no other energy or size is touched.
     *
     * @param strength connection strengths to update
     * @param energy   raw interface energy
     * @param sizes    spikes per cluster, zero for dead clusters
     * @param cluster  the row and column to recompute
     */
    public static void refresh(TriangularMatrix strength, TriangularMatrix energy, int[] sizes, int cluster) {
        checkConsistent(energy, sizes);
        checkArgument(strength.size() == sizes.length, "incorrect connection strength size");
        checkArgument(cluster >= 0 && cluster < sizes.length, "cluster out of range");
        double own = normalizedSelfEnergy(energy, sizes, cluster);
        for (int k = 0; k < sizes.length; k++) {
            if (k == cluster) {
                strength.set(k, k, diagonal(energy, sizes, k));
            } else {
                double other = normalizedSelfEnergy(energy, sizes, k);
                strength.set(cluster, k, value(energy, sizes, cluster, k, own, other));
            }
        }
    }

    /**
     * Energy of cluster {@code i} divided by its number of unordered spike pairs.
     * Not finite for clusters of fewer than two spikes.
     */
    public static double normalizedSelfEnergy(TriangularMatrix energy, int[] sizes, int i) {
        double n = sizes[i];
        return energy.get(i, i) / ((n * n - n) / 2);
    }

    /**
     * Between-cluster energy divided by the number of spike pairs.
     */
    public static double normalizedEnergy(TriangularMatrix energy, int[] sizes, int i, int j) {
        return energy.get(i, j) / ((double) sizes[i] * sizes[j]);
    }

    static double diagonal(TriangularMatrix energy, int[] sizes, int i) {
        if (sizes[i] <= 0 || energy.get(i, i) == 0) {
            return 1;
        }
        double self = normalizedSelfEnergy(energy, sizes, i);
        double value = 2 * self / (self + self);
        return Double.isFinite(value) ? value : 1;
    }

    static double offDiagonal(TriangularMatrix energy, int[] sizes, double[] self, int i, int j) {
        return value(energy, sizes, i, j, self[i], self[j]);
    }

    static double value(TriangularMatrix energy, int[] sizes, int i, int j, double selfI, double selfJ) {
        if (sizes[i] <= 0 || sizes[j] <= 0) {
            return 0;
        }
        double value = 2 * normalizedEnergy(energy, sizes, i, j) / (selfI + selfJ);
        return Double.isFinite(value) ? value : 0;
    }

    /**
     * Connection strength between two distinct clusters without substitution.
     * The result is NaN or infinite when either cluster has fewer than two
     * spikes or both self energies vanish.
     *
     * @param energy raw interface energy
     * @param sizes  spikes per cluster
     * @param i      a cluster
     * @param j      another cluster
     * @return {@code 2 En(i, j) / (En(i, i) + En(j, j))}
     */
    public static double unsubstituted(TriangularMatrix energy, int[] sizes, int i, int j) {
        checkConsistent(energy, sizes);
        checkArgument(i != j, "clusters must be distinct");
        return 2 * normalizedEnergy(energy, sizes, i, j)
                / (normalizedSelfEnergy(energy, sizes, i) + normalizedSelfEnergy(energy, sizes, j));
    }

    private static void checkConsistent(TriangularMatrix energy, int[] sizes) {
        checkNotNull(energy, "energy must not be null");
        checkNotNull(sizes, "sizes must not be null");
        checkArgument(energy.size() == sizes.length, "one size is needed per cluster");
    }
}
