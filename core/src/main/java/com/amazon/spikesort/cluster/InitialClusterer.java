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
import static com.amazon.spikesort.CommonUtils.checkRectangular;
import static com.amazon.spikesort.CommonUtils.checkState;
import static com.amazon.spikesort.CommonUtils.euclideanDistance;
import static com.amazon.spikesort.CommonUtils.squaredDistance;

import java.util.Arrays;
import java.util.Random;

import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.spikesort.config.SortingConfig;

/**
 * Over-segments the feature space of one electrode by repeated bisection (Fee,
 * Mitra and Kleinfeld 1996; Hill, Mehta and Kleinfeld 2011). Every bisection
 * doubles the cluster centres by perturbing a copy of each one, then spikes are
 * reassigned to their nearest centre and centres recomputed until the
 * assignment settles or the pass budget is spent. A cluster that ends a pass
 * with too few spikes is dissolved into its members' next-nearest clusters.
 *
 * Over-segmentation lets small clusters follow waveforms that drift or form
 * curved clouds; the merge stage reassembles them.
 */
public class InitialClusterer {

    private static final Logger LOG = LoggerFactory.getLogger(InitialClusterer.class);

    /**
     * Number of random spike pairs used to estimate the typical spike distance.
     */
    public static final int DISTANCE_SAMPLES = 5000;

    /**
     * Heuristic divisor of the perturbation added to duplicated centres.
     */
    public static final double NOISE_DIVISOR = 100;

    /**
     * Divisor applied to the within-cluster spread to obtain the energy scale.
     */
    public static final double SCALE_DIVISOR = 10;

    private final int bisections;
    private final int maxAssignments;
    private final int minSpikes;

    public InitialClusterer(int bisections, int maxAssignments, int minSpikes) {
        checkArgument(bisections > 0, "bisections must be greater than 0");
        checkArgument(bisections <= SortingConfig.MAX_BISECTIONS,
                "bisections must be at most " + SortingConfig.MAX_BISECTIONS);
        checkArgument(maxAssignments > 0, "maxAssignments must be greater than 0");
        checkArgument(minSpikes > 0, "minSpikes must be greater than 0");
        this.bisections = bisections;
        this.maxAssignments = maxAssignments;
        this.minSpikes = minSpikes;
    }

    public InitialClusterer(SortingConfig config) {
        this(config.getBisections(), config.getMaxAssignments(), config.getMinSpikes());
    }

    /**
     * Clusters the spikes of one electrode.
     *
     * @param features spike-major feature matrix
     * @param random   source of the centre perturbations and distance samples
     * @return dense assignment, cluster sizes and the interface-energy scale
     */
    public InitialClustering cluster(double[][] features, Random random) {
        int dimensions = checkRectangular(features, "features");
        int spikes = features.length;
        checkArgument(spikes >= minSpikes, String.format("need at least %d spikes, found %d", minSpikes, spikes));

        double noise = meanPairDistance(features, DISTANCE_SAMPLES, random) / NOISE_DIVISOR / dimensions;

        int maxClusters = 1 << bisections;
        double[][] centres = new double[maxClusters][];
        int[] counts = new int[maxClusters];
        int[] assignment = new int[spikes];
        int[] previous = new int[spikes];
        centres[0] = mean(features, assignment, 0, dimensions);
        counts[0] = spikes;
        int[] live = new int[] { 0 };

        for (int bisection = 0; bisection < bisections; bisection++) {
            int total = 2 * live.length;
            double[][] duplicated = new double[total][];
            for (int k = 0; k < total; k++) {
                double[] centre = centres[live[k % live.length]].clone();
                for (int d = 0; d < dimensions; d++) {
                    centre[d] += noise * random.nextDouble();
                }
                duplicated[k] = centre;
            }
            System.arraycopy(duplicated, 0, centres, 0, total);
            live = new int[total];
            for (int k = 0; k < total; k++) {
                live[k] = k;
            }
            // no previous assignment can match a fresh set of centres
            Arrays.fill(previous, -1);

            for (int pass = 0; pass < maxAssignments; pass++) {
                assignNearest(features, centres, live, assignment, counts);
                live = liveClusters(live, counts);
                if (Arrays.equals(previous, assignment)) {
                    break;
                }
                System.arraycopy(assignment, 0, previous, 0, spikes);
                for (int cluster : live) {
                    centres[cluster] = mean(features, assignment, cluster, dimensions);
                }
            }
        }

        int[] relabel = new int[maxClusters];
        int[] sizes = new int[live.length];
        for (int k = 0; k < live.length; k++) {
            relabel[live[k]] = k;
            sizes[k] = counts[live[k]];
        }
        for (int s = 0; s < spikes; s++) {
            assignment[s] = relabel[assignment[s]];
        }

        double scale = scale(features, assignment, sizes.length, dimensions);
        LOG.debug("{} spikes split into {} initial clusters, scale {}", spikes, sizes.length, scale);
        return new InitialClustering(assignment, sizes, scale);
    }

    /**
     * One assignment pass: nearest centre for every spike, then dissolution of
     * clusters below the minimum size. The list of undersized clusters is taken
     * before any dissolution; a listed cluster that has been refilled by an
     * earlier dissolution is kept.
     */
    void assignNearest(double[][] features, double[][] centres, int[] live, int[] assignment, int[] counts) {
        int spikes = features.length;
        double[][] distances = new double[spikes][live.length];
        for (int s = 0; s < spikes; s++) {
            for (int k = 0; k < live.length; k++) {
                distances[s][k] = squaredDistance(features[s], centres[live[k]]);
            }
        }
        for (int cluster : live) {
            counts[cluster] = 0;
        }
        for (int s = 0; s < spikes; s++) {
            assignment[s] = live[argmin(distances[s])];
            counts[assignment[s]]++;
        }

        int[] undersized = Arrays.stream(live).filter(c -> counts[c] < minSpikes).toArray();
        for (int cluster : undersized) {
            if (counts[cluster] >= minSpikes) {
                continue;
            }
            int column = Arrays.binarySearch(live, cluster);
            for (int s = 0; s < spikes; s++) {
                distances[s][column] = Double.POSITIVE_INFINITY;
            }
            for (int s = 0; s < spikes; s++) {
                if (assignment[s] == cluster) {
                    int nearest = argmin(distances[s]);
                    checkState(distances[s][nearest] < Double.POSITIVE_INFINITY,
                            "no cluster left to absorb an undersized cluster");
                    assignment[s] = live[nearest];
                    counts[assignment[s]]++;
                }
            }
            counts[cluster] = 0;
        }
    }

    static int[] liveClusters(int[] live, int[] counts) {
        return Arrays.stream(live).filter(c -> counts[c] > 0).toArray();
    }

    /**
     * Index of the first minimum.
     */
    static int argmin(double[] values) {
        int best = 0;
        for (int k = 1; k < values.length; k++) {
            if (values[k] < values[best]) {
                best = k;
            }
        }
        return best;
    }

    static double[] mean(double[][] features, int[] assignment, int cluster, int dimensions) {
        double[] centre = new double[dimensions];
        int count = 0;
        for (int s = 0; s < features.length; s++) {
            if (assignment[s] == cluster) {
                for (int d = 0; d < dimensions; d++) {
                    centre[d] += features[s][d];
                }
                count++;
            }
        }
        if (count > 0) {
            for (int d = 0; d < dimensions; d++) {
                centre[d] /= count;
            }
        }
        return centre;
    }

    /**
     * Mean distance between randomly sampled pairs of distinct spikes.
     *
     * @param features spike-major feature matrix
     * @param samples  number of pairs
     * @param random   source of the pairs
     * @return the mean distance, zero if there are fewer than two spikes
     */
    static double meanPairDistance(double[][] features, int samples, Random random) {
        int spikes = features.length;
        if (spikes < 2) {
            return 0;
        }
        double sum = 0;
        int found = 0;
        while (found < samples) {
            int a = random.nextInt(spikes);
            int b = random.nextInt(spikes);
            if (a == b) {
                continue;
            }
            sum += euclideanDistance(features[a], features[b]);
            found++;
        }
        return sum / samples;
    }

    /**
     * The interface-energy scale of UltraMegaSort2000: the square root of the
     * within-cluster scatter (total minus between-cluster variance, summed over
     * components), divided by ten. A clustering without spread gets the smallest
     * positive double, the limit where only coincident spikes interact.
     */
    static double scale(double[][] features, int[] assignment, int clusters, int dimensions) {
        double[][] centres = new double[clusters][];
        for (int c = 0; c < clusters; c++) {
            centres[c] = mean(features, assignment, c, dimensions);
        }
        Variance variance = new Variance();
        double within = 0;
        double[] total = new double[features.length];
        double[] between = new double[features.length];
        for (int d = 0; d < dimensions; d++) {
            for (int s = 0; s < features.length; s++) {
                total[s] = features[s][d];
                between[s] = centres[assignment[s]][d];
            }
            within += variance.evaluate(total) - variance.evaluate(between);
        }
        double scale = Math.sqrt(Math.max(0, within)) / SCALE_DIVISOR;
        return (scale > 0 && Double.isFinite(scale)) ? scale : Double.MIN_VALUE;
    }
}
