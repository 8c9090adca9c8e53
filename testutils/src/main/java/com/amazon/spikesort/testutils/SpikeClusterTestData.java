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

package com.amazon.spikesort.testutils;

import java.util.Random;

/**
 * Samples spikes from well separated clusters. Features of cluster {@code c}
 * are normal with mean {@code separation * c} on the first axis, 0 elsewhere,
 * and covariance {@code sigma * I}. Waveforms are a half sine of amplitude
 * {@code c + 1} plus normal noise, so their RMS grows with the cluster index.
 */
public class SpikeClusterTestData {

    private final double separation;
    private final double sigma;
    private final double waveformNoise;
    private final int waveformLength;

    public SpikeClusterTestData(double separation, double sigma, double waveformNoise, int waveformLength) {
        this.separation = separation;
        this.sigma = sigma;
        this.waveformNoise = waveformNoise;
        this.waveformLength = waveformLength;
    }

    public SpikeClusterTestData() {
        this(20.0, 1.0, 0.05, 16);
    }

    /**
     * @param clusterSizes number of spikes drawn from each cluster
     * @param dimensions   number of feature components
     * @param seed         random seed
     * @return spikes ordered by cluster
     */
    public LabeledSpikeData generate(int[] clusterSizes, int dimensions, long seed) {
        int total = 0;
        for (int size : clusterSizes) {
            total += size;
        }
        double[][] features = new double[total][dimensions];
        double[][] waveforms = new double[total][waveformLength];
        int[] labels = new int[total];
        NormalDistribution dist = new NormalDistribution(new Random(seed));

        int s = 0;
        for (int c = 0; c < clusterSizes.length; c++) {
            for (int k = 0; k < clusterSizes[c]; k++) {
                for (int d = 0; d < dimensions; d++) {
                    features[s][d] = dist.nextDouble(d == 0 ? separation * c : 0, sigma);
                }
                for (int t = 0; t < waveformLength; t++) {
                    double template = (c + 1) * Math.sin(Math.PI * (t + 0.5) / waveformLength);
                    waveforms[s][t] = dist.nextDouble(template, waveformNoise);
                }
                labels[s] = c;
                s++;
            }
        }
        return new LabeledSpikeData(features, waveforms, labels);
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller
                double u = 1 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
