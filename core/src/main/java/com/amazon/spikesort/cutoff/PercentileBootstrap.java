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

package com.amazon.spikesort.cutoff;

import static com.amazon.spikesort.CommonUtils.checkArgument;
import static com.amazon.spikesort.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Random;
import java.util.SplittableRandom;
import java.util.stream.IntStream;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import lombok.Getter;

/**
 * Bias-corrected and accelerated (BCa) bootstrap confidence interval for a
 * percentile of a sample (Efron 1987). Percentiles use the R-5 (Hazen)
 * definition, which places the k-th of n sorted values at {@code 100 (k - 0.5) / n}
 * and interpolates linearly.
 *
 * Resamples are independent and may run in parallel. The seed of every
 * resample is drawn from the caller's generator before any resample runs, so
 * the result does not depend on scheduling.
 */
@Getter
public class PercentileBootstrap {

    private final int samples;
    private final double alpha;
    private final double percentile;
    private final boolean parallel;

    public PercentileBootstrap(int samples, double alpha, double percentile, boolean parallel) {
        checkArgument(samples > 0, "samples must be greater than 0");
        checkArgument(alpha > 0 && alpha < 1, "alpha must be in the range (0, 1)");
        checkArgument(percentile >= 0 && percentile <= 100, "percentile must be in the range [0, 100]");
        this.samples = samples;
        this.alpha = alpha;
        this.percentile = percentile;
        this.parallel = parallel;
    }

    /**
     * The two-sided {@code (1 - alpha)} BCa confidence interval of the
     * percentile.
     *
     * @param data   the sample, at least two values
     * @param random source of the resample seeds
     * @return {@code {lower, upper}}
     */
    public double[] interval(double[] data, Random random) {
        checkNotNull(data, "data must not be null");
        checkArgument(data.length > 1, "at least two values are needed to bootstrap");
        double[] sorted = data.clone();
        Arrays.sort(sorted);
        double statistic = quantile(sorted, percentile);

        double[] distribution = resample(data, random);
        Arrays.sort(distribution);
        if (distribution[0] == distribution[distribution.length - 1]) {
            return new double[] { distribution[0], distribution[0] };
        }

        NormalDistribution normal = new NormalDistribution();
        double z0 = normal.inverseCumulativeProbability(clampProbability(biasFraction(distribution, statistic)));
        double acceleration = acceleration(sorted, percentile);

        double lower = endpoint(normal, z0, acceleration, normal.inverseCumulativeProbability(alpha / 2));
        double upper = endpoint(normal, z0, acceleration, normal.inverseCumulativeProbability(1 - alpha / 2));
        double first = quantile(distribution, 100 * lower);
        double second = quantile(distribution, 100 * upper);
        return new double[] { Math.min(first, second), Math.max(first, second) };
    }

    /**
     * @param data   the sample
     * @param random source of the resample seeds
     * @return the upper end of the BCa interval
     */
    public double upperBound(double[] data, Random random) {
        return interval(data, random)[1];
    }

    /**
     * The percentile of {@code samples} resamples drawn with replacement.
     */
    double[] resample(double[] data, Random random) {
        long[] seeds = new long[samples];
        for (int b = 0; b < samples; b++) {
            seeds[b] = random.nextLong();
        }
        IntStream range = IntStream.range(0, samples);
        if (parallel) {
            range = range.parallel();
        }
        double[] distribution = new double[samples];
        range.forEach(b -> {
            SplittableRandom generator = new SplittableRandom(seeds[b]);
            double[] draw = new double[data.length];
            for (int k = 0; k < draw.length; k++) {
                draw[k] = data[generator.nextInt(data.length)];
            }
            distribution[b] = quantile(draw, percentile);
        });
        return distribution;
    }

    /**
     * Fraction of the bootstrap distribution below the sample statistic, counting
     * ties as one half.
     */
    static double biasFraction(double[] distribution, double statistic) {
        double below = 0;
        for (double value : distribution) {
            if (value < statistic) {
                below += 1;
            } else if (value == statistic) {
                below += 0.5;
            }
        }
        return below / distribution.length;
    }

    /**
     * Jackknife estimate of the acceleration. Leaving out one value of a sorted
     * sample shifts the positions above it by one, so each leave-one-out
     * percentile is read off the full sorted sample without re-sorting.
     */
    static double acceleration(double[] sorted, double percentile) {
        int n = sorted.length;
        double[] jackknife = new double[n];
        double mean = 0;
        for (int removed = 0; removed < n; removed++) {
            jackknife[removed] = leaveOneOutQuantile(sorted, removed, percentile);
            mean += jackknife[removed];
        }
        mean /= n;
        double squares = 0;
        double cubes = 0;
        for (double value : jackknife) {
            double score = mean - value;
            squares += score * score;
            cubes += score * score * score;
        }
        if (squares == 0) {
            return 0;
        }
        return cubes / Math.pow(squares, 1.5) / 6;
    }

    static double endpoint(NormalDistribution normal, double z0, double acceleration, double z) {
        double shifted = z0 + z;
        return normal.cumulativeProbability(z0 + shifted / (1 - acceleration * shifted));
    }

    /**
     * R-5 percentile of a sample; percentiles outside the interpolation range
     * return the smallest or largest value.
     *
     * @param values     the sample, need not be sorted
     * @param percentile in [0, 100]
     * @return the percentile
     */
    public static double quantile(double[] values, double percentile) {
        if (!(percentile > 0)) {
            return Arrays.stream(values).min().getAsDouble();
        }
        double p = Math.min(100, percentile);
        return new Percentile().withEstimationType(EstimationType.R_5).evaluate(values, p);
    }

    /**
     * R-5 percentile of {@code sorted} without the value at position
     * {@code removed}.
     */
    static double leaveOneOutQuantile(double[] sorted, int removed, double percentile) {
        int n = sorted.length - 1;
        double position = n * percentile / 100 + 0.5;
        if (position <= 1) {
            return valueWithout(sorted, removed, 0);
        }
        if (position >= n) {
            return valueWithout(sorted, removed, n - 1);
        }
        int below = (int) Math.floor(position);
        double fraction = position - below;
        double low = valueWithout(sorted, removed, below - 1);
        double high = valueWithout(sorted, removed, below);
        return low + fraction * (high - low);
    }

    private static double valueWithout(double[] sorted, int removed, int index) {
        return sorted[index < removed ? index : index + 1];
    }

    private static double clampProbability(double p) {
        double tiny = 1e-12;
        return Math.min(1 - tiny, Math.max(tiny, p));
    }
}
