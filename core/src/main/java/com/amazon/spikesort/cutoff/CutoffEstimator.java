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

import java.util.Random;
import java.util.stream.DoubleStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.spikesort.config.CutoffMethod;
import com.amazon.spikesort.config.SortingConfig;
import com.amazon.spikesort.connection.ConnectionStrengthNormalizer;
import com.amazon.spikesort.energy.TriangularMatrix;

/**
 * Chooses the connection strength below which clusters stay apart. A positive
 * configured default wins. Otherwise the cutoff is the upper end of the BCa
 * confidence interval of a high percentile of the defined connection strengths
 * between live cluster pairs, so that only pairs that stand out from the bulk of
 * the distribution get merged.
 */
public class CutoffEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(CutoffEstimator.class);

    private final boolean useDefault;
    private final double defaultCutoff;
    private final int minimumPairs;
    private final double fallbackCutoff;
    private final PercentileBootstrap bootstrap;

    public CutoffEstimator(SortingConfig config) {
        checkNotNull(config, "config must not be null");
        this.useDefault = config.isDefaultCutoffEnabled();
        this.defaultCutoff = config.getDefaultCutoff();
        this.minimumPairs = config.getMinimumBootstrapPairs();
        this.fallbackCutoff = config.getFallbackCutoff();
        this.bootstrap = new PercentileBootstrap(config.getBootstrapSamples(), config.getAlpha(),
                config.getPercentile(), config.isParallelExecutionEnabled());
    }

    /**
     * @param energy raw interface energy
     * @param sizes  spikes per cluster, zero for dead clusters
     * @param random source of the bootstrap resamples
     * @return the cutoff
     */
    public CutoffEstimate estimate(TriangularMatrix energy, int[] sizes, Random random) {
        checkNotNull(energy, "energy must not be null");
        checkNotNull(sizes, "sizes must not be null");
        checkArgument(energy.size() == sizes.length, "one size is needed per cluster");
        if (useDefault) {
            return new CutoffEstimate(defaultCutoff, CutoffMethod.DEFAULT, 0);
        }

        double[] values = livePairStrengths(energy, sizes);
        if (values.length < minimumPairs) {
            LOG.warn("only {} usable cluster pairs, using fallback cutoff {}", values.length, fallbackCutoff);
            return new CutoffEstimate(fallbackCutoff, CutoffMethod.FALLBACK, values.length);
        }
        double cutoff = bootstrap.upperBound(values, random);
        LOG.debug("bootstrapped cutoff {} from {} cluster pairs", cutoff, values.length);
        return new CutoffEstimate(cutoff, CutoffMethod.BOOTSTRAP, values.length);
    }

    /**
     * Connection strengths between live clusters, row by row. A pair is left out
     * when its strength is undefined: either cluster has a single spike, or both
     * self energies vanish.
     */
    static double[] livePairStrengths(TriangularMatrix energy, int[] sizes) {
        DoubleStream.Builder values = DoubleStream.builder();
        for (int i = 0; i < sizes.length; i++) {
            if (sizes[i] < 2) {
                continue;
            }
            for (int j = i + 1; j < sizes.length; j++) {
                if (sizes[j] < 2) {
                    continue;
                }
                double value = ConnectionStrengthNormalizer.unsubstituted(energy, sizes, i, j);
                if (Double.isFinite(value)) {
                    values.add(value);
                }
            }
        }
        return values.build().toArray();
    }
}
