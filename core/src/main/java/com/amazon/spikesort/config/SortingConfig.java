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

package com.amazon.spikesort.config;

import static com.amazon.spikesort.CommonUtils.checkArgument;

import java.util.Optional;
import java.util.Random;

import lombok.Getter;

/**
 * The parameters of a spike sorting session. A configuration is immutable and
 * validated when it is built, so that a bad value is rejected before any
 * electrode is touched. The same instance is passed explicitly to every stage
 * of the pipeline.
 */
@Getter
public class SortingConfig {

    /**
     * Default number of bisections; up to 64 initial clusters.
     */
    public static final int DEFAULT_BISECTIONS = 6;

    /**
     * Upper bound on bisections; 4096 initial clusters.
     */
    public static final int MAX_BISECTIONS = 12;

    /**
     * Default number of reassignment passes after each bisection.
     */
    public static final int DEFAULT_MAX_ASSIGNMENTS = 5;

    /**
     * Default minimum number of spikes in an initial cluster.
     */
    public static final int DEFAULT_MIN_SPIKES = 10;

    /**
     * Default connection-strength cutoff. A positive value is used for every
     * electrode; zero asks for a bootstrap estimate per electrode.
     */
    public static final double DEFAULT_CUTOFF = 0.05;

    public static final int DEFAULT_BOOTSTRAP_SAMPLES = 2000;

    public static final double DEFAULT_ALPHA = 0.01;

    public static final double DEFAULT_PERCENTILE = 85;

    /**
     * With fewer between-cluster pairs than this the bootstrap is not attempted;
     * three pairs means at least three clusters.
     */
    public static final int DEFAULT_MINIMUM_BOOTSTRAP_PAIRS = 3;

    public static final double DEFAULT_FALLBACK_CUTOFF = 0.0;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final int bisections;
    private final int maxAssignments;
    private final int minSpikes;
    private final double defaultCutoff;
    private final int bootstrapSamples;
    private final double alpha;
    private final double percentile;
    private final int minimumBootstrapPairs;
    private final double fallbackCutoff;
    private final Optional<Long> randomSeed;
    private final boolean parallelExecutionEnabled;
    private final int threadPoolSize;

    protected SortingConfig(Builder<?> builder) {
        checkArgument(builder.bisections > 0, "bisections must be greater than 0");
        checkArgument(builder.bisections <= MAX_BISECTIONS, "bisections must be at most " + MAX_BISECTIONS);
        checkArgument(builder.maxAssignments > 0, "maxAssignments must be greater than 0");
        checkArgument(builder.minSpikes > 0, "minSpikes must be greater than 0");
        checkArgument(builder.defaultCutoff >= 0 && builder.defaultCutoff <= 1,
                "defaultCutoff must be in the range [0, 1]");
        checkArgument(builder.bootstrapSamples > 0, "bootstrapSamples must be greater than 0");
        checkArgument(builder.alpha > 0 && builder.alpha < 1, "alpha must be in the range (0, 1)");
        checkArgument(builder.percentile >= 0 && builder.percentile <= 100,
                "percentile must be in the range [0, 100]");
        checkArgument(builder.minimumBootstrapPairs > 1, "minimumBootstrapPairs must be greater than 1");
        checkArgument(builder.fallbackCutoff >= 0 && builder.fallbackCutoff <= 1,
                "fallbackCutoff must be in the range [0, 1]");
        builder.threadPoolSize.ifPresent(n -> checkArgument(n > 0 || (n == 0 && !builder.parallelExecutionEnabled),
                "threadPoolSize must be greater/equal than 0. To disable thread pool, set parallel execution to 'false'."));

        bisections = builder.bisections;
        maxAssignments = builder.maxAssignments;
        minSpikes = builder.minSpikes;
        defaultCutoff = builder.defaultCutoff;
        bootstrapSamples = builder.bootstrapSamples;
        alpha = builder.alpha;
        percentile = builder.percentile;
        minimumBootstrapPairs = builder.minimumBootstrapPairs;
        fallbackCutoff = builder.fallbackCutoff;
        randomSeed = builder.randomSeed;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
        } else {
            threadPoolSize = 0;
        }
    }

    /**
     * @return a new configuration builder
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @return a configuration with every parameter at its default value
     */
    public static SortingConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Whether the cutoff is fixed by configuration rather than estimated.
     *
     * @return true if a positive default cutoff is configured
     */
    public boolean isDefaultCutoffEnabled() {
        return defaultCutoff > 0;
    }

    /**
     * A random number generator for one electrode. When a seed is configured the
     * generator depends only on the seed and the electrode id, so electrodes that
     * are processed in parallel produce the same result in any order.
     *
     * @param electrodeId the electrode
     * @return a new random number generator
     */
    public Random getRandom(int electrodeId) {
        return randomSeed.map(seed -> new Random(seed ^ (0x9E3779B97F4A7C15L * (electrodeId + 1))))
                .orElseGet(Random::new);
    }

    /**
     * @return a builder initialised with the values of this configuration
     */
    public Builder<?> toBuilder() {
        Builder<?> builder = builder().bisections(bisections).maxAssignments(maxAssignments).minSpikes(minSpikes)
                .defaultCutoff(defaultCutoff).bootstrapSamples(bootstrapSamples).alpha(alpha).percentile(percentile)
                .minimumBootstrapPairs(minimumBootstrapPairs).fallbackCutoff(fallbackCutoff)
                .parallelExecutionEnabled(parallelExecutionEnabled);
        randomSeed.ifPresent(builder::randomSeed);
        if (parallelExecutionEnabled) {
            builder.threadPoolSize(threadPoolSize);
        }
        return builder;
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional primitive fields when it doesn't make
        // sense to use a constant default.

        private int bisections = DEFAULT_BISECTIONS;
        private int maxAssignments = DEFAULT_MAX_ASSIGNMENTS;
        private int minSpikes = DEFAULT_MIN_SPIKES;
        private double defaultCutoff = DEFAULT_CUTOFF;
        private int bootstrapSamples = DEFAULT_BOOTSTRAP_SAMPLES;
        private double alpha = DEFAULT_ALPHA;
        private double percentile = DEFAULT_PERCENTILE;
        private int minimumBootstrapPairs = DEFAULT_MINIMUM_BOOTSTRAP_PAIRS;
        private double fallbackCutoff = DEFAULT_FALLBACK_CUTOFF;
        private Optional<Long> randomSeed = Optional.empty();
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public T bisections(int bisections) {
            this.bisections = bisections;
            return (T) this;
        }

        public T maxAssignments(int maxAssignments) {
            this.maxAssignments = maxAssignments;
            return (T) this;
        }

        public T minSpikes(int minSpikes) {
            this.minSpikes = minSpikes;
            return (T) this;
        }

        public T defaultCutoff(double defaultCutoff) {
            this.defaultCutoff = defaultCutoff;
            return (T) this;
        }

        public T bootstrapSamples(int bootstrapSamples) {
            this.bootstrapSamples = bootstrapSamples;
            return (T) this;
        }

        public T alpha(double alpha) {
            this.alpha = alpha;
            return (T) this;
        }

        public T percentile(double percentile) {
            this.percentile = percentile;
            return (T) this;
        }

        public T minimumBootstrapPairs(int minimumBootstrapPairs) {
            this.minimumBootstrapPairs = minimumBootstrapPairs;
            return (T) this;
        }

        public T fallbackCutoff(double fallbackCutoff) {
            this.fallbackCutoff = fallbackCutoff;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public SortingConfig build() {
            return new SortingConfig(this);
        }
    }
}
