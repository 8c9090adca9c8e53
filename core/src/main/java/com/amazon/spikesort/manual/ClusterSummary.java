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

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Waveform statistics of one final cluster.
 */
@Getter
public class ClusterSummary {

    /**
     * id after renumbering, 1 for the smallest RMS
     */
    private final int finalId;
    /**
     * the initial cluster id that survived all merges into this cluster
     */
    private final int cluster;
    private final int count;
    @Getter(AccessLevel.NONE)
    private final double[] meanWaveform;
    /**
     * per-sample variance, normalized by {@code count - 1}; all zero for a
     * single spike
     */
    @Getter(AccessLevel.NONE)
    private final double[] waveformVariance;
    private final double rms;

    public ClusterSummary(int finalId, int cluster, int count, double[] meanWaveform, double[] waveformVariance,
            double rms) {
        this.finalId = finalId;
        this.cluster = cluster;
        this.count = count;
        this.meanWaveform = meanWaveform.clone();
        this.waveformVariance = waveformVariance.clone();
        this.rms = rms;
    }

    public double[] getMeanWaveform() {
        return meanWaveform.clone();
    }

    public double[] getWaveformVariance() {
        return waveformVariance.clone();
    }
}
