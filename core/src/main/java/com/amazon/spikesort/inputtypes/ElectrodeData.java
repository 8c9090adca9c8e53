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

package com.amazon.spikesort.inputtypes;

import static com.amazon.spikesort.CommonUtils.checkArgument;
import static com.amazon.spikesort.CommonUtils.checkRectangular;
import static com.amazon.spikesort.CommonUtils.deepCopy;

import lombok.Getter;

/**
 * The spikes recorded on one electrode, as delivered by the upstream alignment
 * and feature extraction. Both matrices are spike-major: {@code features[s]} is
 * the reduced feature vector of spike {@code s} and {@code waveforms[s]} its
 * aligned raw waveform. The arrays are copied on construction and every
 * accessor returns a copy.
 */
public class ElectrodeData {

    @Getter
    private final int electrodeId;
    private final double[][] features;
    private final double[][] waveforms;
    @Getter
    private final int dimensions;
    @Getter
    private final int waveformLength;

    public ElectrodeData(int electrodeId, double[][] features, double[][] waveforms) {
        dimensions = checkRectangular(features, "features");
        waveformLength = checkRectangular(waveforms, "waveforms");
        checkArgument(features.length == waveforms.length,
                "features and waveforms must describe the same number of spikes");
        this.electrodeId = electrodeId;
        this.features = deepCopy(features);
        this.waveforms = deepCopy(waveforms);
    }

    /**
     * Electrode data where the feature vectors double as waveforms.
     *
     * @param electrodeId the electrode
     * @param features    spike-major feature matrix
     * @return the electrode data
     */
    public static ElectrodeData ofFeatures(int electrodeId, double[][] features) {
        return new ElectrodeData(electrodeId, features, features);
    }

    public int getNumberOfSpikes() {
        return features.length;
    }

    public double[][] getFeatures() {
        return deepCopy(features);
    }

    public double[][] getWaveforms() {
        return deepCopy(waveforms);
    }

    public double[] getFeature(int spike) {
        return features[spike].clone();
    }

    public double[] getWaveform(int spike) {
        return waveforms[spike].clone();
    }
}
