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

package com.amazon.spikesort;

import static com.amazon.spikesort.CommonUtils.checkNotNull;

import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.spikesort.cluster.InitialClusterer;
import com.amazon.spikesort.cluster.InitialClustering;
import com.amazon.spikesort.config.SortingConfig;
import com.amazon.spikesort.cutoff.CutoffEstimate;
import com.amazon.spikesort.cutoff.CutoffEstimator;
import com.amazon.spikesort.energy.InterfaceEnergyMatrix;
import com.amazon.spikesort.energy.TriangularMatrix;
import com.amazon.spikesort.inputtypes.ElectrodeData;
import com.amazon.spikesort.merge.MergeEngine;
import com.amazon.spikesort.merge.MergeState;
import com.amazon.spikesort.returntypes.ElectrodeSortResult;

/**
 * Sorts the spikes of a single electrode: over-clusters the features, measures
 * the interface energy between the clusters, chooses a cutoff and merges every
 * pair connected at least as strongly as the cutoff.
 */
public class ElectrodeSorter {

    private static final Logger LOG = LoggerFactory.getLogger(ElectrodeSorter.class);

    private final SortingConfig config;
    private final InitialClusterer clusterer;
    private final CutoffEstimator cutoffEstimator;

    public ElectrodeSorter(SortingConfig config) {
        this.config = checkNotNull(config, "config must not be null");
        this.clusterer = new InitialClusterer(config);
        this.cutoffEstimator = new CutoffEstimator(config);
    }

    /**
     * @param data the spikes of one electrode
     * @return the initial and the merged clusters
     */
    public ElectrodeSortResult sort(ElectrodeData data) {
        checkNotNull(data, "data must not be null");
        int electrode = data.getElectrodeId();
        Random random = config.getRandom(electrode);

        double[][] features = data.getFeatures();
        InitialClustering clustering = clusterer.cluster(features, random);
        LOG.info("electrode {}: {} spikes in {} initial clusters, scale {}", electrode, data.getNumberOfSpikes(),
                clustering.getNumberOfClusters(), clustering.getScale());

        TriangularMatrix energy = InterfaceEnergyMatrix.compute(features, clustering.getAssignment(),
                clustering.getNumberOfClusters(), clustering.getScale(), config.isParallelExecutionEnabled());
        MergeState initial = MergeState.initial(energy, clustering.getSizes(), clustering.getAssignment());

        CutoffEstimate cutoff = cutoffEstimator.estimate(energy, clustering.getSizes(), random);
        MergeState automated = initial.copy();
        int merges = MergeEngine.run(automated, cutoff.getValue());
        LOG.info("electrode {}: {} cutoff {}, {} merges, {} clusters", electrode, cutoff.getMethod(),
                cutoff.getValue(), merges, automated.getLiveCount());

        return new ElectrodeSortResult(electrode, clustering, cutoff, initial, automated);
    }

    public SortingConfig getConfig() {
        return config;
    }
}
