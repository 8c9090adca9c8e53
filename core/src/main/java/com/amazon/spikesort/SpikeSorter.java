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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.spikesort.config.SortingConfig;
import com.amazon.spikesort.executor.AbstractElectrodeExecutor;
import com.amazon.spikesort.executor.ParallelElectrodeExecutor;
import com.amazon.spikesort.executor.SequentialElectrodeExecutor;
import com.amazon.spikesort.inputtypes.ElectrodeData;
import com.amazon.spikesort.returntypes.ElectrodeOutcome;
import com.amazon.spikesort.returntypes.ElectrodeSortResult;

/**
 * Entry point for sorting a recording. Electrodes are independent and, when
 * parallel execution is enabled, are sorted concurrently in a private thread
 * pool of {@code threadPoolSize} threads. A failure on one electrode is
 * reported in its {@link ElectrodeOutcome} and does not stop the others.
 *
 * <pre>
 * SpikeSorter sorter = new SpikeSorter(SortingConfig.builder().randomSeed(42).build());
 * List&lt;ElectrodeOutcome&gt; outcomes = sorter.sortAll(electrodes);
 * </pre>
 */
public class SpikeSorter {

    private static final Logger LOG = LoggerFactory.getLogger(SpikeSorter.class);

    private final SortingConfig config;
    private final ElectrodeSorter electrodeSorter;
    private final AbstractElectrodeExecutor executor;

    public SpikeSorter(SortingConfig config) {
        this.config = checkNotNull(config, "config must not be null");
        this.electrodeSorter = new ElectrodeSorter(config);
        if (config.isParallelExecutionEnabled()) {
            executor = new ParallelElectrodeExecutor(config.getThreadPoolSize());
        } else {
            executor = new SequentialElectrodeExecutor();
        }
    }

    /**
     * Sorts a single electrode, propagating any failure.
     *
     * @param data the spikes of one electrode
     * @return the sorting result
     */
    public ElectrodeSortResult sort(ElectrodeData data) {
        return electrodeSorter.sort(data);
    }

    /**
     * @param electrodes the electrodes of a recording
     * @return one outcome per electrode, in input order
     */
    public List<ElectrodeOutcome> sortAll(List<ElectrodeData> electrodes) {
        checkNotNull(electrodes, "electrodes must not be null");
        return executor.map(electrodes, this::sortIsolated);
    }

    ElectrodeOutcome sortIsolated(ElectrodeData data) {
        try {
            return ElectrodeOutcome.success(electrodeSorter.sort(data));
        } catch (RuntimeException e) {
            LOG.warn("electrode {} failed: {}", data.getElectrodeId(), e.getMessage(), e);
            return ElectrodeOutcome.failure(data.getElectrodeId(), e);
        }
    }

    public SortingConfig getConfig() {
        return config;
    }

    AbstractElectrodeExecutor getExecutor() {
        return executor;
    }
}
