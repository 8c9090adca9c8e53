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

import static com.amazon.spikesort.CommonUtils.checkArgument;
import static com.amazon.spikesort.CommonUtils.checkNotNull;
import static com.amazon.spikesort.CommonUtils.checkState;
import static com.amazon.spikesort.CommonUtils.deepCopy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.spikesort.config.ResetMode;
import com.amazon.spikesort.cutoff.CutoffEstimate;
import com.amazon.spikesort.inputtypes.ElectrodeData;
import com.amazon.spikesort.merge.ClusterPair;
import com.amazon.spikesort.merge.MergeEngine;
import com.amazon.spikesort.merge.MergeState;
import com.amazon.spikesort.merge.StaleReferenceException;
import com.amazon.spikesort.returntypes.ElectrodeSortResult;

/**
 * Manual merging of the clusters of one electrode. The session keeps the
 * initial and the automatically merged states and a working state that every
 * command acts on. Methods are synchronized, so commands from several threads
 * are applied one at a time.
 *
 * The session revision increases with every command that changes the working
 * state, resets and cutoff changes included, so a command prepared against an
 * older snapshot is refused with a {@link StaleReferenceException}.
 */
public class ManualMergeSession implements IManualOverride {

    private static final Logger LOG = LoggerFactory.getLogger(ManualMergeSession.class);

    private final MergeState initial;
    private final MergeState automated;
    private final CutoffEstimate automatedCutoff;
    private final double[][] waveforms;
    private final int[] initialAssignment;

    private MergeState working;
    private CutoffEstimate cutoff;
    private boolean finalized;
    private long revision;

    /**
     * @param initial         the state before any merge
     * @param automated       the state after automated merging
     * @param automatedCutoff the cutoff automated merging used
     * @param waveforms       spike-major raw waveforms, one row per spike, copied
     */
    public ManualMergeSession(MergeState initial, MergeState automated, CutoffEstimate automatedCutoff,
            double[][] waveforms) {
        checkNotNull(initial, "initial state must not be null");
        checkNotNull(automated, "automated state must not be null");
        checkNotNull(automatedCutoff, "cutoff must not be null");
        checkNotNull(waveforms, "waveforms must not be null");
        checkArgument(initial.getNumberOfClusters() == automated.getNumberOfClusters(),
                "initial and automated states must have the same clusters");
        checkArgument(waveforms.length == initial.getAssignment().length, "one waveform is needed per spike");
        this.initial = initial.copy();
        this.automated = automated.copy();
        this.automatedCutoff = automatedCutoff;
        this.waveforms = deepCopy(waveforms);
        this.initialAssignment = initial.getAssignment();
        this.working = automated.copy();
        this.cutoff = automatedCutoff;
    }

    /**
     * Opens a session on the result of sorting one electrode.
     */
    public static ManualMergeSession of(ElectrodeSortResult result, ElectrodeData data) {
        checkNotNull(result, "result must not be null");
        checkNotNull(data, "data must not be null");
        checkArgument(result.getElectrodeId() == data.getElectrodeId(), "result and data are from different electrodes");
        return new ManualMergeSession(result.getInitialState(), result.getAutomatedState(), result.getCutoff(),
                data.getWaveforms());
    }

    @Override
    public synchronized MergeSnapshot reset(ResetMode mode) {
        checkNotNull(mode, "mode must not be null");
        if (mode == ResetMode.AUTOMATED) {
            working = automated.copy();
            cutoff = automatedCutoff;
        } else {
            working = initial.copy();
        }
        return changed();
    }

    @Override
    public synchronized MergeSnapshot setCutoff(double value) {
        CutoffEstimate estimate = CutoffEstimate.manual(value);
        MergeState replay = initial.copy();
        int merges = MergeEngine.run(replay, value);
        LOG.debug("replayed {} merges at cutoff {}", merges, value);
        working = replay;
        cutoff = estimate;
        return changed();
    }

    @Override
    public synchronized MergeSnapshot merge(int a, int b) {
        checkNotFinalized();
        working.merge(a, b);
        return changed();
    }

    @Override
    public synchronized MergeSnapshot merge(long expectedRevision, int a, int b) {
        checkRevision(expectedRevision);
        return merge(a, b);
    }

    @Override
    public synchronized MergeSnapshot reject(int a) {
        checkNotFinalized();
        working.reject(a);
        return changed();
    }

    @Override
    public synchronized MergeSnapshot reject(long expectedRevision, int a) {
        checkRevision(expectedRevision);
        return reject(a);
    }

    @Override
    public synchronized MergeSnapshot current() {
        return new MergeSnapshot(revision, working, cutoff, finalized);
    }

    @Override
    public synchronized Optional<ClusterPair> suggest() {
        return MergeEngine.strongestPair(working);
    }

    @Override
    public synchronized Optional<ClusterPair> suggest(int selected) {
        return MergeEngine.strongestPartner(working, selected);
    }

    @Override
    public synchronized FinalClustering finalizeClusters() {
        int[] live = working.getLiveClusters();
        int[] assignment = working.getAssignment();
        int length = waveforms.length == 0 ? 0 : waveforms[0].length;

        List<ClusterSummary> unordered = new ArrayList<>(live.length);
        for (int cluster : live) {
            unordered.add(summarize(cluster, assignment, length));
        }
        unordered.sort(Comparator.comparingDouble(ClusterSummary::getRms).thenComparingInt(ClusterSummary::getCluster));

        int[] finalIds = new int[working.getNumberOfClusters()];
        List<ClusterSummary> clusters = new ArrayList<>(live.length);
        for (int k = 0; k < unordered.size(); k++) {
            ClusterSummary summary = unordered.get(k);
            finalIds[summary.getCluster()] = k + 1;
            clusters.add(new ClusterSummary(k + 1, summary.getCluster(), summary.getCount(),
                    summary.getMeanWaveform(), summary.getWaveformVariance(), summary.getRms()));
        }

        int[] spikes = new int[assignment.length];
        int[] idMap = new int[working.getNumberOfClusters()];
        for (int s = 0; s < assignment.length; s++) {
            spikes[s] = (assignment[s] == MergeState.REJECTED) ? 0 : finalIds[assignment[s]];
            if (initialAssignment[s] >= 0) {
                idMap[initialAssignment[s]] = spikes[s];
            }
        }

        finalized = true;
        revision++;
        LOG.info("finalized {} clusters, {} rejected", clusters.size(), working.getRejected().size());
        return new FinalClustering(idMap, spikes, clusters, cutoff, working.getHistory(), working.getRejected());
    }

    /**
     * Mean, variance and RMS of the waveforms of one working cluster.
     */
    ClusterSummary summarize(int cluster, int[] assignment, int length) {
        int count = 0;
        double[] mean = new double[length];
        double squares = 0;
        for (int s = 0; s < assignment.length; s++) {
            if (assignment[s] == cluster) {
                count++;
                for (int t = 0; t < length; t++) {
                    mean[t] += waveforms[s][t];
                    squares += waveforms[s][t] * waveforms[s][t];
                }
            }
        }
        checkState(count > 0, "live cluster without spikes");
        for (int t = 0; t < length; t++) {
            mean[t] /= count;
        }
        double[] variance = new double[length];
        if (count > 1) {
            for (int s = 0; s < assignment.length; s++) {
                if (assignment[s] == cluster) {
                    for (int t = 0; t < length; t++) {
                        double d = waveforms[s][t] - mean[t];
                        variance[t] += d * d;
                    }
                }
            }
            for (int t = 0; t < length; t++) {
                variance[t] /= count - 1;
            }
        }
        double rms = (length == 0) ? 0 : Math.sqrt(squares / ((double) count * length));
        return new ClusterSummary(0, cluster, count, mean, variance, rms);
    }

    public synchronized boolean isFinalized() {
        return finalized;
    }

    public synchronized CutoffEstimate getCutoff() {
        return cutoff;
    }

    private MergeSnapshot changed() {
        finalized = false;
        revision++;
        return new MergeSnapshot(revision, working, cutoff, finalized);
    }

    private void checkNotFinalized() {
        checkState(!finalized, "clusters are finalized, reset or change the cutoff to continue");
    }

    private void checkRevision(long expectedRevision) {
        if (expectedRevision != revision) {
            throw new StaleReferenceException(
                    "session is at revision " + revision + ", command was issued at revision " + expectedRevision);
        }
    }
}
