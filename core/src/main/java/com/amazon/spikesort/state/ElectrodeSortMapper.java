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

package com.amazon.spikesort.state;

import static com.amazon.spikesort.CommonUtils.checkArgument;
import static com.amazon.spikesort.CommonUtils.checkNotNull;

import java.util.List;

import com.amazon.spikesort.config.CutoffMethod;
import com.amazon.spikesort.cutoff.CutoffEstimate;
import com.amazon.spikesort.energy.TriangularMatrix;
import com.amazon.spikesort.merge.MergeRecord;
import com.amazon.spikesort.merge.MergeState;
import com.amazon.spikesort.returntypes.ElectrodeSortResult;

public class ElectrodeSortMapper implements IStateMapper<ElectrodeSortResult, ElectrodeSortState> {

    @Override
    public ElectrodeSortState toState(ElectrodeSortResult model) {
        checkNotNull(model, "result must not be null");
        ElectrodeSortState state = new ElectrodeSortState();
        state.setElectrodeId(model.getElectrodeId());
        state.setScale(model.getScale());
        state.setNumberOfClusters(model.getNumberOfInitialClusters());
        state.setInitialAssignment(model.getInitialAssignment());
        state.setInitialSizes(model.getInitialSizes());
        state.setInitialEnergy(model.getInitialEnergy().toPacked());
        state.setCutoff(model.getCutoff().getValue());
        state.setCutoffMethod(model.getCutoff().getMethod().name());
        state.setCutoffPairs(model.getCutoff().getPairs());

        List<MergeRecord> history = model.getHistory();
        int[][] merges = new int[history.size()][];
        for (int k = 0; k < merges.length; k++) {
            merges[k] = new int[] { history.get(k).getLow(), history.get(k).getHigh() };
        }
        state.setMergeHistory(merges);
        return state;
    }

    @Override
    public ElectrodeSortResult toModel(ElectrodeSortState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported version " + state.getVersion());
        TriangularMatrix energy = new TriangularMatrix(state.getNumberOfClusters(), state.getInitialEnergy());
        MergeState initial = MergeState.initial(energy, state.getInitialSizes(), state.getInitialAssignment());
        MergeState automated = initial.copy();
        if (state.getMergeHistory() != null) {
            for (int[] merge : state.getMergeHistory()) {
                checkArgument(merge.length == 2, "a merge names two clusters");
                automated.merge(merge[0], merge[1]);
            }
        }
        CutoffEstimate cutoff = new CutoffEstimate(state.getCutoff(), CutoffMethod.valueOf(state.getCutoffMethod()),
                state.getCutoffPairs());
        return new ElectrodeSortResult(state.getElectrodeId(), state.getScale(), cutoff, initial, automated);
    }
}
