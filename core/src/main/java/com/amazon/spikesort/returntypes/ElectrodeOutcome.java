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

package com.amazon.spikesort.returntypes;

import static com.amazon.spikesort.CommonUtils.checkNotNull;
import static com.amazon.spikesort.CommonUtils.checkState;

import java.util.Optional;

import lombok.Getter;

/**
 * Either the result of sorting one electrode or the reason it failed.
 */
public class ElectrodeOutcome {

    @Getter
    private final int electrodeId;
    private final ElectrodeSortResult result;
    private final RuntimeException failure;

    private ElectrodeOutcome(int electrodeId, ElectrodeSortResult result, RuntimeException failure) {
        this.electrodeId = electrodeId;
        this.result = result;
        this.failure = failure;
    }

    public static ElectrodeOutcome success(ElectrodeSortResult result) {
        checkNotNull(result, "result must not be null");
        return new ElectrodeOutcome(result.getElectrodeId(), result, null);
    }

    public static ElectrodeOutcome failure(int electrodeId, RuntimeException failure) {
        checkNotNull(failure, "failure must not be null");
        return new ElectrodeOutcome(electrodeId, null, failure);
    }

    public boolean isSuccess() {
        return result != null;
    }

    /**
     * @return the result
     * @throws IllegalStateException if the electrode failed
     */
    public ElectrodeSortResult getResult() {
        checkState(isSuccess(), "electrode " + electrodeId + " failed: " + failure);
        return result;
    }

    public Optional<RuntimeException> getFailure() {
        return Optional.ofNullable(failure);
    }
}
