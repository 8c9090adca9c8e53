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

import com.amazon.spikesort.config.CutoffMethod;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A merge cutoff together with the way it was obtained.
 */
@Getter
@ToString
@EqualsAndHashCode
public class CutoffEstimate {

    private final double value;
    private final CutoffMethod method;
    /**
     * Number of live cluster pairs the estimate was computed from, 0 unless
     * bootstrapped.
     */
    private final int pairs;

    public CutoffEstimate(double value, CutoffMethod method, int pairs) {
        checkNotNull(method, "method must not be null");
        checkArgument(Double.isFinite(value), "cutoff must be finite");
        checkArgument(pairs >= 0, "pairs must be non-negative");
        this.value = value;
        this.method = method;
        this.pairs = pairs;
    }

    public static CutoffEstimate manual(double value) {
        checkArgument(value >= 0 && value <= 1, "cutoff must be in the range [0, 1]");
        return new CutoffEstimate(value, CutoffMethod.MANUAL, 0);
    }
}
