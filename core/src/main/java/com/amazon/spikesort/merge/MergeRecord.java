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

package com.amazon.spikesort.merge;

import static com.amazon.spikesort.CommonUtils.checkArgument;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One merge: cluster {@code high} was absorbed into cluster {@code low}.
 */
@Getter
@EqualsAndHashCode
public class MergeRecord {

    private final int low;
    private final int high;

    public MergeRecord(int low, int high) {
        checkArgument(low >= 0 && low < high, "a merge record needs 0 <= low < high");
        this.low = low;
        this.high = high;
    }

    @Override
    public String toString() {
        return "(" + low + ", " + high + ")";
    }
}
