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

import static com.amazon.spikesort.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

/**
 * Serializable form of an electrode sorting result. The automated clusters are
 * not stored: they are recovered by replaying the merge history on the initial
 * clusters.
 */
@Data
public class ElectrodeSortState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String version = V1_0;
    private int electrodeId;
    private double scale;
    private int numberOfClusters;
    private int[] initialAssignment;
    private int[] initialSizes;
    /**
     * raw interface energy, upper triangle packed row by row
     */
    private double[] initialEnergy;
    private double cutoff;
    private String cutoffMethod;
    private int cutoffPairs;
    /**
     * merges in chronological order, each {low, high}
     */
    private int[][] mergeHistory;
}
