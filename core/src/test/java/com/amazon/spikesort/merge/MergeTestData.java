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

import com.amazon.spikesort.energy.TriangularMatrix;

/**
 * Five clusters of sizes 50, 10, 5, 8 and 40 whose normalized self energies are
 * all 1, so each connection strength equals the normalized energy between the
 * pair. Clusters 1 and 2 are connected with strength 0.9, every other pair with
 * at most 0.4.
 */
final class MergeTestData {

    static final int[] SIZES = { 50, 10, 5, 8, 40 };

    static final double[][] NORMALIZED = { { 1, 0.1, 0.2, 0.1, 0.3 }, { 0, 1, 0.9, 0.2, 0.1 },
            { 0, 0, 1, 0.4, 0.1 }, { 0, 0, 0, 1, 0.2 }, { 0, 0, 0, 0, 1 } };

    private MergeTestData() {
    }

    static TriangularMatrix energy() {
        TriangularMatrix energy = new TriangularMatrix(SIZES.length);
        for (int i = 0; i < SIZES.length; i++) {
            double n = SIZES[i];
            energy.set(i, i, (n * n - n) / 2);
            for (int j = i + 1; j < SIZES.length; j++) {
                energy.set(i, j, NORMALIZED[i][j] * SIZES[i] * SIZES[j]);
            }
        }
        return energy;
    }

    static int[] assignment() {
        int total = 0;
        for (int size : SIZES) {
            total += size;
        }
        int[] assignment = new int[total];
        int s = 0;
        for (int c = 0; c < SIZES.length; c++) {
            for (int k = 0; k < SIZES[c]; k++) {
                assignment[s++] = c;
            }
        }
        return assignment;
    }

    static MergeState state() {
        return MergeState.initial(energy(), SIZES, assignment());
    }
}
