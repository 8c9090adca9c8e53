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

package com.amazon.spikesort.connection;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.spikesort.energy.InterfaceEnergyMatrix;
import com.amazon.spikesort.energy.TriangularMatrix;
import com.amazon.spikesort.testutils.LabeledSpikeData;
import com.amazon.spikesort.testutils.SpikeClusterTestData;

public class ConnectionStrengthNormalizerTest {

    @Test
    public void testStrengthFormula() {
        // sizes 3 and 4: 3 and 6 unordered pairs, 12 cross pairs
        int[] sizes = { 3, 4 };
        TriangularMatrix energy = TriangularMatrix.fromUpper(new double[][] { { 1.5, 6.0 }, { 0, 4.8 } });
        TriangularMatrix strength = ConnectionStrengthNormalizer.compute(energy, sizes);

        double self0 = 1.5 / 3;
        double self1 = 4.8 / 6;
        double between = 6.0 / 12;
        assertEquals(2 * between / (self0 + self1), strength.get(0, 1), 1e-12);
        assertEquals(1.0, strength.get(0, 0), 1e-12);
        assertEquals(1.0, strength.get(1, 1), 1e-12);
        assertEquals(self0, ConnectionStrengthNormalizer.normalizedSelfEnergy(energy, sizes, 0), 1e-12);
        assertEquals(between, ConnectionStrengthNormalizer.normalizedEnergy(energy, sizes, 0, 1), 1e-12);
    }

    @Test
    public void testZeroSelfEnergyGivesUnitDiagonal() {
        int[] sizes = { 1, 5 };
        TriangularMatrix energy = TriangularMatrix.fromUpper(new double[][] { { 0, 2.0 }, { 0, 3.0 } });
        TriangularMatrix strength = ConnectionStrengthNormalizer.compute(energy, sizes);
        assertEquals(1.0, strength.get(0, 0));
        assertTrue(Double.isFinite(strength.get(0, 1)));
    }

    @Test
    public void testNonFiniteStrengthIsZero() {
        // two single-spike clusters have no self energy at all
        int[] sizes = { 1, 1 };
        TriangularMatrix energy = TriangularMatrix.fromUpper(new double[][] { { 0, 0.5 }, { 0, 0 } });
        TriangularMatrix strength = ConnectionStrengthNormalizer.compute(energy, sizes);
        assertEquals(0.0, strength.get(0, 1));
        assertTrue(Double.isNaN(ConnectionStrengthNormalizer.unsubstituted(energy, sizes, 0, 1)));
    }

    @Test
    public void testUnsubstitutedMatchesFiniteStrength() {
        int[] sizes = { 3, 4 };
        TriangularMatrix energy = TriangularMatrix.fromUpper(new double[][] { { 1.5, 6.0 }, { 0, 4.8 } });
        TriangularMatrix strength = ConnectionStrengthNormalizer.compute(energy, sizes);
        assertEquals(strength.get(0, 1), ConnectionStrengthNormalizer.unsubstituted(energy, sizes, 0, 1), 1e-12);
        assertThrows(IllegalArgumentException.class,
                () -> ConnectionStrengthNormalizer.unsubstituted(energy, sizes, 1, 1));
    }

    @Test
    public void testDeadClusterRow() {
        int[] sizes = { 3, 0, 4 };
        TriangularMatrix energy = TriangularMatrix
                .fromUpper(new double[][] { { 1.5, 0, 6.0 }, { 0, 0, 0 }, { 0, 0, 4.8 } });
        TriangularMatrix strength = ConnectionStrengthNormalizer.compute(energy, sizes);
        assertEquals(1.0, strength.get(1, 1));
        assertEquals(0.0, strength.get(0, 1));
        assertEquals(0.0, strength.get(1, 2));
    }

    @Test
    public void testRefreshMatchesFullComputation() {
        LabeledSpikeData data = new SpikeClusterTestData(2.0, 1.0, 0.1, 4).generate(new int[] { 20, 15, 25, 10 }, 2,
                5);
        int[] sizes = { 20, 15, 25, 10 };
        TriangularMatrix energy = InterfaceEnergyMatrix.compute(data.features, data.labels, 4, 1.0, false);
        TriangularMatrix strength = ConnectionStrengthNormalizer.compute(energy, sizes);

        energy.add(2, 2, 3.0);
        energy.add(2, 0, 1.0);
        sizes[2] = 27;
        ConnectionStrengthNormalizer.refresh(strength, energy, sizes, 2);
        assertArrayEquals(ConnectionStrengthNormalizer.compute(energy, sizes).toPacked(), strength.toPacked(), 1e-12);
    }

    @Test
    public void testInvalidInput() {
        TriangularMatrix energy = new TriangularMatrix(2);
        assertThrows(IllegalArgumentException.class, () -> ConnectionStrengthNormalizer.compute(energy, new int[3]));
        assertThrows(IllegalArgumentException.class,
                () -> ConnectionStrengthNormalizer.refresh(new TriangularMatrix(2), energy, new int[2], 2));
    }
}
