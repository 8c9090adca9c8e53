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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.spikesort.SpikeSorter;
import com.amazon.spikesort.config.SortingConfig;
import com.amazon.spikesort.inputtypes.ElectrodeData;
import com.amazon.spikesort.returntypes.ElectrodeSortResult;
import com.amazon.spikesort.testutils.LabeledSpikeData;
import com.amazon.spikesort.testutils.SpikeClusterTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ElectrodeSortMapperTest {

    private static ElectrodeSortResult sortedElectrode() {
        LabeledSpikeData data = new SpikeClusterTestData(6.0, 1.0, 0.1, 8).generate(new int[] { 50, 40, 60 }, 2, 23);
        SortingConfig config = SortingConfig.builder().bisections(3).defaultCutoff(0).bootstrapSamples(200)
                .randomSeed(5L).build();
        return new SpikeSorter(config).sort(new ElectrodeData(12, data.features, data.waveforms));
    }

    private static void assertSameResult(ElectrodeSortResult expected, ElectrodeSortResult actual) {
        assertEquals(expected.getElectrodeId(), actual.getElectrodeId());
        assertEquals(expected.getScale(), actual.getScale());
        assertEquals(expected.getCutoff(), actual.getCutoff());
        assertEquals(expected.getInitialEnergy(), actual.getInitialEnergy());
        assertArrayEquals(expected.getInitialAssignment(), actual.getInitialAssignment());
        assertArrayEquals(expected.getInitialSizes(), actual.getInitialSizes());
        assertEquals(expected.getHistory(), actual.getHistory());
        assertArrayEquals(expected.getAssignment(), actual.getAssignment());
        assertArrayEquals(expected.getSizes(), actual.getSizes());
        assertArrayEquals(expected.getEnergy().toPacked(), actual.getEnergy().toPacked(), 1e-12);
    }

    @Test
    public void testRoundTrip() {
        ElectrodeSortResult result = sortedElectrode();
        ElectrodeSortMapper mapper = new ElectrodeSortMapper();
        assertSameResult(result, mapper.toModel(mapper.toState(result)));
    }

    @Test
    public void testRoundTripWithJackson() throws Exception {
        ElectrodeSortResult result = sortedElectrode();
        ElectrodeSortMapper mapper = new ElectrodeSortMapper();
        ObjectMapper jsonMapper = new ObjectMapper();

        String json = jsonMapper.writeValueAsString(mapper.toState(result));
        ElectrodeSortState state = jsonMapper.readValue(json, ElectrodeSortState.class);
        assertEquals(Version.V1_0, state.getVersion());
        assertSameResult(result, mapper.toModel(state));
    }

    @Test
    public void testInvalidState() {
        ElectrodeSortMapper mapper = new ElectrodeSortMapper();
        ElectrodeSortState state = mapper.toState(sortedElectrode());
        state.setVersion("0.1");
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));

        ElectrodeSortState broken = mapper.toState(sortedElectrode());
        broken.setMergeHistory(new int[][] { { 0 } });
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(broken));
    }
}
