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

package com.amazon.spikesort.config;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class SortingConfigTest {

    @Test
    public void testDefaults() {
        SortingConfig config = SortingConfig.defaultConfig();
        assertEquals(6, config.getBisections());
        assertEquals(5, config.getMaxAssignments());
        assertEquals(10, config.getMinSpikes());
        assertEquals(0.05, config.getDefaultCutoff());
        assertEquals(2000, config.getBootstrapSamples());
        assertEquals(0.01, config.getAlpha());
        assertEquals(85.0, config.getPercentile());
        assertEquals(3, config.getMinimumBootstrapPairs());
        assertEquals(0.0, config.getFallbackCutoff());
        assertEquals(Optional.empty(), config.getRandomSeed());
        assertFalse(config.isParallelExecutionEnabled());
        assertEquals(0, config.getThreadPoolSize());
        assertTrue(config.isDefaultCutoffEnabled());
    }

    @Test
    public void testZeroDefaultCutoffRequestsEstimation() {
        SortingConfig config = SortingConfig.builder().defaultCutoff(0).build();
        assertFalse(config.isDefaultCutoffEnabled());
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, -1, 13 })
    public void testInvalidBisections(int bisections) {
        assertThrows(IllegalArgumentException.class, () -> SortingConfig.builder().bisections(bisections).build());
    }

    @Test
    public void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> SortingConfig.builder().maxAssignments(0).build());
        assertThrows(IllegalArgumentException.class, () -> SortingConfig.builder().minSpikes(0).build());
        assertThrows(IllegalArgumentException.class, () -> SortingConfig.builder().defaultCutoff(-0.1).build());
        assertThrows(IllegalArgumentException.class, () -> SortingConfig.builder().defaultCutoff(1.1).build());
        assertThrows(IllegalArgumentException.class, () -> SortingConfig.builder().bootstrapSamples(0).build());
        assertThrows(IllegalArgumentException.class, () -> SortingConfig.builder().alpha(0).build());
        assertThrows(IllegalArgumentException.class, () -> SortingConfig.builder().alpha(1).build());
        assertThrows(IllegalArgumentException.class, () -> SortingConfig.builder().percentile(-1).build());
        assertThrows(IllegalArgumentException.class, () -> SortingConfig.builder().percentile(100.5).build());
        assertThrows(IllegalArgumentException.class, () -> SortingConfig.builder().minimumBootstrapPairs(1).build());
        assertThrows(IllegalArgumentException.class, () -> SortingConfig.builder().fallbackCutoff(2).build());
        assertThrows(IllegalArgumentException.class,
                () -> SortingConfig.builder().parallelExecutionEnabled(true).threadPoolSize(0).build());
    }

    @Test
    public void testParallelThreadPoolSize() {
        SortingConfig config = SortingConfig.builder().parallelExecutionEnabled(true).threadPoolSize(3).build();
        assertEquals(3, config.getThreadPoolSize());

        SortingConfig defaulted = SortingConfig.builder().parallelExecutionEnabled(true).build();
        assertTrue(defaulted.getThreadPoolSize() >= 1);
    }

    @Test
    public void testToBuilder() {
        SortingConfig config = SortingConfig.builder().bisections(4).maxAssignments(3).minSpikes(7).defaultCutoff(0)
                .bootstrapSamples(500).alpha(0.05).percentile(90).minimumBootstrapPairs(4).fallbackCutoff(0.2)
                .randomSeed(17L).parallelExecutionEnabled(true).threadPoolSize(2).build();
        SortingConfig copy = config.toBuilder().build();
        assertEquals(config.getBisections(), copy.getBisections());
        assertEquals(config.getMaxAssignments(), copy.getMaxAssignments());
        assertEquals(config.getMinSpikes(), copy.getMinSpikes());
        assertEquals(config.getDefaultCutoff(), copy.getDefaultCutoff());
        assertEquals(config.getBootstrapSamples(), copy.getBootstrapSamples());
        assertEquals(config.getAlpha(), copy.getAlpha());
        assertEquals(config.getPercentile(), copy.getPercentile());
        assertEquals(config.getMinimumBootstrapPairs(), copy.getMinimumBootstrapPairs());
        assertEquals(config.getFallbackCutoff(), copy.getFallbackCutoff());
        assertEquals(config.getRandomSeed(), copy.getRandomSeed());
        assertEquals(config.getThreadPoolSize(), copy.getThreadPoolSize());
    }

    @Test
    public void testElectrodeRandomDependsOnSeedAndElectrode() {
        SortingConfig config = SortingConfig.builder().randomSeed(42L).build();
        assertThat(config.getRandom(3).nextLong(), is(config.getRandom(3).nextLong()));
        assertNotEquals(config.getRandom(3).nextLong(), config.getRandom(4).nextLong());
    }
}
