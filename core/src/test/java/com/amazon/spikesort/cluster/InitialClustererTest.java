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

package com.amazon.spikesort.cluster;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.spikesort.config.SortingConfig;
import com.amazon.spikesort.testutils.LabeledSpikeData;
import com.amazon.spikesort.testutils.SpikeClusterTestData;

public class InitialClustererTest {

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 4 })
    public void testClusteringIsDenseAndRespectsMinimumSize(int bisections) {
        LabeledSpikeData data = new SpikeClusterTestData().generate(new int[] { 80, 60, 70 }, 3, 11);
        InitialClusterer clusterer = new InitialClusterer(bisections, 5, 10);
        InitialClustering clustering = clusterer.cluster(data.features, new Random(5));

        int clusters = clustering.getNumberOfClusters();
        assertThat(clusters, lessThanOrEqualTo(1 << bisections));
        assertThat(clusters, greaterThanOrEqualTo(1));
        int[] counts = new int[clusters];
        for (int cluster : clustering.getAssignment()) {
            assertTrue(cluster >= 0 && cluster < clusters);
            counts[cluster]++;
        }
        assertArrayEquals(counts, clustering.getSizes());
        for (int size : clustering.getSizes()) {
            assertThat(size, greaterThanOrEqualTo(10));
        }
        assertEquals(210, Arrays.stream(clustering.getSizes()).sum());
        assertThat(clustering.getScale(), greaterThan(0.0));
    }

    @Test
    public void testSeparatedClustersAreNotMixed() {
        LabeledSpikeData data = new SpikeClusterTestData().generate(new int[] { 100, 100 }, 1, 3);
        InitialClustering clustering = new InitialClusterer(2, 5, 10).cluster(data.features, new Random(8));

        assertThat(clustering.getNumberOfClusters(), greaterThanOrEqualTo(2));
        for (int cluster = 0; cluster < clustering.getNumberOfClusters(); cluster++) {
            Set<Integer> labels = new HashSet<>();
            for (int s = 0; s < data.labels.length; s++) {
                if (clustering.getAssignment()[s] == cluster) {
                    labels.add(data.labels[s]);
                }
            }
            assertEquals(1, labels.size(), "cluster " + cluster + " mixes labels " + labels);
        }
    }

    @Test
    public void testSameSeedGivesSameClustering() {
        LabeledSpikeData data = new SpikeClusterTestData().generate(new int[] { 50, 50, 50 }, 2, 21);
        InitialClusterer clusterer = new InitialClusterer(SortingConfig.builder().bisections(3).build());
        InitialClustering first = clusterer.cluster(data.features, new Random(99));
        InitialClustering second = clusterer.cluster(data.features, new Random(99));
        assertArrayEquals(first.getAssignment(), second.getAssignment());
        assertEquals(first.getScale(), second.getScale());
    }

    @Test
    public void testTooFewSpikes() {
        double[][] features = new double[5][2];
        InitialClusterer clusterer = new InitialClusterer(2, 5, 10);
        assertThrows(IllegalArgumentException.class, () -> clusterer.cluster(features, new Random()));
    }

    @Test
    public void testIdenticalSpikesGetSmallestScale() {
        double[][] features = new double[20][2];
        InitialClustering clustering = new InitialClusterer(2, 5, 5).cluster(features, new Random(1));
        assertEquals(Double.MIN_VALUE, clustering.getScale());
        assertEquals(20, Arrays.stream(clustering.getSizes()).sum());
    }

    @Test
    public void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new InitialClusterer(0, 5, 10));
        assertThrows(IllegalArgumentException.class, () -> new InitialClusterer(13, 5, 10));
        assertThrows(IllegalArgumentException.class, () -> new InitialClusterer(2, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new InitialClusterer(2, 5, 0));
    }

    @Test
    public void testArgminTakesFirstMinimum() {
        assertEquals(1, InitialClusterer.argmin(new double[] { 3, 1, 1, 2 }));
    }

    @Test
    public void testScaleOfTwoPointClusters() {
        // within-cluster variance per component: 1 on the first axis, 0 on the second
        double[][] features = { { 0, 0 }, { 2, 0 }, { 10, 5 }, { 12, 5 } };
        int[] assignment = { 0, 0, 1, 1 };
        double total = new org.apache.commons.math3.stat.descriptive.moment.Variance()
                .evaluate(new double[] { 0, 2, 10, 12 });
        double between = new org.apache.commons.math3.stat.descriptive.moment.Variance()
                .evaluate(new double[] { 1, 1, 11, 11 });
        double expected = Math.sqrt(total - between) / InitialClusterer.SCALE_DIVISOR;
        assertEquals(expected, InitialClusterer.scale(features, assignment, 2, 2), 1e-12);
    }
}
