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

package com.amazon.spikesort.runner;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.spikesort.config.SortingConfig;
import com.amazon.spikesort.inputtypes.ElectrodeData;

public class SpikeSortRunnerTest {

    private SpikeSortRunner runner;
    private BufferedReader in;
    private PrintWriter out;

    @BeforeEach
    public void setUp() {
        runner = new SpikeSortRunner();
        runner.parse("--bisections", "1", "--min-spikes", "2", "--delimiter", ",", "--header-row", "true");
        in = mock(BufferedReader.class);
        out = mock(PrintWriter.class);
    }

    @Test
    public void testWriteHeader() {
        runner.prepareAlgorithm(2);
        runner.writeHeader(new String[] { "electrode", "x" }, out);
        verify(out).println("electrode,x,initial_cluster,cluster");
    }

    @Test
    public void testUnsortableElectrodeGetsNA() throws IOException {
        when(in.readLine()).thenReturn("electrode,x").thenReturn("7,1.5").thenReturn(null);
        runner.run(in, out);
        verify(out).println("electrode,x,initial_cluster,cluster");
        verify(out).println("7,1.5,NA,NA");
    }

    @Test
    public void testRun() throws IOException {
        String input = String.join("\n", "electrode,x", "1,0", "2,5", "1,10", "1,1", "1,11", "2,6", "3,4");
        StringWriter buffer = new StringWriter();
        runner.run(new BufferedReader(new StringReader(input)), new PrintWriter(buffer));

        String[] lines = buffer.toString().split("\\R");
        assertEquals(8, lines.length);
        assertEquals("electrode,x,initial_cluster,cluster", lines[0]);

        String[][] rows = new String[7][];
        for (int r = 0; r < 7; r++) {
            rows[r] = lines[r + 1].split(",");
            assertEquals(4, rows[r].length);
        }
        assertArrayEquals(new String[] { "1", "0" }, Arrays.copyOf(rows[0], 2));
        // electrode 1 has two groups; the quieter one is cluster 1
        assertEquals("1", rows[0][3]);
        assertEquals("1", rows[3][3]);
        assertEquals("2", rows[2][3]);
        assertEquals("2", rows[4][3]);
        assertEquals(rows[0][2], rows[3][2]);
        assertEquals(rows[2][2], rows[4][2]);
        assertNotEquals(rows[0][2], rows[2][2]);
        // electrode 2 is a single group
        assertEquals("1", rows[1][3]);
        assertEquals("1", rows[5][3]);
        // electrode 3 has too few spikes
        assertEquals("NA", rows[6][2]);
        assertEquals("NA", rows[6][3]);
    }

    @Test
    public void testFeatureCountSplitsColumns() {
        SpikeSortRunner split = new SpikeSortRunner();
        split.parse("--feature-count", "1");
        split.prepareAlgorithm(4);
        split.processLine(new String[] { "3", "0.5", "1", "2" });
        split.processLine(new String[] { "3", "1.5", "3", "4" });
        ElectrodeData data = split.toElectrodeData(3, Arrays.asList(0, 1));
        assertEquals(1, data.getDimensions());
        assertEquals(2, data.getWaveformLength());
        assertArrayEquals(new double[] { 1.5 }, data.getFeature(1));
        assertArrayEquals(new double[] { 3, 4 }, data.getWaveform(1));
    }

    @Test
    public void testInvalidRows() {
        runner.prepareAlgorithm(2);
        assertThrows(IllegalArgumentException.class, () -> runner.processLine(new String[] { "1", "2", "3" }));
        assertThrows(IllegalArgumentException.class, () -> runner.prepareAlgorithm(1));

        SpikeSortRunner split = new SpikeSortRunner();
        split.parse("--feature-count", "3");
        assertThrows(IllegalArgumentException.class, () -> split.prepareAlgorithm(4));
    }

    @Test
    public void testArgumentsBuildConfig() {
        ArgumentParser parser = new ArgumentParser("runner", "description");
        parser.parse("-b", "4", "-m", "3", "-k", "7", "-c", "0", "--bootstrap-samples", "100", "-a", "0.05", "-p",
                "90", "--random-seed", "9", "-t", "2");
        SortingConfig config = parser.toConfig();
        assertEquals(4, config.getBisections());
        assertEquals(3, config.getMaxAssignments());
        assertEquals(7, config.getMinSpikes());
        assertEquals(0.0, config.getDefaultCutoff());
        assertEquals(100, config.getBootstrapSamples());
        assertEquals(0.05, config.getAlpha());
        assertEquals(90.0, config.getPercentile());
        assertEquals(Optional.of(9L), config.getRandomSeed());
        assertTrue(config.isParallelExecutionEnabled());
        assertEquals(2, config.getThreadPoolSize());
    }
}
