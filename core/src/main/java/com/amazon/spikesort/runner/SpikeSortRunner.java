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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.spikesort.SpikeSorter;
import com.amazon.spikesort.inputtypes.ElectrodeData;
import com.amazon.spikesort.manual.FinalClustering;
import com.amazon.spikesort.manual.ManualMergeSession;
import com.amazon.spikesort.returntypes.ElectrodeOutcome;
import com.amazon.spikesort.returntypes.ElectrodeSortResult;

/**
 * A command-line application that sorts the spikes of every electrode in a
 * delimited file. Each input row is one spike: the electrode id, the feature
 * values and the waveform samples. Each output row is the input row followed by
 * the spike's initial cluster and its final cluster, both counted from 1, with
 * final clusters numbered by ascending waveform RMS. Spikes of electrodes that
 * could not be sorted get NA.
 */
public class SpikeSortRunner {

    private static final Logger LOG = LoggerFactory.getLogger(SpikeSortRunner.class);

    public static final List<String> RESULT_COLUMN_NAMES = Arrays.asList("initial_cluster", "cluster");
    public static final List<String> EMPTY_RESULT_VALUE = Arrays.asList("NA", "NA");

    protected final ArgumentParser argumentParser;
    protected SpikeSorter sorter;
    protected int columns;
    protected int lineNumber;
    protected final List<String[]> rows = new ArrayList<>();
    protected final Map<Integer, List<Integer>> rowsByElectrode = new LinkedHashMap<>();

    public SpikeSortRunner() {
        this(new ArgumentParser(SpikeSortRunner.class.getName(),
                "Sort the spikes of every electrode by interface energy clustering and merging."));
    }

    public SpikeSortRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        SpikeSortRunner runner = new SpikeSortRunner();
        runner.parse(args);
        System.out.println("Reading from stdin... (Ctrl-c to exit)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
        System.out.println("Done.");
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            String[] values = line.split(argumentParser.getDelimiter());

            if (sorter == null) {
                prepareAlgorithm(values.length);
            }

            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                writeHeader(values, out);
                continue;
            }

            processLine(values);
        }

        finish(out);
        out.flush();
    }

    protected void prepareAlgorithm(int columns) {
        if (columns < 2) {
            throw new IllegalArgumentException("a row needs an electrode id and at least one feature");
        }
        int features = argumentParser.getFeatureCount();
        if (features > 0 && features + 1 >= columns) {
            throw new IllegalArgumentException(String.format(
                    "%d feature columns leave no waveform samples in rows of %d columns", features, columns));
        }
        this.columns = columns;
        sorter = new SpikeSorter(argumentParser.toConfig());
    }

    protected void writeHeader(String[] values, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        RESULT_COLUMN_NAMES.forEach(joiner::add);
        out.println(joiner.toString());
    }

    /**
     * Buffers one spike. Electrodes can only be sorted once all of their spikes
     * have been read.
     */
    protected void processLine(String[] values) {
        if (values.length != columns) {
            throw new IllegalArgumentException(String.format("Wrong number of values on line %d. Expected %d but found %d.",
                    lineNumber, columns, values.length));
        }
        int electrode = Integer.parseInt(values[0].trim());
        rowsByElectrode.computeIfAbsent(electrode, e -> new ArrayList<>()).add(rows.size());
        rows.add(values);
    }

    protected void finish(PrintWriter out) {
        List<ElectrodeData> electrodes = new ArrayList<>();
        for (Map.Entry<Integer, List<Integer>> entry : rowsByElectrode.entrySet()) {
            electrodes.add(toElectrodeData(entry.getKey(), entry.getValue()));
        }

        Map<Integer, List<String>> results = new HashMap<>();
        List<ElectrodeOutcome> outcomes = sorter == null ? new ArrayList<>() : sorter.sortAll(electrodes);
        for (int e = 0; e < outcomes.size(); e++) {
            ElectrodeOutcome outcome = outcomes.get(e);
            List<Integer> electrodeRows = rowsByElectrode.get(outcome.getElectrodeId());
            if (!outcome.isSuccess()) {
                LOG.warn("electrode {} could not be sorted, writing NA", outcome.getElectrodeId());
                continue;
            }
            ElectrodeSortResult result = outcome.getResult();
            FinalClustering clustering = ManualMergeSession.of(result, electrodes.get(e)).finalizeClusters();
            int[] initial = result.getInitialAssignment();
            int[] clusters = clustering.getAssignment();
            for (int s = 0; s < electrodeRows.size(); s++) {
                results.put(electrodeRows.get(s),
                        Arrays.asList(Integer.toString(initial[s] + 1), Integer.toString(clusters[s])));
            }
        }

        for (int r = 0; r < rows.size(); r++) {
            StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
            Arrays.stream(rows.get(r)).forEach(joiner::add);
            results.getOrDefault(r, EMPTY_RESULT_VALUE).forEach(joiner::add);
            out.println(joiner.toString());
        }
    }

    ElectrodeData toElectrodeData(int electrode, List<Integer> electrodeRows) {
        int features = argumentParser.getFeatureCount();
        double[][] values = new double[electrodeRows.size()][];
        for (int s = 0; s < values.length; s++) {
            String[] row = rows.get(electrodeRows.get(s));
            values[s] = new double[columns - 1];
            for (int c = 1; c < columns; c++) {
                values[s][c - 1] = Double.parseDouble(row[c]);
            }
        }
        if (features == 0) {
            return ElectrodeData.ofFeatures(electrode, values);
        }
        double[][] featureValues = new double[values.length][];
        double[][] waveforms = new double[values.length][];
        for (int s = 0; s < values.length; s++) {
            featureValues[s] = Arrays.copyOfRange(values[s], 0, features);
            waveforms[s] = Arrays.copyOfRange(values[s], features, values[s].length);
        }
        return new ElectrodeData(electrode, featureValues, waveforms);
    }
}
