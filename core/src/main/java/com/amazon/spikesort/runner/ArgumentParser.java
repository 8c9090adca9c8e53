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

import static com.amazon.spikesort.CommonUtils.checkArgument;
import static com.amazon.spikesort.CommonUtils.checkNotNull;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.spikesort.config.SortingConfig;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/spikesort-core-1.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final IntegerArgument bisections;
    private final IntegerArgument maxAssignments;
    private final IntegerArgument minSpikes;
    private final DoubleArgument defaultCutoff;
    private final IntegerArgument bootstrapSamples;
    private final DoubleArgument alpha;
    private final DoubleArgument percentile;
    private final IntegerArgument featureCount;
    private final StringArgument delimiter;
    private final BooleanArgument headerRow;
    private final IntegerArgument randomSeed;
    private final IntegerArgument threads;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        bisections = new IntegerArgument("-b", "--bisections", "Number of bisections of the initial clustering.",
                SortingConfig.DEFAULT_BISECTIONS, n -> checkArgument(n > 0 && n <= SortingConfig.MAX_BISECTIONS,
                        "bisections should be between 1 and " + SortingConfig.MAX_BISECTIONS));
        addArgument(bisections);

        maxAssignments = new IntegerArgument("-m", "--max-assignments",
                "Maximum number of assignment passes after each bisection.", SortingConfig.DEFAULT_MAX_ASSIGNMENTS,
                n -> checkArgument(n > 0, "max assignments should be greater than 0"));
        addArgument(maxAssignments);

        minSpikes = new IntegerArgument("-k", "--min-spikes", "Minimum number of spikes in an initial cluster.",
                SortingConfig.DEFAULT_MIN_SPIKES, n -> checkArgument(n > 0, "min spikes should be greater than 0"));
        addArgument(minSpikes);

        defaultCutoff = new DoubleArgument("-c", "--cutoff",
                "Connection strength cutoff, or 0 to estimate it by bootstrap.", SortingConfig.DEFAULT_CUTOFF,
                x -> checkArgument(x >= 0 && x <= 1, "cutoff should be between 0 and 1"));
        addArgument(defaultCutoff);

        bootstrapSamples = new IntegerArgument(null, "--bootstrap-samples",
                "Number of bootstrap resamples used to estimate the cutoff.", SortingConfig.DEFAULT_BOOTSTRAP_SAMPLES,
                n -> checkArgument(n > 0, "bootstrap samples should be greater than 0"));
        addArgument(bootstrapSamples);

        alpha = new DoubleArgument("-a", "--alpha", "Significance level of the bootstrap confidence interval.",
                SortingConfig.DEFAULT_ALPHA, x -> checkArgument(x > 0 && x < 1, "alpha should be between 0 and 1"));
        addArgument(alpha);

        percentile = new DoubleArgument("-p", "--percentile",
                "Percentile of the connection strengths that is bootstrapped.", SortingConfig.DEFAULT_PERCENTILE,
                x -> checkArgument(x >= 0 && x <= 100, "percentile should be between 0 and 100"));
        addArgument(percentile);

        featureCount = new IntegerArgument("-f", "--feature-count",
                "Number of feature columns after the electrode column, the rest being waveform samples, or 0 to "
                        + "use every column as both feature and waveform.",
                0, n -> checkArgument(n >= 0, "feature count should be non-negative"));
        addArgument(featureCount);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                ",");
        addArgument(delimiter);

        headerRow = new BooleanArgument(null, "--header-row", "Set to 'true' if the data contains a header row.",
                false);
        addArgument(headerRow);

        randomSeed = new IntegerArgument(null, "--random-seed", "Random seed to use in clustering and bootstrap.", 42);
        addArgument(randomSeed);

        threads = new IntegerArgument("-t", "--threads",
                "Number of threads used to sort electrodes in parallel, or 1 to sort them sequentially.", 1,
                n -> checkArgument(n > 0, "threads should be greater than 0"));
        addArgument(threads);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that
     *                 should be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(
                String.format("Usage: java -cp %s %s [options] < input_file > output_file", ARCHIVE_NAME, runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    /**
     * @return the sorting configuration described by the parsed arguments
     */
    public SortingConfig toConfig() {
        return SortingConfig.builder().bisections(getBisections()).maxAssignments(getMaxAssignments())
                .minSpikes(getMinSpikes()).defaultCutoff(getDefaultCutoff()).bootstrapSamples(getBootstrapSamples())
                .alpha(getAlpha()).percentile(getPercentile()).randomSeed(getRandomSeed())
                .parallelExecutionEnabled(getThreads() > 1).threadPoolSize(getThreads()).build();
    }

    public int getBisections() {
        return bisections.getValue();
    }

    public int getMaxAssignments() {
        return maxAssignments.getValue();
    }

    public int getMinSpikes() {
        return minSpikes.getValue();
    }

    public double getDefaultCutoff() {
        return defaultCutoff.getValue();
    }

    public int getBootstrapSamples() {
        return bootstrapSamples.getValue();
    }

    public double getAlpha() {
        return alpha.getValue();
    }

    public double getPercentile() {
        return percentile.getValue();
    }

    /**
     * @return the number of feature columns, 0 if every column is a feature
     */
    public int getFeatureCount() {
        return featureCount.getValue();
    }

    /**
     * @return the user-specified value of the delimiter parameter
     */
    public String getDelimiter() {
        return delimiter.getValue();
    }

    /**
     * @return the user-specified value of the header-row parameter
     */
    public boolean getHeaderRow() {
        return headerRow.getValue();
    }

    /**
     * @return the user-specified value of the random-seed parameter
     */
    public int getRandomSeed() {
        return randomSeed.getValue();
    }

    public int getThreads() {
        return threads.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }
    }
}
