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

package com.amazon.anomalyensemble.runner;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import lombok.AccessLevel;
import lombok.Getter;

import com.amazon.anomalyensemble.config.ConfidenceTier;
import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;

/**
 * Command-line options of the ensemble runner. Every option has a long flag and
 * may have a short one; each flag takes exactly one value.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/anomaly-ensemble-core-1.0.0.jar";

    /** Conversion factor from mmol/L to mg/dL for glucose. */
    public static final double MMOL_TO_MGDL = 18.0;

    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Option<?>> flags = new HashMap<>();
    private final List<Option<?>> options = new ArrayList<>();

    private final Option<String> delimiter;
    private final Option<Boolean> headerRow;
    private final Option<String> unit;
    private final Option<ZoneId> zone;
    private final Option<Boolean> timeOfDay;
    private final Option<Double> scoreFloor;
    private final Option<ConfidenceTier> minimumTier;
    private final Option<Boolean> calibrateWeights;
    private final Option<Set<DetectionMethod>> methods;
    private final Option<Boolean> parallelExecution;
    private final Option<Integer> threadPoolSize;

    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;

        delimiter = register(new Option<>("-d", "--delimiter", "field delimiter of input and output rows", ",",
                Function.identity()));
        headerRow = register(new Option<>(null, "--header-row",
                "'true' if the input starts with a header row; a header is then also written", false,
                Boolean::parseBoolean));
        unit = register(new Option<>("-u", "--unit", "unit of the readings, 'mgdl' or 'mmol'", "mgdl", u -> {
            String lower = u.toLowerCase(Locale.ROOT);
            checkArgument("mgdl".equals(lower) || "mmol".equals(lower), "unit must be 'mgdl' or 'mmol'");
            return lower;
        }));
        zone = register(new Option<>("-z", "--zone", "time zone of local timestamps and time-of-day rules",
                ZoneId.of("UTC"), ZoneId::of));
        timeOfDay = register(new Option<>(null, "--time-of-day",
                "'false' to ignore time of day even when timestamps are present", true, Boolean::parseBoolean));
        scoreFloor = register(new Option<>("-f", "--score-floor", "adjusted scores below this are dropped",
                EnsembleConfig.DEFAULT_SCORE_FLOOR, x -> {
                    double value = Double.parseDouble(x);
                    checkArgument(value >= 0, "score floor must be non-negative");
                    return value;
                }));
        minimumTier = register(new Option<>("-m", "--minimum-tier", "lowest tier written: high, medium or low",
                ConfidenceTier.LOW, t -> ConfidenceTier.valueOf(t.trim().toUpperCase(Locale.ROOT))));
        calibrateWeights = register(new Option<>(null, "--calibrate-weights",
                "'true' to calibrate method weights from the relationships of the run", false,
                Boolean::parseBoolean));
        methods = register(new Option<>(null, "--methods",
                "comma separated methods to enable, e.g. 'statistical,physiological', or 'all'",
                EnumSet.allOf(DetectionMethod.class), ArgumentParser::parseMethods));
        parallelExecution = register(new Option<>(null, "--parallel", "'false' to run the detectors sequentially",
                true, Boolean::parseBoolean));
        threadPoolSize = register(new Option<>("-t", "--thread-pool-size", "threads running the detectors",
                EnsembleConfig.DEFAULT_THREAD_POOL_SIZE, n -> {
                    int value = Integer.parseInt(n);
                    checkArgument(value > 0, "thread pool size must be positive");
                    return value;
                }));
    }

    protected <T> Option<T> register(Option<T> option) {
        checkNotNull(option, "option must not be null");
        checkArgument(!flags.containsKey(option.getLongFlag()), "duplicate flag " + option.getLongFlag());
        flags.put(option.getLongFlag(), option);
        if (option.getShortFlag() != null) {
            checkArgument(!flags.containsKey(option.getShortFlag()), "duplicate flag " + option.getShortFlag());
            flags.put(option.getShortFlag(), option);
        }
        options.add(option);
        return option;
    }

    /**
     * Parses flag and value pairs. Prints the usage and exits on an unknown flag,
     * a missing value or a value that does not parse.
     *
     * @param arguments the command-line arguments
     */
    public void parse(String... arguments) {
        for (int i = 0; i < arguments.length; i += 2) {
            String flag = arguments[i];
            if ("-h".equals(flag) || "--help".equals(flag)) {
                printUsage();
                Runtime.getRuntime().exit(0);
            }
            Option<?> option = flags.get(flag);
            if (option == null) {
                printUsageAndExit("unknown option %s", flag);
            } else if (i + 1 >= arguments.length) {
                printUsageAndExit("option %s needs a value", flag);
            } else {
                try {
                    option.parse(arguments[i + 1]);
                } catch (RuntimeException e) {
                    printUsageAndExit("bad value '%s' for %s: %s", arguments[i + 1], flag, e.getMessage());
                }
            }
        }
    }

    public void printUsage() {
        System.out.println(String.format("Usage: java -jar %s [options] < input_file > output_file", ARCHIVE_NAME));
        System.out.println();
        System.out.println(runnerClass + ": " + runnerDescription);
        System.out.println();
        System.out.println("Options:");
        options.forEach(option -> System.out.println("  " + option.usage()));
        System.out.println("  --help, -h  print this message and exit");
    }

    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    /**
     * @return an ensemble configuration with the parsed options applied to the
     *         defaults
     */
    public EnsembleConfig toConfig() {
        return EnsembleConfig.builder().scoreFloor(getScoreFloor()).weightCalibrationEnabled(getCalibrateWeights())
                .enabledMethods(getMethods()).parallelExecutionEnabled(getParallelExecution())
                .threadPoolSize(getThreadPoolSize()).build();
    }

    public String getDelimiter() {
        return delimiter.getValue();
    }

    public boolean getHeaderRow() {
        return headerRow.getValue();
    }

    public double getUnitFactor() {
        return "mmol".equals(unit.getValue()) ? MMOL_TO_MGDL : 1.0;
    }

    public ZoneId getZone() {
        return zone.getValue();
    }

    public boolean getTimeOfDay() {
        return timeOfDay.getValue();
    }

    public double getScoreFloor() {
        return scoreFloor.getValue();
    }

    public ConfidenceTier getMinimumTier() {
        return minimumTier.getValue();
    }

    public boolean getCalibrateWeights() {
        return calibrateWeights.getValue();
    }

    public Set<DetectionMethod> getMethods() {
        return EnumSet.copyOf(methods.getValue());
    }

    static Set<DetectionMethod> parseMethods(String value) {
        if ("all".equalsIgnoreCase(value.trim())) {
            return EnumSet.allOf(DetectionMethod.class);
        }
        Set<DetectionMethod> result = EnumSet.noneOf(DetectionMethod.class);
        for (String key : value.split(",")) {
            result.add(DetectionMethod.fromKey(key.trim()));
        }
        return result;
    }

    public boolean getParallelExecution() {
        return parallelExecution.getValue();
    }

    public int getThreadPoolSize() {
        return threadPoolSize.getValue();
    }

    /**
     * One option: its flags, help text and current value.
     *
     * @param <T> type of the parsed value
     */
    @Getter
    public static class Option<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        @Getter(AccessLevel.NONE)
        private final Function<String, T> parser;
        private T value;

        /**
         * @param shortFlag    short flag, or null
         * @param longFlag     long flag
         * @param description  help text
         * @param defaultValue value when the flag is absent
         * @param parser       converts and validates the text of the flag; throws
         *                     on a bad value
         */
        public Option(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parser) {
            this.shortFlag = shortFlag;
            this.longFlag = checkNotNull(longFlag, "longFlag must not be null");
            this.description = description;
            this.defaultValue = defaultValue;
            this.parser = checkNotNull(parser, "parser must not be null");
            this.value = defaultValue;
        }

        public void parse(String text) {
            value = parser.apply(text);
        }

        String usage() {
            String names = shortFlag == null ? longFlag : longFlag + ", " + shortFlag;
            return String.format("%-26s %s (default: %s)", names, description, defaultValue);
        }
    }
}
