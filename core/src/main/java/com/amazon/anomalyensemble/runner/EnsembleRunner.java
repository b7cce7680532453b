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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.StringJoiner;
import java.util.stream.Collectors;

import com.amazon.anomalyensemble.AnomalyEnsemble;
import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.returntypes.AnalysisRunResult;
import com.amazon.anomalyensemble.returntypes.FusedAnomaly;
import com.amazon.anomalyensemble.signal.AnalysisContext;
import com.amazon.anomalyensemble.signal.MalformedSignalException;
import com.amazon.anomalyensemble.signal.Signal;

/**
 * A command-line application that analyzes one signal. Readings are read from
 * STDIN as {@code timestamp,value} or {@code value} rows; one row per fused
 * anomaly is written to STDOUT as
 * {@code index,timestamp,value,score,tier,methods}.
 */
public class EnsembleRunner {

    public static final String[] OUTPUT_COLUMNS = { "index", "timestamp", "value", "score", "tier", "methods" };

    static final DateTimeFormatter LOCAL_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    protected final ArgumentParser argumentParser;
    protected int lineNumber;

    public EnsembleRunner() {
        this(new ArgumentParser(EnsembleRunner.class.getName(),
                "Detect anomalies in a glucose series and write the fused, confidence-ranked anomalies."));
    }

    public EnsembleRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        EnsembleRunner runner = new EnsembleRunner();
        runner.parse(args);
        System.err.println("Reading from stdin... (Ctrl-d to finish)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        System.err.println("Done.");
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        Signal signal = readSignal(in);
        AnalysisContext context = new AnalysisContext(argumentParser.getZone(), argumentParser.getTimeOfDay());
        AnalysisRunResult result;
        try (AnomalyEnsemble ensemble = new AnomalyEnsemble(argumentParser.toConfig())) {
            result = ensemble.run(signal, context);
        }

        if (argumentParser.getHeaderRow()) {
            out.println(String.join(argumentParser.getDelimiter(), OUTPUT_COLUMNS));
        }
        for (FusedAnomaly anomaly : result.getFusedAnomalies()) {
            if (anomaly.getConfidenceTier() == argumentParser.getMinimumTier()
                    || anomaly.getConfidenceTier().isAbove(argumentParser.getMinimumTier())) {
                out.println(formatAnomaly(anomaly, signal));
            }
        }
        out.flush();
    }

    protected Signal readSignal(BufferedReader in) throws IOException {
        Signal.Builder builder = Signal.builder();
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                continue;
            }
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] values = line.split(argumentParser.getDelimiter());
            if (values.length == 1) {
                builder.add(parseValue(values[0]));
            } else if (values.length == 2) {
                builder.add(parseTimestamp(values[0], argumentParser.getZone()), parseValue(values[1]));
            } else {
                throw new MalformedSignalException(String.format(
                        "Wrong number of values on line %d. Expected 1 or 2 but found %d.", lineNumber, values.length));
            }
        }
        return builder.build();
    }

    protected double parseValue(String field) {
        try {
            return Double.parseDouble(field.trim()) * argumentParser.getUnitFactor();
        } catch (NumberFormatException e) {
            throw new MalformedSignalException(
                    String.format("Non-numeric value '%s' on line %d.", field.trim(), lineNumber));
        }
    }

    /**
     * Accepts an ISO-8601 instant or a local date-time {@code yyyy-MM-dd HH:mm[:ss]}
     * read in the given zone.
     */
    protected Instant parseTimestamp(String field, ZoneId zone) {
        String text = field.trim();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text, LOCAL_TIMESTAMP).atZone(zone).toInstant();
            } catch (DateTimeParseException inner) {
                throw new MalformedSignalException(
                        String.format("Unparseable timestamp '%s' on line %d.", text, lineNumber));
            }
        }
    }

    protected String formatAnomaly(FusedAnomaly anomaly, Signal signal) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        joiner.add(Integer.toString(anomaly.getIndex()));
        Instant timestamp = signal.getTimestamp(anomaly.getIndex());
        joiner.add(timestamp == null ? "" : timestamp.toString());
        joiner.add(String.format(Locale.ROOT, "%.1f", signal.getValue(anomaly.getIndex())));
        joiner.add(String.format(Locale.ROOT, "%.4f", anomaly.getTotalScore()));
        joiner.add(anomaly.getConfidenceTier().name().toLowerCase(Locale.ROOT));
        joiner.add(anomaly.getSupportingMethods().stream().map(DetectionMethod::getKey)
                .collect(Collectors.joining("|")));
        return joiner.toString();
    }
}
