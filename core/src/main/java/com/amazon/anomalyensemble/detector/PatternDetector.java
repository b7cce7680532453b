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

package com.amazon.anomalyensemble.detector;

import java.util.List;
import java.util.SortedMap;

import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.signal.Signal;
import com.amazon.anomalyensemble.statistics.NumericDegeneracyException;
import com.amazon.anomalyensemble.statistics.Statistics;

/**
 * Flags shapes that a living system does not produce: stuck flat runs,
 * second-difference oscillation (at the center of each excursion), abrupt trend
 * reversals and short-period periodicity. Every flag carries a raw score of 1.
 */
@Slf4j
public class PatternDetector extends AbstractDetector {

    public static final double RAW_SCORE = 1.0;

    public PatternDetector(EnsembleConfig config) {
        super(config);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.PATTERN_BASED;
    }

    @Override
    public int getMinimumLength() {
        return config.getMinLengthForPattern();
    }

    @Override
    protected void score(Signal signal, SortedMap<Integer, Double> scores) {
        double[] values = signal.getValues();
        flagFlatRuns(values, scores);
        flagOscillation(values, scores);
        flagTrendReversals(values, signal.getMinuteOffsets(config.getNominalIntervalMinutes()), scores);
        if (values.length >= config.getMinLengthForPeriodicity()) {
            try {
                flagPeriodicity(values, scores);
            } catch (NumericDegeneracyException e) {
                log.debug("periodicity test skipped: {}", e.getMessage());
            }
        }
    }

    void flagFlatRuns(double[] values, SortedMap<Integer, Double> scores) {
        int start = -1;
        for (int i = 1; i <= values.length; i++) {
            boolean flat = i < values.length && Math.abs(values[i] - values[i - 1]) < config.getFlatTolerance();
            if (flat) {
                if (start < 0) {
                    start = i - 1;
                }
            } else if (start >= 0) {
                if (i - start >= config.getFlatMinLength()) {
                    flagRange(scores, start, i, RAW_SCORE);
                }
                start = -1;
            }
        }
    }

    void flagOscillation(double[] values, SortedMap<Integer, Double> scores) {
        int n = values.length;
        double[] secondDiff = new double[n - 2];
        for (int j = 0; j < secondDiff.length; j++) {
            secondDiff[j] = values[j] - 2 * values[j + 1] + values[j + 2];
        }
        double threshold = Statistics.standardDeviation(secondDiff) * config.getOscillationStdMultiplier();
        for (int j = 0; j < secondDiff.length; j++) {
            double magnitude = Math.abs(secondDiff[j]);
            // neighbors of an excursion share its second difference; only the center is flagged
            boolean peak = (j == 0 || magnitude >= Math.abs(secondDiff[j - 1]))
                    && (j + 1 == secondDiff.length || magnitude >= Math.abs(secondDiff[j + 1]));
            if (magnitude > threshold && peak) {
                flag(scores, j + 1, RAW_SCORE);
            }
        }
    }

    void flagTrendReversals(double[] values, double[] minutes, SortedMap<Integer, Double> scores) {
        int window = config.getTrendWindow();
        for (int i = window; i + window <= values.length; i++) {
            double before = Statistics.slope(minutes, values, i - window, i);
            double after = Statistics.slope(minutes, values, i, i + window);
            if (Math.abs(after - before) > config.getTrendChangeThreshold()) {
                flag(scores, i, RAW_SCORE);
            }
        }
    }

    void flagPeriodicity(double[] values, SortedMap<Integer, Double> scores) {
        double[] autocorrelation = Statistics.autocorrelation(values, config.getAutocorrMaxLag());
        List<Integer> peaks = Statistics.localPeaks(autocorrelation, 1, autocorrelation.length,
                config.getAutocorrPeakHeightRatio() * autocorrelation[0]);
        if (peaks.size() <= config.getAutocorrMaxPeaks()) {
            return;
        }
        int lag = peaks.get(0);
        for (int peak : peaks) {
            if (autocorrelation[peak] > autocorrelation[lag]) {
                lag = peak;
            }
        }
        log.debug("{} autocorrelation peaks, dominant lag {}", peaks.size(), lag);
        flagEvery(values, lag, RAW_SCORE, scores);
    }
}
