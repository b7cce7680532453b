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

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.signal.Signal;

/**
 * Domain-knowledge detector. Each position is scored by the most severe
 * {@link PhysiologicalViolation} it takes part in.
 */
@Slf4j
public class PhysiologicalDetector extends AbstractDetector {

    // values are grouped by their rounding to one decimal
    private static final double REPEAT_RESOLUTION = 10.0;

    public PhysiologicalDetector(EnsembleConfig config) {
        super(config);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.PHYSIOLOGICAL;
    }

    @Override
    public int getMinimumLength() {
        return 1;
    }

    @Override
    protected void score(Signal signal, SortedMap<Integer, Double> scores) {
        double[] values = signal.getValues();
        flagLimits(values, scores);
        flagRateOfChange(signal, scores);
        flagSustained(values, scores);
        flagRepeatedValues(values, scores);
    }

    void flagLimits(double[] values, SortedMap<Integer, Double> scores) {
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (v < config.getAbsoluteMin() || v > config.getAbsoluteMax()) {
                flag(scores, i, PhysiologicalViolation.ABSOLUTE_LIMIT.getSeverity());
            } else if (v < config.getExtremeMin() || v > config.getExtremeMax()) {
                flag(scores, i, PhysiologicalViolation.EXTREME_VALUE.getSeverity());
            }
        }
    }

    /**
     * A violating pair flags its later sample, unless the next pair violates in
     * the opposite direction; such an isolated spike flags only its middle
     * sample.
     */
    void flagRateOfChange(Signal signal, SortedMap<Integer, Double> scores) {
        int n = signal.size();
        double[] rates = new double[n];
        boolean[] violating = new boolean[n];
        for (int j = 1; j < n; j++) {
            double minutes = signal.minutesBetween(j - 1, j, config.getNominalIntervalMinutes());
            if (minutes <= 0) {
                continue;
            }
            rates[j] = (signal.getValue(j) - signal.getValue(j - 1)) / minutes;
            violating[j] = Math.abs(rates[j]) > config.getMaxRateOfChange();
        }
        double severity = PhysiologicalViolation.RATE_OF_CHANGE.getSeverity();
        for (int j = 1; j < n; j++) {
            if (!violating[j]) {
                continue;
            }
            flag(scores, j, severity);
            if (j + 1 < n && violating[j + 1] && Math.signum(rates[j]) != Math.signum(rates[j + 1])) {
                j++;
            }
        }
    }

    void flagSustained(double[] values, SortedMap<Integer, Double> scores) {
        flagRuns(values, true, config.getSustainedHigh(), config.getSustainedHighMinLength(), scores);
        flagRuns(values, false, config.getSustainedLow(), config.getSustainedLowMinLength(), scores);
    }

    private void flagRuns(double[] values, boolean above, double limit, int minLength,
            SortedMap<Integer, Double> scores) {
        int start = -1;
        for (int i = 0; i <= values.length; i++) {
            boolean inRun = i < values.length && (above ? values[i] > limit : values[i] < limit);
            if (inRun && start < 0) {
                start = i;
            } else if (!inRun && start >= 0) {
                if (i - start >= minLength) {
                    flagRange(scores, start, i, PhysiologicalViolation.SUSTAINED_EXTREME.getSeverity());
                }
                start = -1;
            }
        }
    }

    void flagRepeatedValues(double[] values, SortedMap<Integer, Double> scores) {
        Map<Long, Integer> counts = new TreeMap<>();
        for (double v : values) {
            counts.merge(Math.round(v * REPEAT_RESOLUTION), 1, Integer::sum);
        }
        double ratioLimit = config.getRepeatedValueRatio() * values.length;
        for (int i = 0; i < values.length; i++) {
            int count = counts.get(Math.round(values[i] * REPEAT_RESOLUTION));
            if (count > ratioLimit && count > config.getRepeatedValueMinCount()) {
                flag(scores, i, PhysiologicalViolation.REPEATED_VALUE.getSeverity());
            }
        }
    }
}
