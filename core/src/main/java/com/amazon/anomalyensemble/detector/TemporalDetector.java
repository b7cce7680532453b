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

import java.util.SortedMap;

import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.signal.Signal;
import com.amazon.anomalyensemble.statistics.Statistics;

/**
 * Time-series detector: sampling gaps outside the expected interval band, large
 * residuals against a trailing moving-average prediction, and local z-scores
 * within a symmetric window. The gap test needs timestamps and is skipped
 * without them. Raw scores are 1.
 */
@Slf4j
public class TemporalDetector extends AbstractDetector {

    public static final double RAW_SCORE = 1.0;

    public TemporalDetector(EnsembleConfig config) {
        super(config);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.TEMPORAL;
    }

    @Override
    public int getMinimumLength() {
        return 2;
    }

    @Override
    protected void score(Signal signal, SortedMap<Integer, Double> scores) {
        if (signal.hasTimestamps()) {
            flagGaps(signal, scores);
        } else {
            log.debug("no timestamps, sampling gap test skipped");
        }
        if (signal.size() >= config.getMinLengthForLocalZ()) {
            double[] values = signal.getValues();
            flagPredictionResiduals(values, scores);
            flagLocalZScores(values, scores);
        }
    }

    void flagGaps(Signal signal, SortedMap<Integer, Double> scores) {
        for (int i = 0; i + 1 < signal.size(); i++) {
            double interval = signal.minutesBetween(i, i + 1, config.getNominalIntervalMinutes());
            if (interval < config.getMinIntervalMinutes() || interval > config.getMaxIntervalMinutes()) {
                flag(scores, i, RAW_SCORE);
                flag(scores, i + 1, RAW_SCORE);
            }
        }
    }

    void flagPredictionResiduals(double[] values, SortedMap<Integer, Double> scores) {
        int window = config.getPredictionWindow();
        // flagged readings enter the history as their prediction
        double[] history = values.clone();
        for (int i = window; i < values.length; i++) {
            double predicted = Statistics.mean(history, i - window, i);
            if (Math.abs(values[i] - predicted) > config.getPredictionErrorThreshold()) {
                flag(scores, i, RAW_SCORE);
                history[i] = predicted;
            }
        }
    }

    void flagLocalZScores(double[] values, SortedMap<Integer, Double> scores) {
        int half = config.getLocalWindow();
        for (int i = half; i + half < values.length; i++) {
            double std = Statistics.standardDeviation(values, i - half, i + half + 1);
            if (std == 0) {
                continue;
            }
            double z = Math.abs(values[i] - Statistics.mean(values, i - half, i + half + 1)) / std;
            if (z > config.getLocalZThreshold()) {
                flag(scores, i, RAW_SCORE);
            }
        }
    }
}
