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
import com.amazon.anomalyensemble.statistics.NumericDegeneracyException;
import com.amazon.anomalyensemble.statistics.Statistics;

/**
 * Flags values that deviate from the global distribution by any of three
 * redundant tests: the standard score, interquartile range fences and the
 * median absolute deviation score. The raw score is the absolute standard
 * score.
 */
@Slf4j
public class StatisticalDetector extends AbstractDetector {

    public StatisticalDetector(EnsembleConfig config) {
        super(config);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.STATISTICAL;
    }

    @Override
    public int getMinimumLength() {
        return 1;
    }

    @Override
    protected void score(Signal signal, SortedMap<Integer, Double> scores) {
        double[] values = signal.getValues();
        int n = values.length;
        boolean[] flagged = new boolean[n];

        double[] zScores = null;
        try {
            zScores = Statistics.absoluteZScores(values);
            for (int i = 0; i < n; i++) {
                flagged[i] = zScores[i] > config.getZScoreThreshold();
            }
        } catch (NumericDegeneracyException e) {
            log.debug("z-score test skipped: {}", e.getMessage());
        }

        double q1 = Statistics.percentile(values, 25);
        double q3 = Statistics.percentile(values, 75);
        double fence = config.getIqrMultiplier() * (q3 - q1);
        for (int i = 0; i < n; i++) {
            flagged[i] |= values[i] < q1 - fence || values[i] > q3 + fence;
        }

        try {
            double[] madScores = Statistics.absoluteMadScores(values);
            for (int i = 0; i < n; i++) {
                flagged[i] |= madScores[i] > config.getMadThreshold();
            }
        } catch (NumericDegeneracyException e) {
            log.debug("MAD test skipped: {}", e.getMessage());
        }

        for (int i = 0; i < n; i++) {
            if (flagged[i]) {
                flag(scores, i, zScores == null ? 0 : zScores[i]);
            }
        }
    }
}
