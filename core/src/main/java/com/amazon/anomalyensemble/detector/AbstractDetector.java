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

import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.signal.Signal;
import com.amazon.anomalyensemble.statistics.NumericDegeneracyException;

/**
 * Common plumbing of the detectors: the minimum length guard, the conversion of
 * flagged positions into candidates, and the degrade-to-empty policy for
 * numeric degeneracy.
 */
@Slf4j
public abstract class AbstractDetector implements Detector {

    protected final EnsembleConfig config;

    protected AbstractDetector(EnsembleConfig config) {
        this.config = checkNotNull(config, "config must not be null");
    }

    @Override
    public List<Candidate> detect(Signal signal) {
        checkNotNull(signal, "signal must not be null");
        if (signal.size() < getMinimumLength()) {
            log.debug("{} detector needs at least {} samples, signal has {}", getMethod().getKey(),
                    getMinimumLength(), signal.size());
            return Collections.emptyList();
        }

        SortedMap<Integer, Double> scores = new TreeMap<>();
        try {
            score(signal, scores);
        } catch (NumericDegeneracyException e) {
            log.debug("{} detector degraded to empty: {}", getMethod().getKey(), e.getMessage());
            return Collections.emptyList();
        }

        List<Candidate> candidates = new ArrayList<>(scores.size());
        scores.forEach((index, score) -> candidates.add(new Candidate(index, getMethod(), score)));
        log.debug("{} detector flagged {} of {} samples", getMethod().getKey(), candidates.size(), signal.size());
        return Collections.unmodifiableList(candidates);
    }

    /**
     * Flags positions of a signal that is at least {@link #getMinimumLength()}
     * long.
     *
     * @param signal the signal
     * @param scores raw score by flagged index, to be filled in
     */
    protected abstract void score(Signal signal, SortedMap<Integer, Double> scores);

    /**
     * Records a flag, keeping the larger score when an index is flagged twice.
     */
    protected static void flag(Map<Integer, Double> scores, int index, double score) {
        scores.merge(index, score, Math::max);
    }

    protected static void flagRange(Map<Integer, Double> scores, int from, int to, double score) {
        for (int i = from; i < to; i++) {
            flag(scores, i, score);
        }
    }

    /**
     * Flags every period-th position, starting at the largest value of the first
     * period.
     */
    protected static void flagEvery(double[] values, int period, double score, Map<Integer, Double> scores) {
        int start = 0;
        for (int i = 1; i < Math.min(period, values.length); i++) {
            if (values[i] > values[start]) {
                start = i;
            }
        }
        for (int i = start; i < values.length; i += period) {
            flag(scores, i, score);
        }
    }
}
