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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.anomalyensemble.TestUtils;
import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.signal.Signal;
import com.amazon.anomalyensemble.testutils.GlucoseDataSets;

public class FrequencyDetectorTest {

    private FrequencyDetector detector;

    @BeforeEach
    public void setUp() {
        detector = new FrequencyDetector(EnsembleConfig.defaults());
    }

    private static double[] burst() {
        double[] values = GlucoseDataSets.constant(60, 100);
        for (int i = 20; i < 30; i++) {
            values[i] = (i % 2 == 0) ? 120 : 80;
        }
        return values;
    }

    @Test
    public void testSpectralPeakInPeriodBandFlagsEveryCycle() {
        double[] values = new double[64];
        for (int t = 0; t < values.length; t++) {
            values[t] = 100 + 20 * Math.cos(2 * Math.PI * t / 8);
        }
        List<Candidate> candidates = detector.detect(Signal.of(values));
        assertEquals(Arrays.asList(0, 8, 16, 24, 32, 40, 48, 56), TestUtils.indices(candidates));
        assertTrue(candidates.stream().allMatch(c -> c.getMethod() == DetectionMethod.FREQUENCY));
    }

    @Test
    public void testSlowOscillationOutsidePeriodBandIsIgnored() {
        double[] values = new double[64];
        for (int t = 0; t < values.length; t++) {
            values[t] = 100 + 20 * Math.cos(2 * Math.PI * t / 32);
        }
        assertTrue(detector.detect(Signal.of(values)).isEmpty());
    }

    @Test
    public void testNoisyWindowsAroundBurst() {
        SortedMap<Integer, Double> scores = new TreeMap<>();
        detector.flagNoisyWindows(burst(), scores);
        for (int i = 20; i < 30; i++) {
            assertTrue(scores.containsKey(i), "burst position " + i);
        }
        assertTrue(scores.firstKey() >= 15);
        assertTrue(scores.lastKey() < 35);
    }

    @Test
    public void testHighFrequencyBurstIsDetected() {
        List<Integer> expected = new ArrayList<>();
        for (int i = 20; i < 30; i++) {
            expected.add(i);
        }
        assertEquals(expected, TestUtils.indices(detector.detect(Signal.of(burst()))));
    }

    @ParameterizedTest
    @ValueSource(longs = { 1, 42, 99 })
    public void testNoisyWindowFlagsOnlyTheExcursion(long seed) {
        double[] values = GlucoseDataSets.singleReading(200, 100, 10, seed);
        assertEquals(Collections.singletonList(100), TestUtils.indices(detector.detect(Signal.of(values))));
    }

    @Test
    public void testWindowDrivers() {
        SortedMap<Integer, Double> scores = new TreeMap<>();
        detector.flagDrivers(new double[] { 100, 101, 99, 100, 40, 100, 102, 98 }, 0, 8, 20, scores);
        assertEquals(Collections.singleton(4), scores.keySet());
    }

    @Test
    public void testLowAmplitudeNoiseIsTolerated() {
        double[] values = new double[40];
        for (int t = 0; t < values.length; t++) {
            values[t] = (t % 2 == 0) ? 101 : 99;
        }
        assertTrue(detector.detect(Signal.of(values)).isEmpty());
    }

    @Test
    public void testDegenerateSignalsYieldNothing() {
        assertTrue(detector.detect(Signal.of(GlucoseDataSets.constant(50, 100))).isEmpty());
        assertTrue(detector.detect(Signal.of(1, 200, 1, 200, 1, 200, 1, 200, 1)).isEmpty());
    }
}
