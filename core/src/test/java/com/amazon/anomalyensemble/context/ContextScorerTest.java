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

package com.amazon.anomalyensemble.context;

import static com.amazon.anomalyensemble.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.ZoneId;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyensemble.TestUtils;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.signal.AnalysisContext;
import com.amazon.anomalyensemble.signal.Signal;

public class ContextScorerTest {

    private ContextScorer scorer;

    @BeforeEach
    public void setUp() {
        scorer = new ContextScorer(EnsembleConfig.defaults());
    }

    @Test
    public void testNeighborhoodStability() {
        assertEquals(1.2, scorer.score(Signal.of(100, 100, 100, 100, 100), 2), EPSILON);
        assertEquals(0.8, scorer.score(Signal.of(60, 140, 60, 140, 60), 2), EPSILON);
        assertEquals(1.0, scorer.score(Signal.of(80, 120, 80, 120, 80, 120), 2), EPSILON);
    }

    @Test
    public void testNeighborhoodIsSkippedAtSignalEnds() {
        Signal signal = Signal.of(100, 100, 100, 200, 300, 400);
        assertEquals(1.0, scorer.neighborhoodMultiplier(signal, 0), EPSILON);
        assertEquals(1.0, scorer.neighborhoodMultiplier(signal, 5), EPSILON);
        assertEquals(1.0, scorer.neighborhoodMultiplier(Signal.of(250), 0), EPSILON);
        assertEquals(1.0, scorer.score(Signal.of(100, 100, 100), 0), EPSILON);
    }

    @Test
    public void testNeighborhoodIsClippedNearEdges() {
        Signal signal = Signal.of(100, 100, 100, 200, 300, 400);
        assertEquals(0.8, scorer.neighborhoodMultiplier(signal, 1), EPSILON);
        assertEquals(1.2, scorer.neighborhoodMultiplier(Signal.of(100, 101, 100, 102, 250, 400), 1), EPSILON);
        assertEquals(0.8, scorer.neighborhoodMultiplier(signal, 4), EPSILON);
    }

    @Test
    public void testTimeOfDayMultipliesNeighborhood() {
        Signal lunch = TestUtils.startingAt("2024-01-01T13:00:00Z", 5, 180, 180, 180, 180, 180);
        assertEquals(0.6 * 1.2, scorer.score(lunch, 2), EPSILON);
        assertEquals(1.2, scorer.score(lunch, 2, AnalysisContext.withoutTimeOfDay()), EPSILON);
        assertEquals(1.2, scorer.score(lunch, 2, AnalysisContext.inZone(ZoneId.of("America/New_York"))), EPSILON);
    }

    @Test
    public void testEarlyMorningLow() {
        Signal night = TestUtils.startingAt("2024-01-01T04:00:00Z", 5, 70, 70, 70);
        assertEquals(1.4 * 1.2, scorer.score(night, 1), EPSILON);
    }

    @Test
    public void testIndexOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> scorer.score(Signal.of(1, 2), 2));
    }
}
