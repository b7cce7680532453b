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

package com.amazon.anomalyensemble.fusion;

import static com.amazon.anomalyensemble.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyensemble.config.ConfidenceTier;
import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.returntypes.ConstraintAdjustedCandidate;
import com.amazon.anomalyensemble.returntypes.FusedAnomaly;

public class FusionEngineTest {

    private FusionEngine engine;

    @BeforeEach
    public void setUp() {
        engine = new FusionEngine(EnsembleConfig.defaults());
    }

    private static ConstraintAdjustedCandidate adjusted(int index, DetectionMethod method, double score) {
        return new ConstraintAdjustedCandidate(new Candidate(index, method, score), 1.0, 1.0, 1.0);
    }

    private static List<ConstraintAdjustedCandidate> mixedRun() {
        return Arrays.asList(adjusted(5, DetectionMethod.STATISTICAL, 1.0),
                adjusted(5, DetectionMethod.PHYSIOLOGICAL, 1.0), adjusted(5, DetectionMethod.TEMPORAL, 1.0),
                adjusted(2, DetectionMethod.PATTERN_BASED, 0.5), adjusted(2, DetectionMethod.TEMPORAL, 0.5),
                adjusted(7, DetectionMethod.PHYSIOLOGICAL, 0.6), adjusted(8, DetectionMethod.STATISTICAL, 0.4),
                adjusted(9, DetectionMethod.LEARNED_DENSITY, 2.0), adjusted(10, DetectionMethod.LEARNED_DENSITY, 0.5),
                adjusted(10, DetectionMethod.STATISTICAL, 0.5));
    }

    @Test
    public void testTiersAndRanking() {
        List<FusedAnomaly> fused = engine.fuse(mixedRun());

        assertEquals(4, fused.size());

        assertEquals(5, fused.get(0).getIndex());
        assertEquals(ConfidenceTier.HIGH, fused.get(0).getConfidenceTier());
        assertEquals(3.0, fused.get(0).getTotalScore(), EPSILON);
        assertEquals(EnumSet.of(DetectionMethod.STATISTICAL, DetectionMethod.PHYSIOLOGICAL, DetectionMethod.TEMPORAL),
                fused.get(0).getSupportingMethods());

        // equal score and method count fall back to index order
        assertEquals(2, fused.get(1).getIndex());
        assertEquals(ConfidenceTier.MEDIUM, fused.get(1).getConfidenceTier());
        assertEquals(10, fused.get(2).getIndex());
        assertEquals(ConfidenceTier.MEDIUM, fused.get(2).getConfidenceTier());
        assertTrue(fused.get(2).isSupportedBy(DetectionMethod.LEARNED_DENSITY));

        assertEquals(7, fused.get(3).getIndex());
        assertEquals(ConfidenceTier.LOW, fused.get(3).getConfidenceTier());
    }

    @Test
    public void testMethodCountBreaksScoreTies() {
        List<FusedAnomaly> fused = engine.fuse(Arrays.asList(adjusted(3, DetectionMethod.PHYSIOLOGICAL, 1.0),
                adjusted(4, DetectionMethod.STATISTICAL, 0.5), adjusted(4, DetectionMethod.TEMPORAL, 0.5)));

        assertEquals(2, fused.size());
        assertEquals(4, fused.get(0).getIndex());
        assertEquals(3, fused.get(1).getIndex());
    }

    @Test
    public void testRepeatedMethodCountsOnce() {
        List<FusedAnomaly> fused = engine.fuse(Arrays.asList(adjusted(1, DetectionMethod.STATISTICAL, 0.3),
                adjusted(1, DetectionMethod.STATISTICAL, 0.3)));

        assertEquals(1, fused.size());
        assertEquals(1, fused.get(0).getMethodCount());
        assertEquals(0.6, fused.get(0).getTotalScore(), EPSILON);
        assertEquals(ConfidenceTier.LOW, fused.get(0).getConfidenceTier());
    }

    @Test
    public void testOutputDoesNotDependOnInputOrder() {
        List<ConstraintAdjustedCandidate> shuffled = new ArrayList<>(mixedRun());
        Collections.shuffle(shuffled, new Random(17));
        assertEquals(engine.fuse(mixedRun()), engine.fuse(shuffled));
    }

    @Test
    public void testEmptyInput() {
        assertTrue(engine.fuse(Collections.emptyList()).isEmpty());
        assertThrows(NullPointerException.class, () -> engine.fuse(null));
    }

    @Test
    public void testTier() {
        assertEquals(ConfidenceTier.HIGH, engine.tier(6, 0.0));
        assertEquals(ConfidenceTier.HIGH, engine.tier(3, 0.1));
        assertEquals(ConfidenceTier.MEDIUM, engine.tier(2, 0.1));
        assertEquals(ConfidenceTier.LOW, engine.tier(1, 0.41));
        assertNull(engine.tier(1, EnsembleConfig.DEFAULT_SCORE_FLOOR));
    }

    @Test
    public void testCorroborationSetIsConfigurable() {
        FusionEngine lenient = new FusionEngine(
                EnsembleConfig.builder().corroborationRequired(EnumSet.noneOf(DetectionMethod.class)).build());
        List<FusedAnomaly> fused = lenient.fuse(Collections.singletonList(adjusted(9, DetectionMethod.LEARNED_DENSITY,
                2.0)));
        assertEquals(1, fused.size());
        assertEquals(ConfidenceTier.LOW, fused.get(0).getConfidenceTier());
    }
}
