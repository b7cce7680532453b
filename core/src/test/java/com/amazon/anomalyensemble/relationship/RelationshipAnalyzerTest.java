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

package com.amazon.anomalyensemble.relationship;

import static com.amazon.anomalyensemble.TestUtils.EPSILON;
import static com.amazon.anomalyensemble.TestUtils.candidates;
import static com.amazon.anomalyensemble.TestUtils.range;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyensemble.TestUtils;
import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.config.MethodWeights;
import com.amazon.anomalyensemble.config.RelationType;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.returntypes.DirectConflict;
import com.amazon.anomalyensemble.returntypes.InfluenceMatrix;
import com.amazon.anomalyensemble.returntypes.InterferenceAssessment;
import com.amazon.anomalyensemble.returntypes.RelationshipEdge;
import com.amazon.anomalyensemble.signal.Signal;
import com.amazon.anomalyensemble.testutils.GlucoseDataSets;

public class RelationshipAnalyzerTest {

    private RelationshipAnalyzer analyzer;
    private Map<DetectionMethod, List<Candidate>> candidates;

    @BeforeEach
    public void setUp() {
        analyzer = new RelationshipAnalyzer(EnsembleConfig.defaults());
        candidates = TestUtils.emptyCandidates();
    }

    @Test
    public void testIdenticalSetsSupport() {
        candidates.put(DetectionMethod.PATTERN_BASED, candidates(DetectionMethod.PATTERN_BASED, range(0, 10)));
        candidates.put(DetectionMethod.FREQUENCY, candidates(DetectionMethod.FREQUENCY, range(0, 10)));

        List<RelationshipEdge> edges = analyzer.analyze(candidates);

        assertEquals(1, edges.size());
        RelationshipEdge edge = edges.get(0);
        assertEquals(DetectionMethod.PATTERN_BASED, edge.getMethodA());
        assertEquals(DetectionMethod.FREQUENCY, edge.getMethodB());
        assertEquals(1, edge.getOverlapRatio(), EPSILON);
        assertEquals(RelationType.SUPPORT, edge.getRelation());
        assertEquals(10, edge.getSharedCount());
    }

    @Test
    public void testDisjointAgreeingPairConflicts() {
        candidates.put(DetectionMethod.STATISTICAL, candidates(DetectionMethod.STATISTICAL, range(0, 20)));
        candidates.put(DetectionMethod.PHYSIOLOGICAL, candidates(DetectionMethod.PHYSIOLOGICAL, range(100, 120)));

        RelationshipEdge edge = analyzer.analyze(candidates).get(0);

        assertEquals(0, edge.getOverlapRatio(), EPSILON);
        assertEquals(ExpectedRelation.AGREE, edge.getExpectedRelation());
        assertEquals(RelationType.CONFLICT, edge.getRelation());
    }

    @Test
    public void testDisjointUnrelatedPairIsIndependent() {
        candidates.put(DetectionMethod.PATTERN_BASED, candidates(DetectionMethod.PATTERN_BASED, range(0, 20)));
        candidates.put(DetectionMethod.FREQUENCY, candidates(DetectionMethod.FREQUENCY, range(100, 120)));

        assertEquals(RelationType.INDEPENDENT, analyzer.analyze(candidates).get(0).getRelation());
    }

    @Test
    public void testSmallDisagreementIsNotAConflict() {
        candidates.put(DetectionMethod.STATISTICAL, candidates(DetectionMethod.STATISTICAL, range(0, 9)));
        candidates.put(DetectionMethod.PHYSIOLOGICAL, candidates(DetectionMethod.PHYSIOLOGICAL, range(100, 109)));

        assertEquals(RelationType.INDEPENDENT, analyzer.analyze(candidates).get(0).getRelation());
    }

    @Test
    public void testOverlapIsMeasuredAgainstSmallerSet() {
        candidates.put(DetectionMethod.STATISTICAL, candidates(DetectionMethod.STATISTICAL, range(0, 100)));
        candidates.put(DetectionMethod.PHYSIOLOGICAL, candidates(DetectionMethod.PHYSIOLOGICAL, range(0, 10)));

        RelationshipEdge edge = analyzer.analyze(candidates).get(0);
        assertEquals(1, edge.getOverlapRatio(), EPSILON);
        assertEquals(RelationType.SUPPORT, edge.getRelation());
    }

    @Test
    public void testEmptyMethodsHaveNoEdges() {
        candidates.put(DetectionMethod.STATISTICAL, candidates(DetectionMethod.STATISTICAL, 1, 2));
        candidates.put(DetectionMethod.TEMPORAL, Collections.emptyList());
        assertTrue(analyzer.analyze(candidates).isEmpty());
        assertTrue(analyzer.analyze(TestUtils.emptyCandidates()).isEmpty());
    }

    @Test
    public void testRunsArePooledWithDistinctPositions() {
        Map<DetectionMethod, List<Candidate>> first = TestUtils.emptyCandidates();
        first.put(DetectionMethod.STATISTICAL, candidates(DetectionMethod.STATISTICAL, 1));
        first.put(DetectionMethod.TEMPORAL, candidates(DetectionMethod.TEMPORAL, 2));
        Map<DetectionMethod, List<Candidate>> second = TestUtils.emptyCandidates();
        second.put(DetectionMethod.STATISTICAL, candidates(DetectionMethod.STATISTICAL, 2));
        second.put(DetectionMethod.TEMPORAL, candidates(DetectionMethod.TEMPORAL, 1));

        RelationshipEdge edge = analyzer.analyzeAll(Arrays.asList(first, second)).get(0);

        assertEquals(2, edge.getCountA());
        assertEquals(0, edge.getSharedCount());
    }

    @Test
    public void testInfluence() {
        candidates.put(DetectionMethod.STATISTICAL, candidates(DetectionMethod.STATISTICAL, 1, 2, 3, 4));
        candidates.put(DetectionMethod.PHYSIOLOGICAL, candidates(DetectionMethod.PHYSIOLOGICAL, 3, 4));
        candidates.put(DetectionMethod.TEMPORAL, Collections.emptyList());

        InfluenceMatrix matrix = analyzer.influence(candidates);

        assertEquals(0.5, matrix.get(DetectionMethod.STATISTICAL, DetectionMethod.PHYSIOLOGICAL), EPSILON);
        assertEquals(1, matrix.get(DetectionMethod.PHYSIOLOGICAL, DetectionMethod.STATISTICAL), EPSILON);
        assertEquals(0, matrix.get(DetectionMethod.TEMPORAL, DetectionMethod.STATISTICAL), EPSILON);
        assertEquals(DetectionMethod.PHYSIOLOGICAL, matrix.getDominantInfluencer().get());
        assertEquals(DetectionMethod.STATISTICAL, matrix.getMostInfluenced().get());
        assertEquals(EnumSet.of(DetectionMethod.STATISTICAL, DetectionMethod.PHYSIOLOGICAL, DetectionMethod.TEMPORAL),
                matrix.getMethods());
        assertFalse(analyzer.influence(TestUtils.emptyCandidates()).getDominantInfluencer().isPresent());
    }

    @Test
    public void testConflictsPreferStrongerPrior() {
        candidates.put(DetectionMethod.STATISTICAL, candidates(DetectionMethod.STATISTICAL, range(0, 20)));
        candidates.put(DetectionMethod.PHYSIOLOGICAL, candidates(DetectionMethod.PHYSIOLOGICAL, range(15, 35)));
        List<RelationshipEdge> edges = analyzer.analyze(candidates);

        List<DirectConflict> conflicts = analyzer.conflicts(candidates, edges, MethodWeights.defaults());

        assertEquals(1, conflicts.size());
        DirectConflict conflict = conflicts.get(0);
        assertEquals(15, conflict.getOnlyA().size());
        assertEquals(0, conflict.getOnlyA().get(0));
        assertEquals(20, conflict.getOnlyB().get(0));
        assertEquals(15, conflict.getOnlyB().size());
        assertEquals(DetectionMethod.PHYSIOLOGICAL, conflict.getPreferredMethod());
        assertEquals("prefer physiological over statistical on 30 contested positions", conflict.getResolutionHint());
    }

    @Test
    public void testInterferenceOfIrregularShortSignal() {
        Signal signal = Signal.builder().add(GlucoseDataSets.START, 100)
                .add(GlucoseDataSets.START.plusSeconds(300), 101).add(GlucoseDataSets.START.plusSeconds(1200), 102)
                .build();

        InterferenceAssessment assessment = analyzer.assessInterference(signal, candidates);

        assertTrue(assessment.isIrregularSampling());
        assertEquals(RelationshipAnalyzer.SAMPLING_SENSITIVE, assessment.getIrregularSamplingAffected());
        assertTrue(assessment.isShortSignal());
        assertEquals(RelationshipAnalyzer.LENGTH_SENSITIVE, assessment.getShortSignalAffected());
        assertEquals(1, assessment.getBalanceScore(), EPSILON);
    }

    @Test
    public void testInterferenceOfRegularLongSignal() {
        Signal signal = TestUtils.timestamped(GlucoseDataSets.baseline(100, 1), 5);
        candidates.put(DetectionMethod.STATISTICAL, candidates(DetectionMethod.STATISTICAL, range(0, 10)));
        candidates.put(DetectionMethod.PHYSIOLOGICAL, candidates(DetectionMethod.PHYSIOLOGICAL, range(0, 10)));
        candidates.put(DetectionMethod.TEMPORAL, candidates(DetectionMethod.TEMPORAL, range(0, 40)));

        InterferenceAssessment assessment = analyzer.assessInterference(signal, candidates);

        assertFalse(assessment.isIrregularSampling());
        assertTrue(assessment.getIrregularSamplingAffected().isEmpty());
        assertFalse(assessment.isShortSignal());
        assertEquals(0.4, assessment.getDetectionRates().get(DetectionMethod.TEMPORAL), EPSILON);
        assertEquals(EnumSet.of(DetectionMethod.TEMPORAL), assessment.getOverSensitive());
        assertTrue(assessment.getUnderSensitive().isEmpty());
        double std = Math.sqrt(0.02);
        assertEquals(1 - std / (0.2 + RelationshipAnalyzer.BALANCE_EPSILON), assessment.getBalanceScore(), 1e-9);
    }

    @Test
    public void testValuesOnlySignalIsNotIrregular() {
        assertFalse(analyzer.assessInterference(Signal.of(1, 2, 3, 4), candidates).isIrregularSampling());
    }
}
