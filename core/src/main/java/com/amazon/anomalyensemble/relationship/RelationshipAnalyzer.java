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

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import lombok.extern.slf4j.Slf4j;

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
import com.amazon.anomalyensemble.statistics.Statistics;

/**
 * Characterizes how the methods of a run corroborate or contradict each other.
 * The output is advisory: it feeds weight calibration and audit reports but
 * never vetoes a candidate.
 */
@Slf4j
public class RelationshipAnalyzer {

    public static final double BALANCE_EPSILON = 1e-6;

    static final Set<DetectionMethod> SAMPLING_SENSITIVE = Collections.unmodifiableSet(
            EnumSet.of(DetectionMethod.PATTERN_BASED, DetectionMethod.FREQUENCY, DetectionMethod.TEMPORAL));

    static final Set<DetectionMethod> LENGTH_SENSITIVE = Collections.unmodifiableSet(
            EnumSet.of(DetectionMethod.PATTERN_BASED, DetectionMethod.FREQUENCY, DetectionMethod.LEARNED_DENSITY));

    private final double supportThreshold;
    private final double conflictThreshold;
    private final int minConflictCount;
    private final int shortSignalLength;
    private final ExpectedRelationshipTable expectedRelationships;

    public RelationshipAnalyzer(EnsembleConfig config) {
        checkNotNull(config, "config must not be null");
        this.supportThreshold = config.getSupportThreshold();
        this.conflictThreshold = config.getConflictThreshold();
        this.minConflictCount = config.getMinConflictCount();
        this.shortSignalLength = config.getShortSignalLength();
        this.expectedRelationships = config.getExpectedRelationships();
    }

    /**
     * Classifies every unordered pair of methods with non-empty candidate sets.
     *
     * @param candidates candidates of one run, by method
     * @return one edge per classified pair, in canonical method order
     */
    public List<RelationshipEdge> analyze(Map<DetectionMethod, ? extends Collection<Candidate>> candidates) {
        return analyzeAll(Collections.singletonList(candidates));
    }

    /**
     * Pools the candidates of several runs. A position of one run and the same
     * position of another run are distinct keys.
     *
     * @param runs candidates of each run, by method
     * @return one edge per classified pair, in canonical method order
     */
    public List<RelationshipEdge> analyzeAll(List<? extends Map<DetectionMethod, ? extends Collection<Candidate>>> runs) {
        Map<DetectionMethod, Set<Long>> keys = pool(runs);
        List<RelationshipEdge> edges = new ArrayList<>();
        List<DetectionMethod> methods = new ArrayList<>(keys.keySet());
        for (int i = 0; i < methods.size(); i++) {
            for (int j = i + 1; j < methods.size(); j++) {
                Set<Long> a = keys.get(methods.get(i));
                Set<Long> b = keys.get(methods.get(j));
                if (!a.isEmpty() && !b.isEmpty()) {
                    edges.add(edge(methods.get(i), methods.get(j), a, b));
                }
            }
        }
        return edges;
    }

    RelationshipEdge edge(DetectionMethod methodA, DetectionMethod methodB, Set<Long> a, Set<Long> b) {
        int shared = intersectionSize(a, b);
        double overlap = (double) shared / Math.min(a.size(), b.size());
        ExpectedRelation expected = expectedRelationships.get(methodA, methodB);

        RelationType relation;
        if (overlap >= supportThreshold) {
            relation = RelationType.SUPPORT;
        } else if (expected == ExpectedRelation.AGREE && overlap < conflictThreshold
                && Math.max(a.size() - shared, b.size() - shared) >= minConflictCount) {
            relation = RelationType.CONFLICT;
        } else {
            relation = RelationType.INDEPENDENT;
        }
        return new RelationshipEdge(methodA, methodB, overlap, relation, expected, a.size(), b.size(), shared);
    }

    /**
     * @param candidates candidates of one run, by method
     * @return the directed influence between every pair of methods present
     */
    public InfluenceMatrix influence(Map<DetectionMethod, ? extends Collection<Candidate>> candidates) {
        Map<DetectionMethod, Set<Long>> keys = pool(Collections.singletonList(candidates));
        Map<DetectionMethod, Map<DetectionMethod, Double>> entries = new EnumMap<>(DetectionMethod.class);
        keys.forEach((from, fromKeys) -> {
            Map<DetectionMethod, Double> row = new EnumMap<>(DetectionMethod.class);
            keys.forEach((to, toKeys) -> {
                if (from != to) {
                    row.put(to, fromKeys.isEmpty() ? 0 : (double) intersectionSize(fromKeys, toKeys) / fromKeys.size());
                }
            });
            entries.put(from, row);
        });
        return new InfluenceMatrix(entries);
    }

    /**
     * Lists the contested positions of every conflicting pair.
     *
     * @param candidates candidates of the run the edges were computed on
     * @param edges      edges of that run
     * @param weights    method weights deciding which method has the stronger
     *                   prior
     * @return one entry per conflict edge
     */
    public List<DirectConflict> conflicts(Map<DetectionMethod, ? extends Collection<Candidate>> candidates,
            List<RelationshipEdge> edges, MethodWeights weights) {
        List<DirectConflict> conflicts = new ArrayList<>();
        for (RelationshipEdge edge : edges) {
            if (edge.getRelation() != RelationType.CONFLICT) {
                continue;
            }
            Set<Integer> a = indices(candidates.get(edge.getMethodA()));
            Set<Integer> b = indices(candidates.get(edge.getMethodB()));
            List<Integer> onlyA = new ArrayList<>(a);
            onlyA.removeAll(b);
            List<Integer> onlyB = new ArrayList<>(b);
            onlyB.removeAll(a);

            DetectionMethod preferred = weights.get(edge.getMethodA()) >= weights.get(edge.getMethodB())
                    ? edge.getMethodA()
                    : edge.getMethodB();
            DetectionMethod other = preferred == edge.getMethodA() ? edge.getMethodB() : edge.getMethodA();
            String hint = String.format("prefer %s over %s on %d contested positions", preferred.getKey(),
                    other.getKey(), onlyA.size() + onlyB.size());
            conflicts.add(new DirectConflict(edge.getMethodA(), edge.getMethodB(), Collections.unmodifiableList(onlyA),
                    Collections.unmodifiableList(onlyB), preferred, hint));
            log.debug("conflict between {} and {}: {}", edge.getMethodA().getKey(), edge.getMethodB().getKey(), hint);
        }
        return conflicts;
    }

    /**
     * @param signal     the signal of the run
     * @param candidates candidates of the run, by enabled method
     * @return the interference conditions of the run
     */
    public InterferenceAssessment assessInterference(Signal signal,
            Map<DetectionMethod, ? extends Collection<Candidate>> candidates) {
        checkNotNull(signal, "signal must not be null");
        boolean irregular = false;
        if (signal.hasTimestamps() && signal.size() >= 3) {
            double[] intervals = new double[signal.size() - 1];
            for (int i = 0; i < intervals.length; i++) {
                intervals[i] = signal.minutesBetween(i, i + 1, 1);
            }
            irregular = Statistics.standardDeviation(intervals) > 0;
        }
        boolean shortSignal = signal.size() < shortSignalLength;

        Map<DetectionMethod, Double> rates = new EnumMap<>(DetectionMethod.class);
        candidates.forEach((method, list) -> rates.put(method, (double) list.size() / signal.size()));
        Set<DetectionMethod> over = EnumSet.noneOf(DetectionMethod.class);
        Set<DetectionMethod> under = EnumSet.noneOf(DetectionMethod.class);
        double balance = 1;
        if (!rates.isEmpty()) {
            double[] values = rates.values().stream().mapToDouble(Double::doubleValue).toArray();
            double mean = Statistics.mean(values);
            double std = Statistics.standardDeviation(values);
            rates.forEach((method, rate) -> {
                if (rate > mean + std) {
                    over.add(method);
                } else if (rate < mean - std) {
                    under.add(method);
                }
            });
            balance = 1 - std / (mean + BALANCE_EPSILON);
        }

        return InterferenceAssessment.builder().irregularSampling(irregular)
                .irregularSamplingAffected(irregular ? SAMPLING_SENSITIVE : Collections.emptySet())
                .shortSignal(shortSignal).shortSignalAffected(shortSignal ? LENGTH_SENSITIVE : Collections.emptySet())
                .detectionRates(Collections.unmodifiableMap(rates)).overSensitive(Collections.unmodifiableSet(over))
                .underSensitive(Collections.unmodifiableSet(under)).balanceScore(balance).build();
    }

    static Map<DetectionMethod, Set<Long>> pool(
            List<? extends Map<DetectionMethod, ? extends Collection<Candidate>>> runs) {
        checkNotNull(runs, "runs must not be null");
        Map<DetectionMethod, Set<Long>> keys = new EnumMap<>(DetectionMethod.class);
        for (int run = 0; run < runs.size(); run++) {
            Map<DetectionMethod, ? extends Collection<Candidate>> candidates = runs.get(run);
            checkNotNull(candidates, "candidates of run " + run + " must not be null");
            for (Map.Entry<DetectionMethod, ? extends Collection<Candidate>> entry : candidates.entrySet()) {
                Set<Long> set = keys.computeIfAbsent(entry.getKey(), k -> new TreeSet<>());
                for (Candidate candidate : entry.getValue()) {
                    checkArgument(candidate.getIndex() >= 0, "candidate index must be non-negative");
                    set.add(((long) run << Integer.SIZE) | candidate.getIndex());
                }
            }
        }
        return keys;
    }

    private static Set<Integer> indices(Collection<Candidate> candidates) {
        Set<Integer> indices = new TreeSet<>();
        if (candidates != null) {
            candidates.forEach(candidate -> indices.add(candidate.getIndex()));
        }
        return indices;
    }

    private static int intersectionSize(Set<Long> a, Set<Long> b) {
        Set<Long> smaller = a.size() <= b.size() ? a : b;
        Set<Long> larger = smaller == a ? b : a;
        int count = 0;
        for (Long key : smaller) {
            if (larger.contains(key)) {
                count++;
            }
        }
        return count;
    }
}
