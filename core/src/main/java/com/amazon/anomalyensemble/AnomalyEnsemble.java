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

package com.amazon.anomalyensemble;

import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyensemble.config.ConfidenceTier;
import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.config.MethodWeights;
import com.amazon.anomalyensemble.constraint.ConstraintRuleEvaluator;
import com.amazon.anomalyensemble.constraint.ConstraintRuleTable;
import com.amazon.anomalyensemble.context.ContextScorer;
import com.amazon.anomalyensemble.detector.DetectorBank;
import com.amazon.anomalyensemble.fusion.FusionEngine;
import com.amazon.anomalyensemble.relationship.RelationshipAnalyzer;
import com.amazon.anomalyensemble.relationship.WeightCalibrator;
import com.amazon.anomalyensemble.returntypes.AnalysisRunResult;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.returntypes.ConstraintAdjustedCandidate;
import com.amazon.anomalyensemble.returntypes.EnsembleSummary;
import com.amazon.anomalyensemble.returntypes.FusedAnomaly;
import com.amazon.anomalyensemble.returntypes.RelationshipEdge;
import com.amazon.anomalyensemble.signal.AnalysisContext;
import com.amazon.anomalyensemble.signal.MalformedSignalException;
import com.amazon.anomalyensemble.signal.Signal;

/**
 * Multi-method anomaly detection ensemble. A run passes a signal through the
 * detector bank, scores every candidate for context and domain constraints, and
 * fuses the survivors into a short, confidence-ranked list. The relationship
 * analysis of the detectors is reported alongside and, when weight calibration
 * is enabled, adjusts the method weights of the run.
 *
 * <p>
 * An ensemble holds no per-run state, so one instance may serve concurrent
 * runs. Closing it closes its detector bank.
 */
@Slf4j
public class AnomalyEnsemble implements AutoCloseable {

    @Getter
    private final EnsembleConfig config;

    private final DetectorBank detectorBank;
    private final RelationshipAnalyzer relationshipAnalyzer;
    private final WeightCalibrator weightCalibrator;
    private final ContextScorer contextScorer;
    private final ConstraintRuleTable constraintRules;
    private final FusionEngine fusionEngine;

    public AnomalyEnsemble() {
        this(EnsembleConfig.defaults());
    }

    public AnomalyEnsemble(EnsembleConfig config) {
        this(config, new DetectorBank(validated(config)));
    }

    /**
     * @param config       the configuration of every stage after detection
     * @param detectorBank the detectors to run
     */
    public AnomalyEnsemble(EnsembleConfig config, DetectorBank detectorBank) {
        this.config = validated(config);
        this.detectorBank = checkNotNull(detectorBank, "detectorBank must not be null");
        this.relationshipAnalyzer = new RelationshipAnalyzer(config);
        this.weightCalibrator = new WeightCalibrator(config);
        this.contextScorer = new ContextScorer(config);
        this.constraintRules = ConstraintRuleTable.fromConfig(config);
        this.fusionEngine = new FusionEngine(config);
    }

    private static EnsembleConfig validated(EnsembleConfig config) {
        checkNotNull(config, "config must not be null");
        config.validate();
        return config;
    }

    public AnalysisRunResult run(Signal signal) {
        return run(signal, AnalysisContext.defaults());
    }

    /**
     * Analyzes one signal.
     *
     * @param signal  the signal
     * @param context side-channel context; null means the defaults
     * @return the fused anomalies with the relationship report and diagnostics
     * @throws MalformedSignalException if the signal violates the input contract
     */
    public AnalysisRunResult run(Signal signal, AnalysisContext context) {
        if (signal == null) {
            throw new MalformedSignalException("signal must not be null");
        }
        signal.validate();
        AnalysisContext runContext = context == null ? AnalysisContext.defaults() : context;

        Map<DetectionMethod, List<Candidate>> candidates = detectorBank.detect(signal);
        List<RelationshipEdge> edges = relationshipAnalyzer.analyze(candidates);
        MethodWeights weights = config.isWeightCalibrationEnabled()
                ? weightCalibrator.calibrate(config.getMethodWeights(), edges)
                : config.getMethodWeights();

        ConstraintRuleEvaluator evaluator = new ConstraintRuleEvaluator(constraintRules, weights,
                config.getScoreFloor());
        List<ConstraintAdjustedCandidate> adjusted = evaluator.adjustAll(candidates, signal, runContext,
                contextScorer);
        List<FusedAnomaly> fused = fusionEngine.fuse(adjusted);

        Map<DetectionMethod, Integer> counts = new EnumMap<>(DetectionMethod.class);
        candidates.forEach((method, list) -> counts.put(method, list.size()));
        EnsembleSummary summary = EnsembleSummary.summarize(candidates, fused, candidates.size());

        AnalysisRunResult result = AnalysisRunResult.builder().fusedAnomalies(Collections.unmodifiableList(fused))
                .relationshipReport(Collections.unmodifiableList(edges))
                .perMethodCounts(Collections.unmodifiableMap(counts))
                .influenceMatrix(relationshipAnalyzer.influence(candidates))
                .directConflicts(relationshipAnalyzer.conflicts(candidates, edges, weights))
                .interference(relationshipAnalyzer.assessInterference(signal, candidates)).summary(summary)
                .methodWeights(weights).build();

        log.info("analyzed {} samples: {} flagged positions fused into {} anomalies ({} high, {} medium, {} low)",
                signal.size(), summary.getRawCandidateIndices(), fused.size(),
                summary.getTierDistribution().get(ConfidenceTier.HIGH),
                summary.getTierDistribution().get(ConfidenceTier.MEDIUM),
                summary.getTierDistribution().get(ConfidenceTier.LOW));
        return result;
    }

    /**
     * Runs the detectors over several signals and classifies the method pairs
     * over the pooled candidates.
     *
     * @param signals the signals, one run each
     * @return relationship edges over all runs
     */
    public List<RelationshipEdge> analyzeRelationships(List<Signal> signals) {
        checkNotNull(signals, "signals must not be null");
        List<Map<DetectionMethod, List<Candidate>>> runs = new ArrayList<>();
        for (Signal signal : signals) {
            if (signal == null) {
                throw new MalformedSignalException("signal must not be null");
            }
            signal.validate();
            runs.add(detectorBank.detect(signal));
        }
        return relationshipAnalyzer.analyzeAll(runs);
    }

    /**
     * Calibrates the configured method weights against the relationships
     * observed over several signals. The result can be set on a new
     * configuration for later runs.
     *
     * @param signals the signals, one run each
     * @return the calibrated weights
     */
    public MethodWeights calibrateWeights(List<Signal> signals) {
        return weightCalibrator.calibrate(config.getMethodWeights(), analyzeRelationships(signals));
    }

    @Override
    public void close() {
        detectorBank.close();
    }

    public DetectorBank getDetectorBank() {
        return detectorBank;
    }
}
