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

package com.amazon.anomalyensemble.constraint;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.MethodWeights;
import com.amazon.anomalyensemble.context.ContextScorer;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.returntypes.ConstraintAdjustedCandidate;
import com.amazon.anomalyensemble.signal.AnalysisContext;
import com.amazon.anomalyensemble.signal.Signal;

/**
 * Applies the constraint rules and the method weight to candidates and drops
 * those whose adjusted score falls below the score floor.
 */
@Slf4j
public class ConstraintRuleEvaluator {

    private final ConstraintRuleTable rules;
    private final MethodWeights weights;
    private final double scoreFloor;

    public ConstraintRuleEvaluator(ConstraintRuleTable rules, MethodWeights weights, double scoreFloor) {
        this.rules = checkNotNull(rules, "rules must not be null");
        this.weights = checkNotNull(weights, "weights must not be null");
        checkArgument(scoreFloor >= 0, "scoreFloor must be non-negative");
        this.scoreFloor = scoreFloor;
    }

    public ConstraintAdjustedCandidate adjust(Candidate candidate, Signal signal, double contextMultiplier) {
        return adjust(candidate, signal, contextMultiplier, AnalysisContext.defaults());
    }

    /**
     * @param candidate         the candidate to adjust
     * @param signal            the signal it was flagged on
     * @param contextMultiplier context multiplier of the candidate's position
     * @param context           side-channel context of the run
     * @return the adjusted candidate, whatever its score
     */
    public ConstraintAdjustedCandidate adjust(Candidate candidate, Signal signal, double contextMultiplier,
            AnalysisContext context) {
        checkNotNull(candidate, "candidate must not be null");
        double constraint = rules.multiplier(candidate, signal, context);
        return new ConstraintAdjustedCandidate(candidate, contextMultiplier, constraint,
                weights.get(candidate.getMethod()));
    }

    /**
     * Adjusts every candidate of a run and keeps those at or above the floor.
     *
     * @param candidates candidates by method
     * @param signal     the signal of the run
     * @param context    side-channel context of the run
     * @param scorer     scorer of the context multipliers
     * @return the surviving candidates, in method then index order
     */
    public List<ConstraintAdjustedCandidate> adjustAll(Map<DetectionMethod, List<Candidate>> candidates,
            Signal signal, AnalysisContext context, ContextScorer scorer) {
        List<ConstraintAdjustedCandidate> survivors = new ArrayList<>();
        Map<Integer, Double> contextCache = new HashMap<>();
        int dropped = 0;
        for (List<Candidate> list : candidates.values()) {
            for (Candidate candidate : list) {
                double contextMultiplier = contextCache.computeIfAbsent(candidate.getIndex(),
                        index -> scorer.score(signal, index, context));
                ConstraintAdjustedCandidate adjusted = adjust(candidate, signal, contextMultiplier, context);
                if (adjusted.getAdjustedScore() >= scoreFloor) {
                    survivors.add(adjusted);
                } else {
                    dropped++;
                }
            }
        }
        log.debug("{} candidates survive the score floor {}, {} dropped", survivors.size(), scoreFloor, dropped);
        return survivors;
    }

    public MethodWeights getWeights() {
        return weights;
    }
}
