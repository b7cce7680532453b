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

import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.signal.AnalysisContext;
import com.amazon.anomalyensemble.signal.Signal;

/**
 * Constraint rules keyed by method. The constraint multiplier of a candidate is
 * the product of the multipliers of every applicable rule of its method.
 */
@EqualsAndHashCode
@ToString
public class ConstraintRuleTable {

    private final Map<DetectionMethod, List<ConstraintRule>> rules;

    private ConstraintRuleTable(Map<DetectionMethod, List<ConstraintRule>> rules) {
        this.rules = rules;
    }

    public static ConstraintRuleTable empty() {
        return new ConstraintRuleTable(new EnumMap<>(DetectionMethod.class));
    }

    /**
     * The glucose rules: statistical flags inside the normal band and pattern
     * flags at night are discounted, physiological flags are boosted, and
     * learned-density flags carry a fixed discount until corroborated.
     *
     * @param config thresholds of the rules
     * @return the default table
     */
    public static ConstraintRuleTable fromConfig(EnsembleConfig config) {
        return empty()
                .withRule(DetectionMethod.STATISTICAL,
                        ConstraintRule.valueInBand("inside normal band", config.getNormalBandLow(),
                                config.getNormalBandHigh(), config.getNormalBandStatisticalMultiplier()))
                .withRule(DetectionMethod.PATTERN_BASED,
                        ConstraintRule.hourInWindow("expected flat at night", config.getNightStartHour(),
                                config.getNightEndHour(), config.getNightPatternMultiplier()))
                .withRule(DetectionMethod.PHYSIOLOGICAL,
                        ConstraintRule.always("domain prior", config.getPhysiologicalBoost()))
                .withRule(DetectionMethod.LEARNED_DENSITY,
                        ConstraintRule.always("needs corroboration", config.getCorroborationMultiplier()));
    }

    /**
     * @return a copy of this table with the rule appended to the method's rules
     */
    public ConstraintRuleTable withRule(DetectionMethod method, ConstraintRule rule) {
        checkNotNull(method, "method must not be null");
        checkNotNull(rule, "rule must not be null");
        Map<DetectionMethod, List<ConstraintRule>> copy = new EnumMap<>(DetectionMethod.class);
        rules.forEach((m, list) -> copy.put(m, list));
        List<ConstraintRule> list = new ArrayList<>(copy.getOrDefault(method, Collections.emptyList()));
        list.add(rule);
        copy.put(method, Collections.unmodifiableList(list));
        return new ConstraintRuleTable(copy);
    }

    public List<ConstraintRule> getRules(DetectionMethod method) {
        return rules.getOrDefault(method, Collections.emptyList());
    }

    public double multiplier(Candidate candidate, Signal signal, AnalysisContext context) {
        double product = 1.0;
        for (ConstraintRule rule : getRules(candidate.getMethod())) {
            product *= rule.multiplierAt(signal, candidate.getIndex(), context);
        }
        return product;
    }
}
