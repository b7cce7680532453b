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

import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;
import static com.amazon.anomalyensemble.CommonUtils.checkPositive;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.config.MethodWeights;
import com.amazon.anomalyensemble.config.RelationType;
import com.amazon.anomalyensemble.returntypes.RelationshipEdge;

/**
 * Derives method weights from relationship edges. For a conflict, the method
 * with the weaker prior (the lower base weight, the later method on ties) is
 * multiplied by the conflict penalty; for a support both methods are multiplied
 * by the support bonus. Multipliers compound over edges.
 */
@Slf4j
public class WeightCalibrator {

    private final double conflictPenalty;
    private final double supportBonus;

    public WeightCalibrator(double conflictPenalty, double supportBonus) {
        checkPositive(conflictPenalty, "conflictPenalty must be positive");
        checkPositive(supportBonus, "supportBonus must be positive");
        this.conflictPenalty = conflictPenalty;
        this.supportBonus = supportBonus;
    }

    public WeightCalibrator(EnsembleConfig config) {
        this(config.getConflictPenalty(), config.getSupportBonus());
    }

    /**
     * @param base  the weights before calibration
     * @param edges relationship edges of one or more runs
     * @return the calibrated weights
     */
    public MethodWeights calibrate(MethodWeights base, List<RelationshipEdge> edges) {
        checkNotNull(base, "base weights must not be null");
        checkNotNull(edges, "edges must not be null");
        MethodWeights calibrated = base;
        for (RelationshipEdge edge : edges) {
            if (edge.getRelation() == RelationType.CONFLICT) {
                DetectionMethod weaker = base.get(edge.getMethodB()) <= base.get(edge.getMethodA()) ? edge.getMethodB()
                        : edge.getMethodA();
                calibrated = calibrated.scale(weaker, conflictPenalty);
            } else if (edge.getRelation() == RelationType.SUPPORT) {
                calibrated = calibrated.scale(edge.getMethodA(), supportBonus).scale(edge.getMethodB(), supportBonus);
            }
        }
        log.debug("calibrated weights {}", calibrated);
        return calibrated;
    }
}
