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

package com.amazon.anomalyensemble.returntypes;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.MethodWeights;

/**
 * Everything one analysis run produces. Two runs over the same signal and
 * context yield equal results.
 */
@Data
@Builder
public class AnalysisRunResult {

    /** Ranked output of fusion. */
    private final List<FusedAnomaly> fusedAnomalies;

    private final List<RelationshipEdge> relationshipReport;

    /** Raw candidate count of every enabled method. */
    private final Map<DetectionMethod, Integer> perMethodCounts;

    private final InfluenceMatrix influenceMatrix;

    private final List<DirectConflict> directConflicts;

    private final InterferenceAssessment interference;

    private final EnsembleSummary summary;

    /** Weights used for this run, after calibration when enabled. */
    private final MethodWeights methodWeights;
}
