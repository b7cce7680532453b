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

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

import com.amazon.anomalyensemble.config.ConfidenceTier;
import com.amazon.anomalyensemble.config.DetectionMethod;

/**
 * Aggregate figures of one run: how much fusion reduced the raw flags, how the
 * output spreads over tiers, and how much each method contributed.
 */
@Data
@Builder
public class EnsembleSummary {

    /** Distinct indices flagged by at least one method. */
    private final int rawCandidateIndices;

    private final int fusedAnomalies;

    /** (raw - fused) / raw, 0 when nothing was flagged. */
    private final double reductionRatio;

    private final Map<ConfidenceTier, Integer> tierDistribution;

    /**
     * Per method, the number of fused anomalies it supports divided by the
     * number of candidates it produced.
     */
    private final Map<DetectionMethod, Double> methodContribution;

    /**
     * Mean number of methods per flagged index divided by the number of enabled
     * methods.
     */
    private final double consistencyScore;

    /**
     * @param candidates     raw candidates by enabled method
     * @param fused          output of fusion
     * @param enabledMethods number of enabled methods
     * @return the summary of the run
     */
    public static EnsembleSummary summarize(Map<DetectionMethod, ? extends Collection<Candidate>> candidates,
            List<FusedAnomaly> fused, int enabledMethods) {
        Map<Integer, Integer> methodsPerIndex = new HashMap<>();
        candidates.values().forEach(list -> list
                .forEach(candidate -> methodsPerIndex.merge(candidate.getIndex(), 1, Integer::sum)));
        int raw = methodsPerIndex.size();

        Map<ConfidenceTier, Integer> tiers = new EnumMap<>(ConfidenceTier.class);
        for (ConfidenceTier tier : ConfidenceTier.values()) {
            tiers.put(tier, 0);
        }
        fused.forEach(anomaly -> tiers.merge(anomaly.getConfidenceTier(), 1, Integer::sum));

        Map<DetectionMethod, Double> contribution = new EnumMap<>(DetectionMethod.class);
        candidates.forEach((method, list) -> {
            long supported = fused.stream().filter(anomaly -> anomaly.isSupportedBy(method)).count();
            contribution.put(method, list.isEmpty() ? 0 : (double) supported / list.size());
        });

        double consistency = 0;
        if (raw > 0 && enabledMethods > 0) {
            double meanMethods = methodsPerIndex.values().stream().mapToInt(Integer::intValue).average().orElse(0);
            consistency = meanMethods / enabledMethods;
        }

        return EnsembleSummary.builder().rawCandidateIndices(raw).fusedAnomalies(fused.size())
                .reductionRatio(raw == 0 ? 0 : (double) (raw - fused.size()) / raw)
                .tierDistribution(Collections.unmodifiableMap(tiers))
                .methodContribution(Collections.unmodifiableMap(contribution)).consistencyScore(consistency).build();
    }
}
