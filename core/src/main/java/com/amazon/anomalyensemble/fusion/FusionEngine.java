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

import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyensemble.config.ConfidenceTier;
import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.returntypes.ConstraintAdjustedCandidate;
import com.amazon.anomalyensemble.returntypes.FusedAnomaly;

/**
 * Arbitration core. Candidates flow through {@link FusionStage#COLLECT},
 * {@link FusionStage#RESOLVE} and {@link FusionStage#EMIT}; the output is ranked
 * by descending total score, then by descending number of supporting methods,
 * then by ascending index.
 */
@Slf4j
public class FusionEngine {

    public static final Comparator<FusedAnomaly> RANKING = Comparator.comparingDouble(FusedAnomaly::getTotalScore)
            .reversed().thenComparing(Comparator.comparingInt(FusedAnomaly::getMethodCount).reversed())
            .thenComparingInt(FusedAnomaly::getIndex);

    private final double scoreFloor;
    private final int highTierMethods;
    private final int mediumTierMethods;
    private final Set<DetectionMethod> corroborationRequired;

    public FusionEngine(EnsembleConfig config) {
        checkNotNull(config, "config must not be null");
        this.scoreFloor = config.getScoreFloor();
        this.highTierMethods = config.getHighTierMethods();
        this.mediumTierMethods = config.getMediumTierMethods();
        this.corroborationRequired = config.getCorroborationRequired();
    }

    /**
     * @param candidates adjusted candidates that survived the score floor
     * @return the ranked fused anomalies, empty when nothing survives
     */
    public List<FusedAnomaly> fuse(List<ConstraintAdjustedCandidate> candidates) {
        checkNotNull(candidates, "candidates must not be null");
        SortedMap<Integer, List<ConstraintAdjustedCandidate>> groups = collect(candidates);
        log.debug("{}: {} candidates at {} indices", FusionStage.COLLECT, candidates.size(), groups.size());
        if (groups.isEmpty()) {
            return Collections.emptyList();
        }

        List<Resolution> resolutions = resolve(groups);
        log.debug("{}: {} indices resolved", FusionStage.RESOLVE, resolutions.size());

        List<FusedAnomaly> fused = emit(resolutions);
        log.debug("{}: {} fused anomalies", FusionStage.EMIT, fused.size());
        return fused;
    }

    SortedMap<Integer, List<ConstraintAdjustedCandidate>> collect(List<ConstraintAdjustedCandidate> candidates) {
        SortedMap<Integer, List<ConstraintAdjustedCandidate>> groups = new TreeMap<>();
        for (ConstraintAdjustedCandidate candidate : candidates) {
            groups.computeIfAbsent(candidate.getIndex(), k -> new ArrayList<>()).add(candidate);
        }
        return groups;
    }

    List<Resolution> resolve(SortedMap<Integer, List<ConstraintAdjustedCandidate>> groups) {
        List<Resolution> resolutions = new ArrayList<>(groups.size());
        for (Map.Entry<Integer, List<ConstraintAdjustedCandidate>> entry : groups.entrySet()) {
            List<ConstraintAdjustedCandidate> group = new ArrayList<>(entry.getValue());
            group.sort(Comparator.comparing(ConstraintAdjustedCandidate::getMethod));
            double total = 0;
            Set<DetectionMethod> methods = EnumSet.noneOf(DetectionMethod.class);
            for (ConstraintAdjustedCandidate candidate : group) {
                total += candidate.getAdjustedScore();
                methods.add(candidate.getMethod());
            }
            resolutions.add(new Resolution(entry.getKey(), total, methods));
        }
        return resolutions;
    }

    List<FusedAnomaly> emit(List<Resolution> resolutions) {
        List<FusedAnomaly> fused = new ArrayList<>();
        for (Resolution resolution : resolutions) {
            if (corroborationRequired.containsAll(resolution.getMethods())) {
                log.debug("index {} dropped, supported only by {}", resolution.getIndex(), resolution.getMethods());
                continue;
            }
            ConfidenceTier tier = tier(resolution.getMethods().size(), resolution.getTotalScore());
            if (tier != null) {
                fused.add(new FusedAnomaly(resolution.getIndex(), resolution.getTotalScore(), resolution.getMethods(),
                        tier));
            }
        }
        fused.sort(RANKING);
        return fused;
    }

    /**
     * @return the tier, or null when the index meets no bar
     */
    ConfidenceTier tier(int methodCount, double totalScore) {
        if (methodCount >= highTierMethods) {
            return ConfidenceTier.HIGH;
        }
        if (methodCount >= mediumTierMethods) {
            return ConfidenceTier.MEDIUM;
        }
        if (methodCount == 1 && totalScore > scoreFloor) {
            return ConfidenceTier.LOW;
        }
        return null;
    }

    @Data
    static class Resolution {
        private final int index;
        private final double totalScore;
        private final Set<DetectionMethod> methods;
    }
}
