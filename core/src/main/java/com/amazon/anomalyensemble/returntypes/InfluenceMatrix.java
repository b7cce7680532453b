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

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import com.amazon.anomalyensemble.config.DetectionMethod;

/**
 * Directed influence between methods: the entry (from, to) is the fraction of
 * the candidates of {@code from} that {@code to} also flags. Diagonal entries
 * are not stored.
 */
@EqualsAndHashCode
@ToString
public class InfluenceMatrix {

    private final Map<DetectionMethod, Map<DetectionMethod, Double>> entries;

    public InfluenceMatrix(Map<DetectionMethod, Map<DetectionMethod, Double>> entries) {
        this.entries = new EnumMap<>(DetectionMethod.class);
        entries.forEach((from, row) -> this.entries.put(from, Collections.unmodifiableMap(new EnumMap<>(row))));
    }

    public Set<DetectionMethod> getMethods() {
        return entries.isEmpty() ? EnumSet.noneOf(DetectionMethod.class) : EnumSet.copyOf(entries.keySet());
    }

    /**
     * @return the fraction of candidates of from also flagged by to, 0 when
     *         either method is absent
     */
    public double get(DetectionMethod from, DetectionMethod to) {
        Map<DetectionMethod, Double> row = entries.get(from);
        return row == null ? 0 : row.getOrDefault(to, 0.0);
    }

    public double getRowSum(DetectionMethod from) {
        Map<DetectionMethod, Double> row = entries.get(from);
        return row == null ? 0 : row.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public double getColumnSum(DetectionMethod to) {
        return entries.keySet().stream().mapToDouble(from -> get(from, to)).sum();
    }

    /**
     * @return the method with the largest row sum, the earliest on ties
     */
    public Optional<DetectionMethod> getDominantInfluencer() {
        DetectionMethod best = null;
        for (DetectionMethod method : entries.keySet()) {
            if (best == null || getRowSum(method) > getRowSum(best)) {
                best = method;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * @return the method with the largest column sum, the earliest on ties
     */
    public Optional<DetectionMethod> getMostInfluenced() {
        DetectionMethod best = null;
        for (DetectionMethod method : entries.keySet()) {
            if (best == null || getColumnSum(method) > getColumnSum(best)) {
                best = method;
            }
        }
        return Optional.ofNullable(best);
    }
}
