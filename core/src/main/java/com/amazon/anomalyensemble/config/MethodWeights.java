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

package com.amazon.anomalyensemble.config;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import lombok.EqualsAndHashCode;

/**
 * Immutable table of per-method trust weights. The defaults are the weights of
 * the glucose deployment expressed relative to a uniform one-sixth share, so a
 * weight of 1.0 means average trust.
 */
@EqualsAndHashCode
public class MethodWeights {

    public static final double DEFAULT_STATISTICAL_WEIGHT = 0.9;
    public static final double DEFAULT_PATTERN_WEIGHT = 1.2;
    public static final double DEFAULT_FREQUENCY_WEIGHT = 0.48;
    public static final double DEFAULT_DENSITY_WEIGHT = 0.9;
    public static final double DEFAULT_PHYSIOLOGICAL_WEIGHT = 1.8;
    public static final double DEFAULT_TEMPORAL_WEIGHT = 0.72;

    private final EnumMap<DetectionMethod, Double> weights;

    private MethodWeights(EnumMap<DetectionMethod, Double> weights) {
        for (DetectionMethod method : DetectionMethod.values()) {
            Double weight = weights.get(method);
            checkArgument(weight != null, "missing weight for " + method);
            checkArgument(Double.isFinite(weight) && weight >= 0, "weight must be non-negative for " + method);
        }
        this.weights = weights;
    }

    /**
     * @return the default weight table
     */
    public static MethodWeights defaults() {
        EnumMap<DetectionMethod, Double> map = new EnumMap<>(DetectionMethod.class);
        map.put(DetectionMethod.STATISTICAL, DEFAULT_STATISTICAL_WEIGHT);
        map.put(DetectionMethod.PATTERN_BASED, DEFAULT_PATTERN_WEIGHT);
        map.put(DetectionMethod.FREQUENCY, DEFAULT_FREQUENCY_WEIGHT);
        map.put(DetectionMethod.LEARNED_DENSITY, DEFAULT_DENSITY_WEIGHT);
        map.put(DetectionMethod.PHYSIOLOGICAL, DEFAULT_PHYSIOLOGICAL_WEIGHT);
        map.put(DetectionMethod.TEMPORAL, DEFAULT_TEMPORAL_WEIGHT);
        return new MethodWeights(map);
    }

    /**
     * @param weight the weight given to every method
     * @return a table with the same weight for every method
     */
    public static MethodWeights uniform(double weight) {
        EnumMap<DetectionMethod, Double> map = new EnumMap<>(DetectionMethod.class);
        for (DetectionMethod method : DetectionMethod.values()) {
            map.put(method, weight);
        }
        return new MethodWeights(map);
    }

    public double get(DetectionMethod method) {
        return weights.get(checkNotNull(method, "method must not be null"));
    }

    /**
     * @param method the method to change
     * @param weight the new weight
     * @return a copy of this table with one weight replaced
     */
    public MethodWeights with(DetectionMethod method, double weight) {
        EnumMap<DetectionMethod, Double> copy = new EnumMap<>(weights);
        copy.put(checkNotNull(method, "method must not be null"), weight);
        return new MethodWeights(copy);
    }

    /**
     * @param method the method to change
     * @param factor multiplier applied to the current weight
     * @return a copy of this table with one weight scaled
     */
    public MethodWeights scale(DetectionMethod method, double factor) {
        return with(method, get(method) * factor);
    }

    public Map<DetectionMethod, Double> asMap() {
        return Collections.unmodifiableMap(weights);
    }

    @Override
    public String toString() {
        return "MethodWeights" + weights;
    }
}
