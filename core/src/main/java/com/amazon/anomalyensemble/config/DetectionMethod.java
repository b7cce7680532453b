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

/**
 * The independent detectors of the ensemble. The declaration order is the
 * canonical order used whenever results are iterated, summed or reported, so
 * that every run is reproducible.
 */
public enum DetectionMethod {

    /**
     * global distribution tests: standard score, interquartile fences and median
     * absolute deviation
     */
    STATISTICAL("statistical"),
    /**
     * stuck runs, oscillation, trend reversal and non-physiological periodicity
     */
    PATTERN_BASED("pattern_based"),
    /**
     * high frequency energy and spurious periodicity in the power spectrum
     */
    FREQUENCY("frequency"),
    /**
     * local outlier factor over a fixed per-position feature vector; the only
     * black-box procedure of the bank
     */
    LEARNED_DENSITY("learned_density"),
    /**
     * domain limits: impossible values, impossible rates, implausible runs and
     * stuck sensor values
     */
    PHYSIOLOGICAL("physiological"),
    /**
     * sampling gaps, moving average residuals and local standard scores
     */
    TEMPORAL("temporal");

    private final String key;

    DetectionMethod(String key) {
        this.key = key;
    }

    /**
     * @return the short identifier used in reports and on the command line
     */
    public String getKey() {
        return key;
    }

    /**
     * Looks up a method by its short identifier.
     *
     * @param key the identifier, for example {@code "pattern_based"}
     * @return the matching method
     * @throws IllegalArgumentException if no method has this identifier
     */
    public static DetectionMethod fromKey(String key) {
        for (DetectionMethod method : values()) {
            if (method.key.equalsIgnoreCase(key)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method: " + key);
    }
}
