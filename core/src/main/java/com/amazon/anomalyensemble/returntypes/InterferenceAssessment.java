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

import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.Data;

import com.amazon.anomalyensemble.config.DetectionMethod;

/**
 * Conditions of a run that make some methods less reliable than usual: sampling
 * irregularity, a signal too short for windowed methods, and unbalanced
 * detection rates across methods.
 */
@Data
@Builder
public class InterferenceAssessment {

    private final boolean irregularSampling;

    /** Methods that assume a regular sampling grid. */
    private final Set<DetectionMethod> irregularSamplingAffected;

    private final boolean shortSignal;

    /** Methods whose windows need a longer signal. */
    private final Set<DetectionMethod> shortSignalAffected;

    /** Flagged share of the signal, per enabled method. */
    private final Map<DetectionMethod, Double> detectionRates;

    /** Methods whose rate exceeds the mean rate by more than one deviation. */
    private final Set<DetectionMethod> overSensitive;

    /** Methods whose rate falls short of the mean rate by more than one deviation. */
    private final Set<DetectionMethod> underSensitive;

    /** 1 - std / mean of the detection rates; 1 means perfectly balanced. */
    private final double balanceScore;
}
