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

import lombok.Data;

import com.amazon.anomalyensemble.config.DetectionMethod;

/**
 * A candidate after context and constraint scoring. The adjusted score is the
 * product of the raw score, both multipliers and the method weight.
 */
@Data
public class ConstraintAdjustedCandidate {

    private final Candidate candidate;

    private final double contextMultiplier;

    private final double constraintMultiplier;

    private final double methodWeight;

    private final double adjustedScore;

    public ConstraintAdjustedCandidate(Candidate candidate, double contextMultiplier, double constraintMultiplier,
            double methodWeight) {
        this.candidate = candidate;
        this.contextMultiplier = contextMultiplier;
        this.constraintMultiplier = constraintMultiplier;
        this.methodWeight = methodWeight;
        this.adjustedScore = candidate.getRawScore() * contextMultiplier * constraintMultiplier * methodWeight;
    }

    public int getIndex() {
        return candidate.getIndex();
    }

    public DetectionMethod getMethod() {
        return candidate.getMethod();
    }

    public double getRawScore() {
        return candidate.getRawScore();
    }
}
