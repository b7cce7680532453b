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

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import lombok.Data;

import com.amazon.anomalyensemble.config.ConfidenceTier;
import com.amazon.anomalyensemble.config.DetectionMethod;

/**
 * A position of the signal that survived fusion, with the methods that agree on
 * it. This is the entity handed to report generators.
 */
@Data
public class FusedAnomaly {

    private final int index;

    private final double totalScore;

    private final Set<DetectionMethod> supportingMethods;

    private final ConfidenceTier confidenceTier;

    public FusedAnomaly(int index, double totalScore, Set<DetectionMethod> supportingMethods,
            ConfidenceTier confidenceTier) {
        checkArgument(index >= 0, "index must be non-negative");
        checkArgument(!supportingMethods.isEmpty(), "a fused anomaly needs at least one supporting method");
        this.index = index;
        this.totalScore = totalScore;
        this.supportingMethods = Collections.unmodifiableSet(EnumSet.copyOf(supportingMethods));
        this.confidenceTier = confidenceTier;
    }

    public int getMethodCount() {
        return supportingMethods.size();
    }

    public boolean isSupportedBy(DetectionMethod method) {
        return supportingMethods.contains(method);
    }
}
