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
 * Coarse confidence bucket of a fused anomaly, derived from the number of
 * methods that agree on it.
 */
public enum ConfidenceTier {

    HIGH,
    MEDIUM,
    LOW;

    /**
     * @param other another tier
     * @return true if this tier is strictly more confident than the other
     */
    public boolean isAbove(ConfidenceTier other) {
        return ordinal() < other.ordinal();
    }
}
