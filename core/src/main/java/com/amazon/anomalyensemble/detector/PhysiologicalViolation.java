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

package com.amazon.anomalyensemble.detector;

/**
 * Violation types of the physiological detector, ranked by severity. The
 * severity is the raw score of the candidate.
 */
public enum PhysiologicalViolation {
    /**
     * The value is impossible for the quantity measured.
     */
    ABSOLUTE_LIMIT(1.0),
    /**
     * The value changed faster than the physiological ceiling allows.
     */
    RATE_OF_CHANGE(0.8),
    /**
     * The value stayed extreme for longer than plausible.
     */
    SUSTAINED_EXTREME(0.7),
    /**
     * The value is possible but extreme.
     */
    EXTREME_VALUE(0.6),
    /**
     * The value recurs so often that a stuck sensor is likely.
     */
    REPEATED_VALUE(0.5);

    private final double severity;

    PhysiologicalViolation(double severity) {
        this.severity = severity;
    }

    public double getSeverity() {
        return severity;
    }
}
