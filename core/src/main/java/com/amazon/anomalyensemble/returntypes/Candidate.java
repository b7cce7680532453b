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
 * One detector's opinion that a position of the signal is anomalous. A detector
 * produces at most one candidate per index.
 */
@Data
public class Candidate {

    private final int index;

    private final DetectionMethod method;

    private final double rawScore;
}
