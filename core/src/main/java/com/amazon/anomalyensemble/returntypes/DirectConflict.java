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

import java.util.List;

import lombok.Data;

import com.amazon.anomalyensemble.config.DetectionMethod;

/**
 * The contested positions of a conflicting pair of methods, for audit. The
 * preferred method is the one carrying the stronger prior, that is the higher
 * method weight.
 */
@Data
public class DirectConflict {

    private final DetectionMethod methodA;

    private final DetectionMethod methodB;

    /** Positions flagged by method A only, ascending. */
    private final List<Integer> onlyA;

    /** Positions flagged by method B only, ascending. */
    private final List<Integer> onlyB;

    private final DetectionMethod preferredMethod;

    private final String resolutionHint;

    public int getContestedCount() {
        return onlyA.size() + onlyB.size();
    }
}
