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
import com.amazon.anomalyensemble.config.RelationType;
import com.amazon.anomalyensemble.relationship.ExpectedRelation;

/**
 * Relationship between the candidate sets of two methods. Method A precedes
 * method B in the canonical method order.
 */
@Data
public class RelationshipEdge {

    private final DetectionMethod methodA;

    private final DetectionMethod methodB;

    /** |A and B| / min(|A|, |B|). */
    private final double overlapRatio;

    private final RelationType relation;

    private final ExpectedRelation expectedRelation;

    private final int countA;

    private final int countB;

    private final int sharedCount;

    public boolean involves(DetectionMethod method) {
        return methodA == method || methodB == method;
    }
}
