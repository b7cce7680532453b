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

package com.amazon.anomalyensemble.relationship;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.EnumMap;
import java.util.Map;

import lombok.EqualsAndHashCode;

import com.amazon.anomalyensemble.config.DetectionMethod;

/**
 * Symmetric table of expected relations between pairs of methods. Pairs that
 * are not listed are {@link ExpectedRelation#INDEPENDENT}. Instances are
 * immutable; {@link #with} returns a modified copy.
 */
@EqualsAndHashCode
public class ExpectedRelationshipTable {

    private final Map<DetectionMethod, Map<DetectionMethod, ExpectedRelation>> table;

    private ExpectedRelationshipTable(Map<DetectionMethod, Map<DetectionMethod, ExpectedRelation>> table) {
        this.table = table;
    }

    public static ExpectedRelationshipTable empty() {
        return new ExpectedRelationshipTable(new EnumMap<>(DetectionMethod.class));
    }

    /**
     * The glucose defaults: the physiological and statistical detectors should
     * agree, as should pattern and temporal, frequency and temporal, and learned
     * density and statistical.
     *
     * @return the default table
     */
    public static ExpectedRelationshipTable defaults() {
        return empty().with(DetectionMethod.STATISTICAL, DetectionMethod.PHYSIOLOGICAL, ExpectedRelation.AGREE)
                .with(DetectionMethod.PATTERN_BASED, DetectionMethod.TEMPORAL, ExpectedRelation.AGREE)
                .with(DetectionMethod.FREQUENCY, DetectionMethod.TEMPORAL, ExpectedRelation.AGREE)
                .with(DetectionMethod.LEARNED_DENSITY, DetectionMethod.STATISTICAL, ExpectedRelation.AGREE);
    }

    /**
     * @param a        one method
     * @param b        another method
     * @param relation the expectation for the unordered pair
     * @return a copy of this table with the pair set
     */
    public ExpectedRelationshipTable with(DetectionMethod a, DetectionMethod b, ExpectedRelation relation) {
        checkNotNull(a, "method must not be null");
        checkNotNull(b, "method must not be null");
        checkNotNull(relation, "relation must not be null");
        checkArgument(a != b, "a method has no relation with itself");
        Map<DetectionMethod, Map<DetectionMethod, ExpectedRelation>> copy = new EnumMap<>(DetectionMethod.class);
        table.forEach((method, row) -> copy.put(method, new EnumMap<>(row)));
        copy.computeIfAbsent(a, k -> new EnumMap<>(DetectionMethod.class)).put(b, relation);
        copy.computeIfAbsent(b, k -> new EnumMap<>(DetectionMethod.class)).put(a, relation);
        return new ExpectedRelationshipTable(copy);
    }

    public ExpectedRelation get(DetectionMethod a, DetectionMethod b) {
        Map<DetectionMethod, ExpectedRelation> row = table.get(a);
        if (row == null) {
            return ExpectedRelation.INDEPENDENT;
        }
        return row.getOrDefault(b, ExpectedRelation.INDEPENDENT);
    }

    public boolean expectsAgreement(DetectionMethod a, DetectionMethod b) {
        return get(a, b) == ExpectedRelation.AGREE;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("ExpectedRelationshipTable[");
        String separator = "";
        for (DetectionMethod a : DetectionMethod.values()) {
            for (DetectionMethod b : DetectionMethod.values()) {
                if (a.ordinal() < b.ordinal() && get(a, b) != ExpectedRelation.INDEPENDENT) {
                    builder.append(separator).append(a.getKey()).append('~').append(b.getKey()).append('=')
                            .append(get(a, b));
                    separator = ", ";
                }
            }
        }
        return builder.append(']').toString();
    }
}
