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

package com.amazon.anomalyensemble.fusion;

/**
 * Stages of the fusion pipeline, in execution order.
 */
public enum FusionStage {
    /**
     * Gather the surviving adjusted candidates, grouped by index.
     */
    COLLECT,
    /**
     * Sum the adjusted scores of every index and count its distinct supporting
     * methods.
     */
    RESOLVE,
    /**
     * Assign confidence tiers, discard indices that meet no bar, and rank.
     */
    EMIT
}
