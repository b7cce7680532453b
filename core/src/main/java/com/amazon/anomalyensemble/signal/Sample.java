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

package com.amazon.anomalyensemble.signal;

import java.time.Instant;
import java.util.Optional;

import lombok.Data;

/**
 * A single reading. The timestamp is optional; a signal either has timestamps
 * on every sample or on none.
 */
@Data
public class Sample {

    private final Instant timestamp;

    private final double value;

    public static Sample of(double value) {
        return new Sample(null, value);
    }

    public static Sample of(Instant timestamp, double value) {
        return new Sample(timestamp, value);
    }

    public Optional<Instant> getOptionalTimestamp() {
        return Optional.ofNullable(timestamp);
    }
}
