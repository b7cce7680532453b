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

package com.amazon.anomalyensemble.context;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkPositive;

import lombok.Data;

import com.amazon.anomalyensemble.CommonUtils;

/**
 * A time-of-day plausibility rule: a value in [lowerBound, upperBound) observed
 * between startHour and endHour (inclusive, wrapping around midnight) has its
 * context multiplied by the rule's multiplier.
 */
@Data
public class TimeWindowRule {

    private final String name;

    private final int startHour;

    private final int endHour;

    private final double lowerBound;

    private final double upperBound;

    private final double multiplier;

    public TimeWindowRule(String name, int startHour, int endHour, double lowerBound, double upperBound,
            double multiplier) {
        checkArgument(startHour >= 0 && startHour < 24, "startHour must be in [0, 23]");
        checkArgument(endHour >= 0 && endHour < 24, "endHour must be in [0, 23]");
        checkArgument(lowerBound < upperBound, "lowerBound must be below upperBound");
        checkPositive(multiplier, "multiplier must be positive");
        this.name = name;
        this.startHour = startHour;
        this.endHour = endHour;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.multiplier = multiplier;
    }

    public boolean matches(int hour, double value) {
        return CommonUtils.inHourWindow(hour, startHour, endHour) && value >= lowerBound && value < upperBound;
    }
}
