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

package com.amazon.anomalyensemble.constraint;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkPositive;

import java.util.OptionalInt;

import lombok.Data;

import com.amazon.anomalyensemble.CommonUtils;
import com.amazon.anomalyensemble.signal.AnalysisContext;
import com.amazon.anomalyensemble.signal.Signal;

/**
 * A declarative domain rule that multiplies the score of a candidate when its
 * condition holds.
 */
@Data
public class ConstraintRule {

    public enum Condition {
        /**
         * Always applies.
         */
        ALWAYS,
        /**
         * Applies when the value lies in the closed band [lower, upper].
         */
        VALUE_IN_BAND,
        /**
         * Applies when the sample was taken between the start and end hour,
         * inclusive and wrapping around midnight. Needs timestamps.
         */
        HOUR_IN_WINDOW
    }

    private final String name;

    private final Condition condition;

    private final double lower;

    private final double upper;

    private final double multiplier;

    private ConstraintRule(String name, Condition condition, double lower, double upper, double multiplier) {
        checkPositive(multiplier, "multiplier must be positive");
        this.name = name;
        this.condition = condition;
        this.lower = lower;
        this.upper = upper;
        this.multiplier = multiplier;
    }

    public static ConstraintRule always(String name, double multiplier) {
        return new ConstraintRule(name, Condition.ALWAYS, 0, 0, multiplier);
    }

    public static ConstraintRule valueInBand(String name, double lower, double upper, double multiplier) {
        checkArgument(lower <= upper, "lower must not exceed upper");
        return new ConstraintRule(name, Condition.VALUE_IN_BAND, lower, upper, multiplier);
    }

    public static ConstraintRule hourInWindow(String name, int startHour, int endHour, double multiplier) {
        checkArgument(startHour >= 0 && startHour < 24 && endHour >= 0 && endHour < 24, "hours must be in [0, 23]");
        return new ConstraintRule(name, Condition.HOUR_IN_WINDOW, startHour, endHour, multiplier);
    }

    /**
     * @param signal  the signal under analysis
     * @param index   position of the candidate
     * @param context side-channel context of the run
     * @return true if the rule's condition holds at the position
     */
    public boolean applies(Signal signal, int index, AnalysisContext context) {
        switch (condition) {
        case ALWAYS:
            return true;
        case VALUE_IN_BAND:
            double value = signal.getValue(index);
            return value >= lower && value <= upper;
        case HOUR_IN_WINDOW:
            if (context == null || !context.isTimeOfDayAvailable(signal)) {
                return false;
            }
            OptionalInt hour = signal.getHourOfDay(index, context.getZone());
            return hour.isPresent() && CommonUtils.inHourWindow(hour.getAsInt(), (int) lower, (int) upper);
        default:
            throw new IllegalStateException("unknown condition " + condition);
        }
    }

    public double multiplierAt(Signal signal, int index, AnalysisContext context) {
        return applies(signal, index, context) ? multiplier : 1.0;
    }
}
