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

import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.time.ZoneId;
import java.time.ZoneOffset;

import lombok.Data;

/**
 * Side-channel information that accompanies a signal into an analysis run.
 * Time-of-day reasoning needs the zone in which the wall clock of the subject is
 * read; it can also be switched off for signals whose timestamps are synthetic.
 */
@Data
public class AnalysisContext {

    private static final AnalysisContext DEFAULT = new AnalysisContext(ZoneOffset.UTC, true);

    private final ZoneId zone;

    private final boolean timeOfDayEnabled;

    public AnalysisContext(ZoneId zone, boolean timeOfDayEnabled) {
        this.zone = checkNotNull(zone, "zone must not be null");
        this.timeOfDayEnabled = timeOfDayEnabled;
    }

    /**
     * @return a context reading hours in UTC
     */
    public static AnalysisContext defaults() {
        return DEFAULT;
    }

    public static AnalysisContext inZone(ZoneId zone) {
        return new AnalysisContext(zone, true);
    }

    /**
     * @return a context that ignores time of day
     */
    public static AnalysisContext withoutTimeOfDay() {
        return new AnalysisContext(ZoneOffset.UTC, false);
    }

    /**
     * @param signal the signal under analysis
     * @return true if hour-of-day rules can be evaluated for this signal
     */
    public boolean isTimeOfDayAvailable(Signal signal) {
        return timeOfDayEnabled && signal.hasTimestamps();
    }
}
