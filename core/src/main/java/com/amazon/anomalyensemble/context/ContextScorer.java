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
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.OptionalInt;

import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.signal.AnalysisContext;
import com.amazon.anomalyensemble.signal.Signal;
import com.amazon.anomalyensemble.statistics.Statistics;

/**
 * Plausibility multiplier of a position, independent of the method that flagged
 * it. The multiplier is the product of a time-of-day factor from the
 * {@link ContextProfile} and a neighborhood factor: a quiet neighborhood makes an
 * isolated deviation more suspicious, a noisy one makes it less remarkable.
 */
public class ContextScorer {

    private final ContextProfile profile;
    private final int radius;
    private final double stableStd;
    private final double stableMultiplier;
    private final double unstableStd;
    private final double unstableMultiplier;

    public ContextScorer(EnsembleConfig config) {
        checkNotNull(config, "config must not be null");
        this.profile = config.getContextProfile();
        this.radius = config.getNeighborhoodRadius();
        this.stableStd = config.getStableStd();
        this.stableMultiplier = config.getStableMultiplier();
        this.unstableStd = config.getUnstableStd();
        this.unstableMultiplier = config.getUnstableMultiplier();
    }

    public double score(Signal signal, int index) {
        return score(signal, index, AnalysisContext.defaults());
    }

    /**
     * @param signal  the signal under analysis
     * @param index   position to score
     * @param context side-channel context of the run
     * @return the context multiplier of the position
     */
    public double score(Signal signal, int index, AnalysisContext context) {
        checkNotNull(signal, "signal must not be null");
        checkArgument(index >= 0 && index < signal.size(), "index out of range");
        return timeOfDayMultiplier(signal, index, context) * neighborhoodMultiplier(signal, index);
    }

    public double timeOfDayMultiplier(Signal signal, int index, AnalysisContext context) {
        if (context == null || !context.isTimeOfDayAvailable(signal)) {
            return 1.0;
        }
        OptionalInt hour = signal.getHourOfDay(index, context.getZone());
        return hour.isPresent() ? profile.multiplier(hour.getAsInt(), signal.getValue(index)) : 1.0;
    }

    /**
     * @return the stability factor of the readings within the radius, 1 at the
     *         first and last position of the signal
     */
    public double neighborhoodMultiplier(Signal signal, int index) {
        if (index == 0 || index == signal.size() - 1) {
            return 1.0;
        }
        int from = Math.max(0, index - radius);
        int to = Math.min(signal.size(), index + radius + 1);
        double std = Statistics.standardDeviation(signal.window(from, to));
        if (std < stableStd) {
            return stableMultiplier;
        }
        if (std > unstableStd) {
            return unstableMultiplier;
        }
        return 1.0;
    }
}
