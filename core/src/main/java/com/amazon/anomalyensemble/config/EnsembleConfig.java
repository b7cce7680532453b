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

package com.amazon.anomalyensemble.config;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkFraction;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;
import static com.amazon.anomalyensemble.CommonUtils.checkPositive;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import com.amazon.anomalyensemble.context.ContextProfile;
import com.amazon.anomalyensemble.relationship.ExpectedRelationshipTable;

/**
 * Every threshold used by the detectors, the scorers and the fusion engine.
 * Instances are immutable; use {@link #toBuilder()} to derive a variant. The
 * defaults are calibrated for glucose readings in mg/dL.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class EnsembleConfig {

    // statistical
    public static final double DEFAULT_Z_SCORE_THRESHOLD = 2.5;
    public static final double DEFAULT_IQR_MULTIPLIER = 1.5;
    public static final double DEFAULT_MAD_THRESHOLD = 3.5;

    // pattern
    public static final double DEFAULT_FLAT_TOLERANCE = 0.5;
    public static final int DEFAULT_FLAT_MIN_LENGTH = 6;
    public static final double DEFAULT_OSCILLATION_STD_MULTIPLIER = 2.0;
    public static final int DEFAULT_TREND_WINDOW = 15;
    public static final double DEFAULT_TREND_CHANGE_THRESHOLD = 2.0;
    public static final double DEFAULT_AUTOCORR_PEAK_HEIGHT_RATIO = 0.3;
    public static final int DEFAULT_AUTOCORR_MAX_LAG = 20;
    public static final int DEFAULT_AUTOCORR_MAX_PEAKS = 3;
    public static final int DEFAULT_MIN_LENGTH_FOR_PATTERN = 10;
    public static final int DEFAULT_MIN_LENGTH_FOR_PERIODICITY = 31;

    // frequency
    public static final double DEFAULT_SIGNAL_HIGH_FREQUENCY_RATIO = 0.15;
    public static final double DEFAULT_WINDOW_HIGH_FREQUENCY_RATIO = 0.2;
    public static final double DEFAULT_HIGH_FREQUENCY_CUTOFF = 1.0 / 3;
    public static final int DEFAULT_FREQUENCY_WINDOW_SIZE = 10;
    public static final double DEFAULT_MIN_HIGH_FREQUENCY_AMPLITUDE = 5.0;
    public static final double DEFAULT_PERIODIC_PEAK_HEIGHT_RATIO = 0.1;
    public static final double DEFAULT_PERIODIC_PEAK_DOMINANCE = 10.0;
    public static final int DEFAULT_MIN_PERIOD = 5;
    public static final int DEFAULT_MAX_PERIOD = 20;
    public static final int DEFAULT_MIN_LENGTH_FOR_FREQUENCY = 10;

    // learned density
    public static final double DEFAULT_CONTAMINATION = 0.1;
    public static final int DEFAULT_DENSITY_NEIGHBORS = 10;
    public static final int DEFAULT_MIN_LENGTH_FOR_DENSITY = 20;
    public static final double DEFAULT_MIN_OUTLIER_FACTOR = 1.0;

    // physiological, mg/dL and mg/dL per minute
    public static final double DEFAULT_ABSOLUTE_MIN = 20;
    public static final double DEFAULT_ABSOLUTE_MAX = 600;
    public static final double DEFAULT_EXTREME_MIN = 40;
    public static final double DEFAULT_EXTREME_MAX = 400;
    public static final double DEFAULT_MAX_RATE_OF_CHANGE = 15;
    public static final double DEFAULT_SUSTAINED_HIGH = 300;
    public static final int DEFAULT_SUSTAINED_HIGH_MIN_LENGTH = 6;
    public static final double DEFAULT_SUSTAINED_LOW = 60;
    public static final int DEFAULT_SUSTAINED_LOW_MIN_LENGTH = 4;
    public static final double DEFAULT_REPEATED_VALUE_RATIO = 0.1;
    public static final int DEFAULT_REPEATED_VALUE_MIN_COUNT = 5;

    // temporal, minutes
    public static final double DEFAULT_MIN_INTERVAL_MINUTES = 2;
    public static final double DEFAULT_MAX_INTERVAL_MINUTES = 60;
    public static final int DEFAULT_PREDICTION_WINDOW = 5;
    public static final double DEFAULT_PREDICTION_ERROR_THRESHOLD = 50;
    public static final int DEFAULT_LOCAL_WINDOW = 7;
    public static final double DEFAULT_LOCAL_Z_THRESHOLD = 3;
    public static final int DEFAULT_MIN_LENGTH_FOR_LOCAL_Z = 11;

    public static final double DEFAULT_NOMINAL_INTERVAL_MINUTES = 15;

    // context
    public static final int DEFAULT_NEIGHBORHOOD_RADIUS = 2;
    public static final double DEFAULT_STABLE_STD = 10;
    public static final double DEFAULT_STABLE_MULTIPLIER = 1.2;
    public static final double DEFAULT_UNSTABLE_STD = 30;
    public static final double DEFAULT_UNSTABLE_MULTIPLIER = 0.8;

    // constraint
    public static final double DEFAULT_NORMAL_BAND_LOW = 70;
    public static final double DEFAULT_NORMAL_BAND_HIGH = 200;
    public static final double DEFAULT_NORMAL_BAND_STATISTICAL_MULTIPLIER = 0.5;
    public static final int DEFAULT_NIGHT_START_HOUR = 23;
    public static final int DEFAULT_NIGHT_END_HOUR = 6;
    public static final double DEFAULT_NIGHT_PATTERN_MULTIPLIER = 0.3;
    public static final double DEFAULT_PHYSIOLOGICAL_BOOST = 1.5;
    public static final double DEFAULT_CORROBORATION_MULTIPLIER = 0.8;

    // fusion
    public static final double DEFAULT_SCORE_FLOOR = 0.4;
    public static final int DEFAULT_HIGH_TIER_METHODS = 3;
    public static final int DEFAULT_MEDIUM_TIER_METHODS = 2;

    // relationship
    public static final double DEFAULT_SUPPORT_THRESHOLD = 0.7;
    public static final double DEFAULT_CONFLICT_THRESHOLD = 0.3;
    public static final int DEFAULT_MIN_CONFLICT_COUNT = 10;
    public static final double DEFAULT_CONFLICT_PENALTY = 0.8;
    public static final double DEFAULT_SUPPORT_BONUS = 1.1;
    public static final int DEFAULT_SHORT_SIGNAL_LENGTH = 50;

    public static final int DEFAULT_THREAD_POOL_SIZE = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

    @Builder.Default
    private final double zScoreThreshold = DEFAULT_Z_SCORE_THRESHOLD;
    @Builder.Default
    private final double iqrMultiplier = DEFAULT_IQR_MULTIPLIER;
    @Builder.Default
    private final double madThreshold = DEFAULT_MAD_THRESHOLD;

    @Builder.Default
    private final double flatTolerance = DEFAULT_FLAT_TOLERANCE;
    @Builder.Default
    private final int flatMinLength = DEFAULT_FLAT_MIN_LENGTH;
    @Builder.Default
    private final double oscillationStdMultiplier = DEFAULT_OSCILLATION_STD_MULTIPLIER;
    @Builder.Default
    private final int trendWindow = DEFAULT_TREND_WINDOW;
    /** Change in slope, in units per minute, that counts as a trend reversal. */
    @Builder.Default
    private final double trendChangeThreshold = DEFAULT_TREND_CHANGE_THRESHOLD;
    @Builder.Default
    private final double autocorrPeakHeightRatio = DEFAULT_AUTOCORR_PEAK_HEIGHT_RATIO;
    @Builder.Default
    private final int autocorrMaxLag = DEFAULT_AUTOCORR_MAX_LAG;
    @Builder.Default
    private final int autocorrMaxPeaks = DEFAULT_AUTOCORR_MAX_PEAKS;
    @Builder.Default
    private final int minLengthForPattern = DEFAULT_MIN_LENGTH_FOR_PATTERN;
    @Builder.Default
    private final int minLengthForPeriodicity = DEFAULT_MIN_LENGTH_FOR_PERIODICITY;

    @Builder.Default
    private final double signalHighFrequencyRatio = DEFAULT_SIGNAL_HIGH_FREQUENCY_RATIO;
    @Builder.Default
    private final double windowHighFrequencyRatio = DEFAULT_WINDOW_HIGH_FREQUENCY_RATIO;
    /** Start of the high-frequency band as a fraction of the Nyquist frequency. */
    @Builder.Default
    private final double highFrequencyCutoff = DEFAULT_HIGH_FREQUENCY_CUTOFF;
    /** Sliding windows advance by half this size. */
    @Builder.Default
    private final int frequencyWindowSize = DEFAULT_FREQUENCY_WINDOW_SIZE;
    @Builder.Default
    private final double minHighFrequencyAmplitude = DEFAULT_MIN_HIGH_FREQUENCY_AMPLITUDE;
    @Builder.Default
    private final double periodicPeakHeightRatio = DEFAULT_PERIODIC_PEAK_HEIGHT_RATIO;
    @Builder.Default
    private final double periodicPeakDominance = DEFAULT_PERIODIC_PEAK_DOMINANCE;
    @Builder.Default
    private final int minPeriod = DEFAULT_MIN_PERIOD;
    @Builder.Default
    private final int maxPeriod = DEFAULT_MAX_PERIOD;
    @Builder.Default
    private final int minLengthForFrequency = DEFAULT_MIN_LENGTH_FOR_FREQUENCY;

    @Builder.Default
    private final double contamination = DEFAULT_CONTAMINATION;
    @Builder.Default
    private final int densityNeighbors = DEFAULT_DENSITY_NEIGHBORS;
    @Builder.Default
    private final int minLengthForDensity = DEFAULT_MIN_LENGTH_FOR_DENSITY;
    @Builder.Default
    private final double minOutlierFactor = DEFAULT_MIN_OUTLIER_FACTOR;

    @Builder.Default
    private final double absoluteMin = DEFAULT_ABSOLUTE_MIN;
    @Builder.Default
    private final double absoluteMax = DEFAULT_ABSOLUTE_MAX;
    @Builder.Default
    private final double extremeMin = DEFAULT_EXTREME_MIN;
    @Builder.Default
    private final double extremeMax = DEFAULT_EXTREME_MAX;
    /** Largest plausible change, in units per minute. */
    @Builder.Default
    private final double maxRateOfChange = DEFAULT_MAX_RATE_OF_CHANGE;
    @Builder.Default
    private final double sustainedHigh = DEFAULT_SUSTAINED_HIGH;
    @Builder.Default
    private final int sustainedHighMinLength = DEFAULT_SUSTAINED_HIGH_MIN_LENGTH;
    @Builder.Default
    private final double sustainedLow = DEFAULT_SUSTAINED_LOW;
    @Builder.Default
    private final int sustainedLowMinLength = DEFAULT_SUSTAINED_LOW_MIN_LENGTH;
    @Builder.Default
    private final double repeatedValueRatio = DEFAULT_REPEATED_VALUE_RATIO;
    @Builder.Default
    private final int repeatedValueMinCount = DEFAULT_REPEATED_VALUE_MIN_COUNT;

    @Builder.Default
    private final double minIntervalMinutes = DEFAULT_MIN_INTERVAL_MINUTES;
    @Builder.Default
    private final double maxIntervalMinutes = DEFAULT_MAX_INTERVAL_MINUTES;
    @Builder.Default
    private final int predictionWindow = DEFAULT_PREDICTION_WINDOW;
    @Builder.Default
    private final double predictionErrorThreshold = DEFAULT_PREDICTION_ERROR_THRESHOLD;
    /** Half width of the symmetric window of the local z-score. */
    @Builder.Default
    private final int localWindow = DEFAULT_LOCAL_WINDOW;
    @Builder.Default
    private final double localZThreshold = DEFAULT_LOCAL_Z_THRESHOLD;
    @Builder.Default
    private final int minLengthForLocalZ = DEFAULT_MIN_LENGTH_FOR_LOCAL_Z;

    /** Spacing assumed between samples of a signal without timestamps. */
    @Builder.Default
    private final double nominalIntervalMinutes = DEFAULT_NOMINAL_INTERVAL_MINUTES;

    @Builder.Default
    private final ContextProfile contextProfile = ContextProfile.glucoseDefaults();
    @Builder.Default
    private final int neighborhoodRadius = DEFAULT_NEIGHBORHOOD_RADIUS;
    @Builder.Default
    private final double stableStd = DEFAULT_STABLE_STD;
    @Builder.Default
    private final double stableMultiplier = DEFAULT_STABLE_MULTIPLIER;
    @Builder.Default
    private final double unstableStd = DEFAULT_UNSTABLE_STD;
    @Builder.Default
    private final double unstableMultiplier = DEFAULT_UNSTABLE_MULTIPLIER;

    @Builder.Default
    private final double normalBandLow = DEFAULT_NORMAL_BAND_LOW;
    @Builder.Default
    private final double normalBandHigh = DEFAULT_NORMAL_BAND_HIGH;
    @Builder.Default
    private final double normalBandStatisticalMultiplier = DEFAULT_NORMAL_BAND_STATISTICAL_MULTIPLIER;
    @Builder.Default
    private final int nightStartHour = DEFAULT_NIGHT_START_HOUR;
    @Builder.Default
    private final int nightEndHour = DEFAULT_NIGHT_END_HOUR;
    @Builder.Default
    private final double nightPatternMultiplier = DEFAULT_NIGHT_PATTERN_MULTIPLIER;
    @Builder.Default
    private final double physiologicalBoost = DEFAULT_PHYSIOLOGICAL_BOOST;
    @Builder.Default
    private final double corroborationMultiplier = DEFAULT_CORROBORATION_MULTIPLIER;

    @Builder.Default
    private final MethodWeights methodWeights = MethodWeights.defaults();

    @Builder.Default
    private final double scoreFloor = DEFAULT_SCORE_FLOOR;
    @Builder.Default
    private final int highTierMethods = DEFAULT_HIGH_TIER_METHODS;
    @Builder.Default
    private final int mediumTierMethods = DEFAULT_MEDIUM_TIER_METHODS;
    @Builder.Default
    private final Set<DetectionMethod> corroborationRequired = EnumSet.of(DetectionMethod.LEARNED_DENSITY);

    @Builder.Default
    private final double supportThreshold = DEFAULT_SUPPORT_THRESHOLD;
    @Builder.Default
    private final double conflictThreshold = DEFAULT_CONFLICT_THRESHOLD;
    @Builder.Default
    private final int minConflictCount = DEFAULT_MIN_CONFLICT_COUNT;
    @Builder.Default
    private final ExpectedRelationshipTable expectedRelationships = ExpectedRelationshipTable.defaults();
    @Builder.Default
    private final boolean weightCalibrationEnabled = false;
    @Builder.Default
    private final double conflictPenalty = DEFAULT_CONFLICT_PENALTY;
    @Builder.Default
    private final double supportBonus = DEFAULT_SUPPORT_BONUS;
    /** Signals shorter than this are reported as too short for windowed methods. */
    @Builder.Default
    private final int shortSignalLength = DEFAULT_SHORT_SIGNAL_LENGTH;

    @Builder.Default
    private final Set<DetectionMethod> enabledMethods = EnumSet.allOf(DetectionMethod.class);
    @Builder.Default
    private final boolean parallelExecutionEnabled = true;
    @Builder.Default
    private final int threadPoolSize = DEFAULT_THREAD_POOL_SIZE;

    /**
     * @return a configuration with every default
     */
    public static EnsembleConfig defaults() {
        return builder().build();
    }

    /**
     * @return the enabled methods in canonical order
     */
    public Set<DetectionMethod> getEnabledMethods() {
        return Collections.unmodifiableSet(enabledMethods.isEmpty() ? EnumSet.noneOf(DetectionMethod.class)
                : EnumSet.copyOf(enabledMethods));
    }

    public Set<DetectionMethod> getCorroborationRequired() {
        return Collections.unmodifiableSet(corroborationRequired.isEmpty() ? EnumSet.noneOf(DetectionMethod.class)
                : EnumSet.copyOf(corroborationRequired));
    }

    public boolean isEnabled(DetectionMethod method) {
        return enabledMethods.contains(method);
    }

    /**
     * Fails fast on an inconsistent configuration.
     *
     * @throws IllegalArgumentException if any value is out of range
     */
    public void validate() {
        checkPositive(zScoreThreshold, "zScoreThreshold must be positive");
        checkPositive(iqrMultiplier, "iqrMultiplier must be positive");
        checkPositive(madThreshold, "madThreshold must be positive");

        checkArgument(flatTolerance >= 0, "flatTolerance must be non-negative");
        checkArgument(flatMinLength >= 2, "flatMinLength must be at least 2");
        checkPositive(oscillationStdMultiplier, "oscillationStdMultiplier must be positive");
        checkArgument(trendWindow >= 2, "trendWindow must be at least 2");
        checkPositive(trendChangeThreshold, "trendChangeThreshold must be positive");
        checkFraction(autocorrPeakHeightRatio, "autocorrPeakHeightRatio must be in [0, 1]");
        checkArgument(autocorrMaxLag >= 3, "autocorrMaxLag must be at least 3");
        checkArgument(autocorrMaxPeaks >= 0, "autocorrMaxPeaks must be non-negative");
        checkArgument(minLengthForPattern >= 3, "minLengthForPattern must be at least 3");
        checkArgument(minLengthForPeriodicity > autocorrMaxLag,
                "minLengthForPeriodicity must be larger than autocorrMaxLag");

        checkFraction(signalHighFrequencyRatio, "signalHighFrequencyRatio must be in [0, 1]");
        checkFraction(windowHighFrequencyRatio, "windowHighFrequencyRatio must be in [0, 1]");
        checkArgument(highFrequencyCutoff > 0 && highFrequencyCutoff < 1, "highFrequencyCutoff must be in (0, 1)");
        checkArgument(frequencyWindowSize >= 4, "frequencyWindowSize must be at least 4");
        checkArgument(minHighFrequencyAmplitude >= 0, "minHighFrequencyAmplitude must be non-negative");
        checkFraction(periodicPeakHeightRatio, "periodicPeakHeightRatio must be in [0, 1]");
        checkArgument(periodicPeakDominance >= 1, "periodicPeakDominance must be at least 1");
        checkArgument(minPeriod >= 2 && minPeriod <= maxPeriod, "period band must satisfy 2 <= minPeriod <= maxPeriod");
        checkArgument(minLengthForFrequency >= frequencyWindowSize,
                "minLengthForFrequency must be at least frequencyWindowSize");

        checkArgument(contamination > 0 && contamination < 0.5, "contamination must be in (0, 0.5)");
        checkArgument(densityNeighbors >= 1, "densityNeighbors must be at least 1");
        checkArgument(minLengthForDensity >= 6, "minLengthForDensity must be at least 6");
        checkArgument(minOutlierFactor >= 0, "minOutlierFactor must be non-negative");

        checkArgument(absoluteMin < extremeMin && extremeMin < extremeMax && extremeMax < absoluteMax,
                "physiological limits must satisfy absoluteMin < extremeMin < extremeMax < absoluteMax");
        checkPositive(maxRateOfChange, "maxRateOfChange must be positive");
        checkArgument(sustainedLow < sustainedHigh, "sustainedLow must be below sustainedHigh");
        checkArgument(sustainedHighMinLength >= 1 && sustainedLowMinLength >= 1,
                "sustained run lengths must be positive");
        checkFraction(repeatedValueRatio, "repeatedValueRatio must be in [0, 1]");
        checkArgument(repeatedValueMinCount >= 1, "repeatedValueMinCount must be positive");

        checkArgument(minIntervalMinutes >= 0 && minIntervalMinutes < maxIntervalMinutes,
                "interval band must satisfy 0 <= minIntervalMinutes < maxIntervalMinutes");
        checkArgument(predictionWindow >= 1, "predictionWindow must be positive");
        checkPositive(predictionErrorThreshold, "predictionErrorThreshold must be positive");
        checkArgument(localWindow >= 1, "localWindow must be positive");
        checkPositive(localZThreshold, "localZThreshold must be positive");
        checkArgument(minLengthForLocalZ >= 2, "minLengthForLocalZ must be at least 2");
        checkPositive(nominalIntervalMinutes, "nominalIntervalMinutes must be positive");

        checkNotNull(contextProfile, "contextProfile must not be null");
        checkArgument(neighborhoodRadius >= 1, "neighborhoodRadius must be positive");
        checkArgument(stableStd >= 0 && stableStd < unstableStd, "stableStd must be below unstableStd");
        checkPositive(stableMultiplier, "stableMultiplier must be positive");
        checkPositive(unstableMultiplier, "unstableMultiplier must be positive");

        checkArgument(normalBandLow < normalBandHigh, "normal band must be non-empty");
        checkPositive(normalBandStatisticalMultiplier, "normalBandStatisticalMultiplier must be positive");
        checkArgument(nightStartHour >= 0 && nightStartHour < 24 && nightEndHour >= 0 && nightEndHour < 24,
                "night hours must be in [0, 23]");
        checkPositive(nightPatternMultiplier, "nightPatternMultiplier must be positive");
        checkPositive(physiologicalBoost, "physiologicalBoost must be positive");
        checkPositive(corroborationMultiplier, "corroborationMultiplier must be positive");

        checkNotNull(methodWeights, "methodWeights must not be null");
        checkArgument(scoreFloor >= 0, "scoreFloor must be non-negative");
        checkArgument(mediumTierMethods >= 2 && mediumTierMethods < highTierMethods,
                "tier thresholds must satisfy 2 <= mediumTierMethods < highTierMethods");
        checkNotNull(corroborationRequired, "corroborationRequired must not be null");

        checkFraction(supportThreshold, "supportThreshold must be in [0, 1]");
        checkFraction(conflictThreshold, "conflictThreshold must be in [0, 1]");
        checkArgument(conflictThreshold < supportThreshold, "conflictThreshold must be below supportThreshold");
        checkArgument(minConflictCount >= 1, "minConflictCount must be positive");
        checkNotNull(expectedRelationships, "expectedRelationships must not be null");
        checkPositive(conflictPenalty, "conflictPenalty must be positive");
        checkPositive(supportBonus, "supportBonus must be positive");
        checkArgument(shortSignalLength >= 1, "shortSignalLength must be positive");

        checkNotNull(enabledMethods, "enabledMethods must not be null");
        checkArgument(threadPoolSize >= 1, "threadPoolSize must be positive");
    }
}
