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

package com.amazon.anomalyensemble.detector;

import java.util.Arrays;
import java.util.List;
import java.util.SortedMap;

import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.signal.Signal;
import com.amazon.anomalyensemble.statistics.PowerSpectrum;
import com.amazon.anomalyensemble.statistics.Statistics;

/**
 * Frequency-domain detector. When the whole signal carries a large share of
 * high-frequency energy, sliding windows are examined and every window whose own
 * high-frequency share is excessive contributes the positions driving that
 * energy. Independently, a spectral peak whose period lies in the configured
 * band flags the positions it repeats at.
 * Raw scores are 1.
 */
@Slf4j
public class FrequencyDetector extends AbstractDetector {

    public static final double RAW_SCORE = 1.0;

    /** Spectral power below this share of the total is rounding noise. */
    public static final double SPECTRAL_TOLERANCE = 1e-9;

    public FrequencyDetector(EnsembleConfig config) {
        super(config);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.FREQUENCY;
    }

    @Override
    public int getMinimumLength() {
        return config.getMinLengthForFrequency();
    }

    @Override
    protected void score(Signal signal, SortedMap<Integer, Double> scores) {
        double[] values = signal.getValues();
        PowerSpectrum spectrum = PowerSpectrum.of(values);
        double cutoff = config.getHighFrequencyCutoff();

        double fraction = spectrum.getHighFrequencyFraction(cutoff);
        if (fraction > config.getSignalHighFrequencyRatio()
                && spectrum.getHighFrequencyAmplitude(cutoff) >= config.getMinHighFrequencyAmplitude()) {
            log.debug("high-frequency share {} triggers the windowed pass", fraction);
            flagNoisyWindows(values, scores);
        }
        flagPeriodicPeaks(values, spectrum, scores);
    }

    void flagNoisyWindows(double[] values, SortedMap<Integer, Double> scores) {
        int n = values.length;
        int size = config.getFrequencyWindowSize();
        int step = Math.max(1, size / 2);
        int lastStart = n - size;
        for (int start = 0; start <= lastStart; start += step) {
            checkWindow(values, start, size, scores);
            if (start < lastStart && start + step > lastStart) {
                checkWindow(values, lastStart, size, scores);
            }
        }
    }

    private void checkWindow(double[] values, int start, int size, SortedMap<Integer, Double> scores) {
        PowerSpectrum window = PowerSpectrum.of(values, start, start + size);
        if (window.getTotalPower() == 0) {
            return;
        }
        double cutoff = config.getHighFrequencyCutoff();
        double amplitude = window.getHighFrequencyAmplitude(cutoff);
        if (window.getHighFrequencyFraction(cutoff) > config.getWindowHighFrequencyRatio()
                && amplitude >= config.getMinHighFrequencyAmplitude()) {
            flagDrivers(values, start, start + size, amplitude, scores);
        }
    }

    /**
     * Flags the positions of a noisy window that carry its high-frequency energy,
     * those whose distance from the window median reaches the high-frequency
     * amplitude. Ordinary readings next to a single excursion stay unflagged.
     */
    void flagDrivers(double[] values, int start, int end, double amplitude, SortedMap<Integer, Double> scores) {
        double median = Statistics.median(Arrays.copyOfRange(values, start, end));
        for (int i = start; i < end; i++) {
            if (Math.abs(values[i] - median) >= amplitude) {
                flag(scores, i, RAW_SCORE);
            }
        }
    }

    void flagPeriodicPeaks(double[] values, PowerSpectrum spectrum, SortedMap<Integer, Double> scores) {
        double[] powers = spectrum.getPowers();
        int end = values.length / 2;
        if (end < 3) {
            return;
        }
        double max = Arrays.stream(powers, 1, end).max().orElse(0);
        if (max <= SPECTRAL_TOLERANCE * spectrum.getTotalPower()) {
            return;
        }
        double median = Statistics.median(Arrays.copyOfRange(powers, 1, end));
        double height = Math.max(config.getPeriodicPeakHeightRatio() * max,
                config.getPeriodicPeakDominance() * median);
        if (height <= 0) {
            return;
        }
        List<Integer> peaks = Statistics.localPeaks(powers, 1, end, height);
        for (int bin : peaks) {
            double period = spectrum.getPeriod(bin);
            if (period >= config.getMinPeriod() && period <= config.getMaxPeriod()) {
                log.debug("spectral peak at bin {} with period {} samples", bin, period);
                flagEvery(values, (int) Math.round(period), RAW_SCORE, scores);
            }
        }
    }
}
