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

package com.amazon.anomalyensemble.statistics;

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * One-sided power spectrum of a mean-removed real series. The transform is a
 * direct discrete Fourier transform, so series of any length are supported at
 * quadratic cost; the series handled here are short windows or single days of
 * readings.
 */
public class PowerSpectrum {

    private final int length;

    private final double[] power;

    private final double variance;

    private PowerSpectrum(int length, double[] power, double variance) {
        this.length = length;
        this.power = power;
        this.variance = variance;
    }

    /**
     * @param values the series
     * @param from   first position, inclusive
     * @param to     last position, exclusive
     * @return the spectrum of values[from, to)
     */
    public static PowerSpectrum of(double[] values, int from, int to) {
        int n = to - from;
        checkArgument(n >= 2, "a spectrum needs at least two points");
        double mean = Statistics.mean(values, from, to);
        double[] centered = new double[n];
        double sumOfSquares = 0;
        for (int t = 0; t < n; t++) {
            centered[t] = values[from + t] - mean;
            sumOfSquares += centered[t] * centered[t];
        }
        double[] power = new double[n / 2 + 1];
        for (int k = 0; k < power.length; k++) {
            double re = 0;
            double im = 0;
            for (int t = 0; t < n; t++) {
                double angle = 2 * Math.PI * k * t / n;
                re += centered[t] * Math.cos(angle);
                im -= centered[t] * Math.sin(angle);
            }
            power[k] = re * re + im * im;
        }
        return new PowerSpectrum(n, power, sumOfSquares / n);
    }

    public static PowerSpectrum of(double[] values) {
        return of(values, 0, values.length);
    }

    /**
     * @return number of bins, from frequency 0 to the Nyquist frequency
     */
    public int getBinCount() {
        return power.length;
    }

    public double getPower(int bin) {
        return power[bin];
    }

    public double[] getPowers() {
        return Arrays.copyOf(power, power.length);
    }

    /**
     * @param bin a bin other than 0
     * @return the period of the bin, in samples
     */
    public double getPeriod(int bin) {
        checkArgument(bin > 0 && bin < power.length, "bin out of range");
        return (double) length / bin;
    }

    /**
     * Total power over all bins except the zero-frequency bin.
     */
    public double getTotalPower() {
        double total = 0;
        for (int k = 1; k < power.length; k++) {
            total += power[k];
        }
        return total;
    }

    /**
     * @param cutoff start of the band as a fraction of the Nyquist frequency
     * @return the first bin at or above the cutoff
     */
    public int getCutoffBin(double cutoff) {
        return Math.max(1, (int) Math.ceil(cutoff * length / 2.0));
    }

    /**
     * @param cutoff start of the band as a fraction of the Nyquist frequency
     * @return share of the total power above the cutoff
     * @throws NumericDegeneracyException if the series is constant
     */
    public double getHighFrequencyFraction(double cutoff) {
        double total = getTotalPower();
        if (total == 0) {
            throw new NumericDegeneracyException("constant series has no spectral energy");
        }
        double high = 0;
        for (int k = getCutoffBin(cutoff); k < power.length; k++) {
            high += power[k];
        }
        return high / total;
    }

    /**
     * Root mean square amplitude carried by the band above the cutoff, obtained
     * by apportioning the series variance by the band's share of the power.
     *
     * @param cutoff start of the band as a fraction of the Nyquist frequency
     * @return the amplitude, in the units of the series
     */
    public double getHighFrequencyAmplitude(double cutoff) {
        return Math.sqrt(getHighFrequencyFraction(cutoff) * variance);
    }

    /**
     * @return the population variance of the series
     */
    public double getVariance() {
        return variance;
    }

    public int getLength() {
        return length;
    }
}
