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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Descriptive statistics shared by the detectors and the scorers. Standard
 * deviations are population deviations and percentiles interpolate linearly
 * between order statistics.
 */
public final class Statistics {

    /** Consistency constant that scales a MAD score to a standard normal score. */
    public static final double MAD_SCALE = 0.6745;

    private Statistics() {
    }

    public static double mean(double[] values) {
        checkArgument(values.length > 0, "values must not be empty");
        return new Mean().evaluate(values);
    }

    public static double mean(double[] values, int from, int to) {
        checkArgument(from < to, "range must not be empty");
        return new Mean().evaluate(values, from, to - from);
    }

    public static double standardDeviation(double[] values) {
        checkArgument(values.length > 0, "values must not be empty");
        return new StandardDeviation(false).evaluate(values);
    }

    public static double standardDeviation(double[] values, int from, int to) {
        checkArgument(from < to, "range must not be empty");
        return new StandardDeviation(false).evaluate(values, from, to - from);
    }

    public static double median(double[] values) {
        checkArgument(values.length > 0, "values must not be empty");
        return new Median().evaluate(values);
    }

    /**
     * @param values the sample
     * @param p      percentile in (0, 100]
     * @return the linearly interpolated percentile
     */
    public static double percentile(double[] values, double p) {
        checkArgument(values.length > 0, "values must not be empty");
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, p);
    }

    /**
     * @param values the sample
     * @return the median absolute deviation from the median
     */
    public static double medianAbsoluteDeviation(double[] values) {
        double median = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    /**
     * @param values the sample
     * @return the absolute standard score of every value
     * @throws NumericDegeneracyException if the sample has zero variance
     */
    public static double[] absoluteZScores(double[] values) {
        double mean = mean(values);
        double std = standardDeviation(values);
        if (std == 0) {
            throw new NumericDegeneracyException("zero variance, z-score undefined");
        }
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = Math.abs(values[i] - mean) / std;
        }
        return result;
    }

    /**
     * Modified z-scores based on the median absolute deviation.
     *
     * @param values the sample
     * @return the absolute modified score of every value
     * @throws NumericDegeneracyException if the median absolute deviation is zero
     */
    public static double[] absoluteMadScores(double[] values) {
        double median = median(values);
        double mad = medianAbsoluteDeviation(values);
        if (mad == 0) {
            throw new NumericDegeneracyException("zero median absolute deviation");
        }
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = Math.abs(MAD_SCALE * (values[i] - median) / mad);
        }
        return result;
    }

    /**
     * Least squares slope of y against x over the range [from, to).
     *
     * @param x    abscissae, for instance minutes since the first sample
     * @param y    ordinates
     * @param from first position, inclusive
     * @param to   last position, exclusive
     * @return the slope; 0 if all abscissae coincide
     */
    public static double slope(double[] x, double[] y, int from, int to) {
        checkArgument(to - from >= 2, "a slope needs at least two points");
        SimpleRegression regression = new SimpleRegression();
        for (int i = from; i < to; i++) {
            regression.addData(x[i], y[i]);
        }
        double slope = regression.getSlope();
        return Double.isNaN(slope) ? 0 : slope;
    }

    /**
     * Normalized autocorrelation of the mean-removed series for lags 0 to
     * maxLag - 1; the value at lag 0 is 1.
     *
     * @param values the series
     * @param maxLag number of lags to compute
     * @return the autocorrelation by lag
     * @throws NumericDegeneracyException if the series is constant
     */
    public static double[] autocorrelation(double[] values, int maxLag) {
        int n = values.length;
        double mean = mean(values);
        double[] centered = new double[n];
        for (int i = 0; i < n; i++) {
            centered[i] = values[i] - mean;
        }
        int lags = Math.min(maxLag, n);
        double[] result = new double[lags];
        for (int lag = 0; lag < lags; lag++) {
            double sum = 0;
            for (int i = 0; i + lag < n; i++) {
                sum += centered[i] * centered[i + lag];
            }
            result[lag] = sum;
        }
        if (result[0] == 0) {
            throw new NumericDegeneracyException("constant series has no autocorrelation");
        }
        double zeroLag = result[0];
        for (int lag = 0; lag < lags; lag++) {
            result[lag] /= zeroLag;
        }
        return result;
    }

    /**
     * Local maxima of values in [from, to) whose height is at least minHeight.
     * The first and last position of the range are never peaks. A flat top
     * reports its middle position.
     *
     * @param values    the series
     * @param from      first position, inclusive
     * @param to        last position, exclusive
     * @param minHeight lowest height a peak may have
     * @return the peak positions in ascending order
     */
    public static List<Integer> localPeaks(double[] values, int from, int to, double minHeight) {
        List<Integer> peaks = new ArrayList<>();
        int i = from + 1;
        while (i < to - 1) {
            if (values[i] > values[i - 1]) {
                int ahead = i + 1;
                while (ahead < to - 1 && values[ahead] == values[i]) {
                    ahead++;
                }
                if (values[ahead] < values[i]) {
                    int peak = (i + ahead - 1) / 2;
                    if (values[peak] >= minHeight) {
                        peaks.add(peak);
                    }
                    i = ahead;
                    continue;
                }
            }
            i++;
        }
        return peaks;
    }
}
